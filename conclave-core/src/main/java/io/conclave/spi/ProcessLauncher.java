package io.conclave.spi;

import io.conclave.supervisor.LaunchSpec;
import io.conclave.supervisor.ProcessException;

/**
 * OS process-spawn primitive used by the {@link io.conclave.supervisor.ProcessSupervisor}.
 *
 * @see io.conclave.supervisor.OsProcessLauncher
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Spawns a process and returns without waiting for it.
     *
     * @param spec command, working directory and environment of the process
     * @return the PID of the spawned process
     * @throws ProcessException if the process cannot be started
     */
    long launch(LaunchSpec spec) throws ProcessException;
}
