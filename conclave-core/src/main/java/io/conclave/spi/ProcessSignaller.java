package io.conclave.spi;

import io.conclave.supervisor.ProcessException;

/**
 * OS signal-delivery primitive used by the {@link io.conclave.supervisor.ProcessSupervisor}.
 *
 * @see io.conclave.supervisor.OsProcessSignaller
 */
public interface ProcessSignaller {

    /**
     * Requests graceful termination of a process.
     *
     * @param pid the process id
     * @throws ProcessException if the signal cannot be delivered, e.g. the process is gone
     */
    void terminate(long pid) throws ProcessException;

    /**
     * Forcibly kills a process.
     *
     * @param pid the process id
     * @throws ProcessException if the signal cannot be delivered
     */
    void kill(long pid) throws ProcessException;

    /**
     * Returns whether a process can still receive signals.
     *
     * @param pid the process id
     * @return {@code true} if the process exists and has not exited
     */
    boolean isReachable(long pid);
}
