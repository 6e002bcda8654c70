package io.conclave.supervisor;

import io.conclave.spi.ProcessSignaller;

import java.util.Optional;

/**
 * {@link ProcessSignaller} backed by {@link ProcessHandle}: {@code destroy()} for graceful
 * termination, {@code destroyForcibly()} for kill.
 */
public final class OsProcessSignaller implements ProcessSignaller {

    @Override
    public void terminate(long pid) throws ProcessException {
        ProcessHandle handle = find(pid);
        if (!handle.destroy()) {
            throw new ProcessException("Terminate request refused for PID " + pid);
        }
    }

    @Override
    public void kill(long pid) throws ProcessException {
        ProcessHandle handle = find(pid);
        if (!handle.destroyForcibly()) {
            throw new ProcessException("Kill request refused for PID " + pid);
        }
    }

    @Override
    public boolean isReachable(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static ProcessHandle find(long pid) throws ProcessException {
        Optional<ProcessHandle> handle;
        try {
            handle = ProcessHandle.of(pid);
        } catch (SecurityException e) {
            throw new ProcessException("Not permitted to signal PID " + pid, e);
        }
        if (handle.isEmpty() || !handle.get().isAlive()) {
            throw new ProcessException("No running process with PID " + pid);
        }
        return handle.get();
    }
}
