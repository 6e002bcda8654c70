package io.conclave.supervisor;

/**
 * Lifecycle status of an {@link AgentProcess}.
 *
 * <pre>
 * PENDING --spawned--&gt; RUNNING --stopAll--&gt; STOPPED
 *    |
 *    +--spawn error / missing command--&gt; FAILED
 * </pre>
 */
public enum ProcessStatus {
    PENDING,
    RUNNING,
    STOPPED,
    FAILED;

    boolean canTransitionTo(ProcessStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == FAILED;
            case RUNNING:
                return next == STOPPED;
            default:
                return false;
        }
    }
}
