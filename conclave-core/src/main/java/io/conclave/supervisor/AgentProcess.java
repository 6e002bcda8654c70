package io.conclave.supervisor;

import io.conclave.Role;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One supervised agent process. Owned by the {@link ProcessSupervisor} that created it.
 */
public final class AgentProcess {
    private final Role role;
    private final String title;
    private final List<String> command;
    private ProcessStatus status = ProcessStatus.PENDING;
    private long pid = -1;
    private Instant startedAt;
    private String failureReason;

    AgentProcess(Role role, String title, List<String> command) {
        this.role = Objects.requireNonNull(role, "role");
        this.title = Objects.requireNonNull(title, "title");
        this.command = command == null ? List.of() : List.copyOf(command);
    }

    public Role role() {
        return role;
    }

    public String title() {
        return title;
    }

    public List<String> command() {
        return command;
    }

    public synchronized ProcessStatus status() {
        return status;
    }

    public synchronized OptionalLong pid() {
        return pid < 0 ? OptionalLong.empty() : OptionalLong.of(pid);
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized String failureReason() {
        return failureReason;
    }

    synchronized void markRunning(long pid, Instant startedAt) {
        transition(ProcessStatus.RUNNING);
        this.pid = pid;
        this.startedAt = startedAt;
    }

    synchronized void markFailed(String reason) {
        transition(ProcessStatus.FAILED);
        this.failureReason = reason;
    }

    synchronized void markStopped() {
        transition(ProcessStatus.STOPPED);
    }

    private void transition(ProcessStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(role.id() + ": illegal transition " + status + " -> " + next);
        }
        status = next;
    }

    @Override
    public synchronized String toString() {
        return "AgentProcess{role=" + role.id() + ", status=" + status + (pid < 0 ? "" : ", pid=" + pid) + '}';
    }
}
