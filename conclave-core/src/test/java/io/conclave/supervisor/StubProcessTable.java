package io.conclave.supervisor;

import io.conclave.spi.ProcessLauncher;
import io.conclave.spi.ProcessSignaller;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fake OS process table: launching allocates a PID, signals remove it.
 */
class StubProcessTable implements ProcessLauncher, ProcessSignaller {
    final List<LaunchSpec> launched = new ArrayList<>();
    final List<Long> terminated = new ArrayList<>();
    final List<Long> killed = new ArrayList<>();
    final Set<Long> alive = new HashSet<>();
    final Set<Long> ignoreTerminate = new HashSet<>();
    final Set<String> failingRoles = new HashSet<>();
    private long nextPid = 1000;

    @Override
    public synchronized long launch(LaunchSpec spec) throws ProcessException {
        if (failingRoles.contains(spec.role().id())) {
            throw new ProcessException("spawn failed for " + spec.role().id());
        }
        launched.add(spec);
        long pid = nextPid++;
        alive.add(pid);
        return pid;
    }

    @Override
    public synchronized void terminate(long pid) throws ProcessException {
        terminated.add(pid);
        if (!alive.contains(pid)) {
            throw new ProcessException("no such process " + pid);
        }
        if (!ignoreTerminate.contains(pid)) {
            alive.remove(pid);
        }
    }

    @Override
    public synchronized void kill(long pid) throws ProcessException {
        killed.add(pid);
        if (!alive.remove(pid)) {
            throw new ProcessException("no such process " + pid);
        }
    }

    @Override
    public synchronized boolean isReachable(long pid) {
        return alive.contains(pid);
    }

    synchronized void killExternally(long pid) {
        alive.remove(pid);
    }
}
