package io.conclave.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads that run consumption loops and broker client callbacks.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, and so on. An exception escaping
 * one of them is logged as {@code SEVERE} to this class's logger, which the CLI routes to the
 * run log; agents run detached and have no console to print a stack trace to.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
            logger.log(Level.SEVERE, "Uncaught exception on " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, prefix + sequence.incrementAndGet());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return worker;
    }
}
