package io.conclave.bus;

/**
 * How {@link MessageBus#startConsuming(ConsumeMode)} runs the consumption loop.
 */
public enum ConsumeMode {
    /** Run the loop on the calling thread until the bus is closed or the thread interrupted. */
    BLOCKING,
    /** Run the loop on a daemon thread and return immediately. */
    BACKGROUND
}
