package io.conclave.spi;

/**
 * Observability hook for exporting message bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. The
 * {@code conclave-micrometer} module bridges this interface into Micrometer.
 */
public interface BusMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    BusMetrics NOOP = new Noop();

    /**
     * Increments the count of envelopes handed to the broker.
     */
    void incrementPublished();

    /**
     * Increments the count of envelopes dropped because the bus was disconnected or the
     * broker rejected the publish.
     */
    void incrementPublishDropped();

    /**
     * Increments the count of deliveries handled successfully and acknowledged.
     */
    void incrementDelivered();

    /**
     * Increments the count of deliveries negatively acknowledged without requeue.
     */
    void incrementRejected();

    /**
     * Records the number of deliveries waiting in the local buffer of the consumption loop.
     *
     * @param depth buffered deliveries
     */
    void recordBufferedDeliveries(int depth);

    /**
     * Records the time spent inside a message handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements BusMetrics {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementPublishDropped() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void recordBufferedDeliveries(int depth) {
        }
    }
}
