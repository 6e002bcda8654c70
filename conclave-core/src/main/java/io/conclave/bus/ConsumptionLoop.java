package io.conclave.bus;

import io.conclave.spi.BusMetrics;
import io.conclave.util.DaemonThreadFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains a bounded buffer of raw deliveries and invokes their handlers one at a time.
 *
 * <p>Broker client callbacks {@linkplain #offer(InboundDelivery) offer} deliveries; the loop
 * decodes each body, calls the subscribed {@link MessageHandler}, then acknowledges on success
 * or rejects without requeue on a decode failure or handler exception.
 *
 * <p>A loop can be started at most once, either on the caller's thread
 * ({@link ConsumeMode#BLOCKING}) or on a single daemon thread ({@link ConsumeMode#BACKGROUND}).
 * It runs until {@link #close()} or until the running thread is interrupted.
 */
public final class ConsumptionLoop implements AutoCloseable {
    private static final long POLL_TIMEOUT_MS = 50;
    private static final long OFFER_TIMEOUT_MS = 1000;

    private final Logger logger;
    private final BlockingQueue<InboundDelivery> buffer;
    private final EnvelopeCodec codec;
    private final BusMetrics metrics;
    private final long drainTimeoutMs;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService executor;

    private ConsumptionLoop(Builder builder) {
        if (builder.bufferCapacity <= 0) {
            throw new IllegalArgumentException("bufferCapacity must be > 0");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.logger = Logger.getLogger(ConsumptionLoop.class.getName() + "." + builder.name);
        this.buffer = new ArrayBlockingQueue<>(builder.bufferCapacity);
        this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
        this.metrics = builder.metrics != null ? builder.metrics : BusMetrics.NOOP;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Hands a delivery to the loop. Blocks briefly while the buffer is full; a delivery that
     * still does not fit is rejected.
     *
     * @param delivery the raw delivery
     * @return {@code true} if buffered
     */
    public boolean offer(InboundDelivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        boolean buffered;
        try {
            buffered = buffer.offer(delivery, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            buffered = false;
        }
        if (!buffered) {
            logger.warning("Delivery buffer full; dropping message from queue " + delivery.queue());
            reject(delivery);
        }
        metrics.recordBufferedDeliveries(buffer.size());
        return buffered;
    }

    /**
     * Starts the loop.
     *
     * <p>In {@link ConsumeMode#BLOCKING} mode this method returns only after the loop stops.
     *
     * @param mode where to run the loop
     * @return {@code false} if a loop was already started on this instance
     */
    public boolean start(ConsumeMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (!started.compareAndSet(false, true)) {
            logger.warning("Consumption loop already started; ignoring start(" + mode + ")");
            return false;
        }
        running.set(true);
        if (mode == ConsumeMode.BACKGROUND) {
            executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("conclave-consumer-"));
            executor.submit(this::runLoop);
            logger.fine("Consumption loop started in background");
        } else {
            logger.fine("Consumption loop started on " + Thread.currentThread().getName());
            runLoop();
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int bufferedDeliveries() {
        return buffer.size();
    }

    private void runLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                InboundDelivery delivery = buffer.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (delivery == null) {
                    continue;
                }
                process(delivery);
                metrics.recordBufferedDeliveries(buffer.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Consumption loop error", e);
            }
        }
        running.set(false);
        logger.fine("Consumption loop stopped");
    }

    void process(InboundDelivery delivery) {
        MessageEnvelope envelope;
        try {
            envelope = codec.decode(delivery.body());
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "Undecodable message on queue " + delivery.queue() + "; dropping", e);
            reject(delivery);
            return;
        }

        long startNanos = System.nanoTime();
        try {
            delivery.handler().onMessage(envelope);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Handler failed for " + envelope.routingKey()
                    + " (messageId=" + envelope.messageId() + "); dropping", e);
            reject(delivery);
            return;
        } finally {
            metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }

        try {
            delivery.acknowledger().ack();
            metrics.incrementDelivered();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to ack message " + envelope.messageId(), e);
        }
    }

    private void reject(InboundDelivery delivery) {
        metrics.incrementRejected();
        try {
            delivery.acknowledger().reject();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to reject message on queue " + delivery.queue(), e);
        }
    }

    /**
     * Stops the loop. A background loop is given the drain timeout to finish the handler it is
     * running; buffered deliveries that were never handled stay unacknowledged and are
     * redelivered by the broker once the channel closes.
     */
    @Override
    public void close() {
        running.set(false);
        started.set(true);
        ExecutorService current = executor;
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Drain timeout exceeded; interrupting consumer. Buffered: " + buffer.size());
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link ConsumptionLoop}. */
    public static final class Builder {
        private final String name;
        private int bufferCapacity = 256;
        private EnvelopeCodec codec;
        private BusMetrics metrics;
        private long drainTimeoutMs = 2000;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /**
         * Sets the capacity of the delivery buffer.
         *
         * <p>Optional. Defaults to {@code 256}. Must be &gt; 0.
         *
         * @param bufferCapacity maximum buffered deliveries
         * @return this builder
         */
        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder metrics(BusMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets how long {@link #close()} waits for a background loop to stop.
         *
         * <p>Optional. Defaults to {@code 2000} ms.
         *
         * @param drainTimeoutMs the drain timeout
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public ConsumptionLoop build() {
            return new ConsumptionLoop(this);
        }
    }
}
