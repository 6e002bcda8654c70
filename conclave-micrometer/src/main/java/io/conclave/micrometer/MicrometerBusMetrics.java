package io.conclave.micrometer;

import io.conclave.spi.BusMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link BusMetrics}.
 *
 * <p>Every meter carries a {@code role} tag so the five agents can share one registry.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code conclave.publish.success}: messages handed to the broker</li>
 *   <li>{@code conclave.publish.dropped}: messages dropped while offline or on publish failure</li>
 *   <li>{@code conclave.delivery.success}: deliveries handled and acknowledged</li>
 *   <li>{@code conclave.delivery.rejected}: deliveries rejected without requeue</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code conclave.delivery.buffered}: deliveries waiting in the local buffer</li>
 *   <li>{@code conclave.handler.duration}: handler execution time</li>
 * </ul>
 */
public final class MicrometerBusMetrics implements BusMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter published;
    private final Counter publishDropped;
    private final Counter delivered;
    private final Counter rejected;
    private final Gauge bufferedGauge;
    private final Timer handlerTimer;

    private final AtomicInteger buffered = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates metrics with the default name prefix {@code "conclave"}.
     *
     * @param registry the Micrometer meter registry
     * @param role     value of the {@code role} tag
     */
    public MicrometerBusMetrics(MeterRegistry registry, String role) {
        this(registry, "conclave", role);
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names
     * @param role       value of the {@code role} tag
     */
    public MicrometerBusMetrics(MeterRegistry registry, String namePrefix, String role) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        Objects.requireNonNull(role, "role");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        Tags tags = Tags.of("role", role);

        this.registry = registry;
        this.published = Counter.builder(namePrefix + ".publish.success")
                .description("Messages handed to the broker")
                .tags(tags)
                .register(registry);
        this.publishDropped = Counter.builder(namePrefix + ".publish.dropped")
                .description("Messages dropped (offline or publish failure)")
                .tags(tags)
                .register(registry);
        this.delivered = Counter.builder(namePrefix + ".delivery.success")
                .description("Deliveries handled and acknowledged")
                .tags(tags)
                .register(registry);
        this.rejected = Counter.builder(namePrefix + ".delivery.rejected")
                .description("Deliveries rejected without requeue")
                .tags(tags)
                .register(registry);
        this.bufferedGauge = Gauge.builder(namePrefix + ".delivery.buffered", buffered, AtomicInteger::get)
                .tags(tags)
                .register(registry);
        this.handlerTimer = Timer.builder(namePrefix + ".handler.duration")
                .description("Message handler execution time")
                .tags(tags)
                .register(registry);
    }

    @Override
    public void incrementPublished() {
        if (closed) return;
        published.increment();
    }

    @Override
    public void incrementPublishDropped() {
        if (closed) return;
        publishDropped.increment();
    }

    @Override
    public void incrementDelivered() {
        if (closed) return;
        delivered.increment();
    }

    @Override
    public void incrementRejected() {
        if (closed) return;
        rejected.increment();
    }

    @Override
    public void recordBufferedDeliveries(int depth) {
        if (closed) return;
        buffered.set(depth);
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerTimer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Removes all meters registered by this instance from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(published, publishDropped, delivered, rejected, bufferedGauge, handlerTimer)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
