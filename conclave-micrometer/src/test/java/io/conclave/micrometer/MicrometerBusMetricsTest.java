package io.conclave.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerBusMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerBusMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerBusMetrics(registry, "hub");
    }

    @Test
    void publishCounters() {
        metrics.incrementPublished();
        metrics.incrementPublished();
        metrics.incrementPublishDropped();

        assertEquals(2.0, counter("conclave.publish.success").count());
        assertEquals(1.0, counter("conclave.publish.dropped").count());
    }

    @Test
    void deliveryCounters() {
        metrics.incrementDelivered();
        metrics.incrementRejected();
        metrics.incrementRejected();

        assertEquals(1.0, counter("conclave.delivery.success").count());
        assertEquals(2.0, counter("conclave.delivery.rejected").count());
    }

    @Test
    void bufferedGaugeTracksLatestDepth() {
        metrics.recordBufferedDeliveries(17);
        assertEquals(17.0, gauge("conclave.delivery.buffered").value());

        metrics.recordBufferedDeliveries(0);
        assertEquals(0.0, gauge("conclave.delivery.buffered").value());
    }

    @Test
    void handlerDurationTimer() {
        metrics.recordHandlerDurationMs(40);
        metrics.recordHandlerDurationMs(60);

        Timer timer = registry.find("conclave.handler.duration").tag("role", "hub").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertEquals(100.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void rolesShareRegistryUnderSeparateTags() {
        MicrometerBusMetrics fixer = new MicrometerBusMetrics(registry, "fixer");
        fixer.incrementPublished();
        metrics.incrementPublished();
        metrics.incrementPublished();

        assertEquals(1.0, registry.find("conclave.publish.success").tag("role", "fixer").counter().count());
        assertEquals(2.0, counter("conclave.publish.success").count());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        metrics.incrementPublished();
        metrics.close();
        metrics.incrementPublished();
        metrics.recordBufferedDeliveries(3);

        assertNull(registry.find("conclave.publish.success").counter());
        assertNull(registry.find("conclave.delivery.buffered").gauge());
    }

    @Test
    void invalidPrefixRejected() {
        assertThrows(NullPointerException.class, () -> new MicrometerBusMetrics(null, "hub"));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerBusMetrics(registry, "", "hub"));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerBusMetrics(registry, "conclave.", "hub"));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).tag("role", "hub").counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).tag("role", "hub").gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
