package io.conclave.bus;

import io.conclave.Role;
import io.conclave.config.BrokerSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class NoopMessageBusTest {

    @Test
    void everyOperationReportsNotConnected() {
        NoopMessageBus bus = new NoopMessageBus();

        assertEquals(ConnectionState.DISCONNECTED, bus.connect(BrokerSettings.defaults()));
        assertFalse(bus.isConnected());
        assertFalse(bus.declareTopology());
        assertFalse(bus.declareQueue(Topology.defaultQueue(Role.HUB)));
        assertFalse(bus.subscribe("hub_activities", m -> {
        }, "hub"));
    }

    @Test
    void publishAndConsumeReturnImmediately() {
        NoopMessageBus bus = new NoopMessageBus();

        assertTimeoutPreemptively(Duration.ofMillis(500), () -> {
            assertFalse(bus.publish("agent.activities", "hub.activity.x", Map.of(), "hub"));
            assertFalse(bus.startConsuming(ConsumeMode.BLOCKING));
        });
    }

    @Test
    void closeIsIdempotent() {
        NoopMessageBus bus = new NoopMessageBus();

        bus.close();
        bus.close();

        assertEquals(ConnectionState.DISCONNECTED, bus.state());
    }
}
