package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.QueueBinding;
import io.conclave.bus.Topology;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusRoleRouterTest {

    @Test
    void nonDesignatedRolesCannotPublishToPrivilegedExchanges() {
        for (Exchange exchange : Exchange.values()) {
            if (!exchange.isPrivileged()) {
                continue;
            }
            for (Role role : Role.values()) {
                if (exchange.publisher().get() == role) {
                    continue;
                }
                RecordingMessageBus bus = new RecordingMessageBus();
                BusRoleRouter router = new BusRoleRouter(role, bus);

                assertFalse(router.publish(exchange, "anything", Map.of("k", "v")),
                        role.id() + " -> " + exchange.exchangeName());
                assertTrue(bus.published.isEmpty(), "nothing may reach the bus");
            }
        }
    }

    @Test
    void designatedPublisherReachesTheBus() {
        RecordingMessageBus bus = new RecordingMessageBus();
        BusRoleRouter router = new BusRoleRouter(Role.GOVERNOR, bus);

        assertTrue(router.sendProtocolUpdate("rule_added", Map.of("rule", "simplicity_first")));

        RecordingMessageBus.Published sent = bus.published.get(0);
        assertEquals("protocol.updates", sent.exchange());
        assertEquals("protocol.rule_added", sent.routingKey());
        assertEquals("governor", sent.sourceRole());
    }

    @Test
    void everyRoleMayPublishActivitiesUnderItsOwnId() {
        for (Role role : Role.values()) {
            RecordingMessageBus bus = new RecordingMessageBus();
            BusRoleRouter router = new BusRoleRouter(role, bus);

            assertTrue(router.sendActivity("startup", Map.of()));
            assertTrue(router.sendCodeChange("file_modified", Map.of()));

            assertEquals(role.id() + ".activity.startup", bus.published.get(0).routingKey());
            assertEquals(role.id() + ".code.file_modified", bus.published.get(1).routingKey());
        }
    }

    @Test
    void wrongRoleConvenienceSendsAreRejected() {
        RecordingMessageBus bus = new RecordingMessageBus();
        BusRoleRouter router = new BusRoleRouter(Role.HUB, bus);

        assertFalse(router.sendGovernanceReview("review", Map.of()));
        assertFalse(router.sendFeatureInsight("insight", Map.of()));
        assertTrue(bus.published.isEmpty());
    }

    @Test
    void protocolListenerDeclaresRoleScopedQueue() {
        RecordingMessageBus bus = new RecordingMessageBus();
        BusRoleRouter router = new BusRoleRouter(Role.FIXER, bus);

        assertTrue(router.listenForProtocolUpdates(m -> {
        }));

        assertEquals(new QueueBinding("fixer_protocol_updates", "protocol.updates", "protocol.*"), bus.declared.get(0));
        assertTrue(bus.subscriptions.containsKey("fixer_protocol_updates"));
    }

    @Test
    void listenersAreRestrictedToTheirRoles() {
        RecordingMessageBus bus = new RecordingMessageBus();

        assertFalse(new BusRoleRouter(Role.AUDITOR, bus).listenForProtocolUpdates(m -> {
        }));
        assertFalse(new BusRoleRouter(Role.HUB, bus).listenForGovernanceFeedback(m -> {
        }));
        assertTrue(bus.declared.isEmpty());

        assertTrue(new BusRoleRouter(Role.GOVERNOR, bus).listenForGovernanceFeedback(m -> {
        }));
        assertEquals(Topology.defaultQueue(Role.GOVERNOR), bus.declared.get(0));
    }

    @Test
    void activityListenerNarrowsToSource() {
        RecordingMessageBus bus = new RecordingMessageBus();
        BusRoleRouter router = new BusRoleRouter(Role.GOVERNOR, bus);

        assertTrue(router.listenForActivities(Role.FIXER, m -> {
        }));

        QueueBinding binding = bus.declared.get(0);
        assertEquals("governor_fixer_activities", binding.queue());
        assertEquals("fixer.activity.*", binding.pattern());
    }

    @Test
    void defaultQueueListener() {
        RecordingMessageBus bus = new RecordingMessageBus();

        assertTrue(new BusRoleRouter(Role.AUDITOR, bus).listenOnDefaultQueue(m -> {
        }));

        assertEquals("auditor_audits", bus.declared.get(0).queue());
    }

    @Test
    void consumeAndCloseDelegateToBus() {
        RecordingMessageBus bus = new RecordingMessageBus();
        BusRoleRouter router = new BusRoleRouter(Role.HUB, bus);

        assertTrue(router.isOnline());
        router.startConsuming(ConsumeMode.BACKGROUND);
        router.close();

        assertEquals(ConsumeMode.BACKGROUND, bus.consumeCalls.get(0));
        assertEquals(1, bus.closeCalls);
        assertFalse(router.isOnline());
    }
}
