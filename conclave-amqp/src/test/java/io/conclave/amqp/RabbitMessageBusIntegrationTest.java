package io.conclave.amqp;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.MessageBus;
import io.conclave.bus.MessageEnvelope;
import io.conclave.bus.MessageHandler;
import io.conclave.bus.Topology;
import io.conclave.config.BrokerSettings;
import io.conclave.router.BusRoleRouter;
import io.conclave.router.RoleRouter;
import io.conclave.router.RoleRouters;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@RabbitAvailable
@Testcontainers
class RabbitMessageBusIntegrationTest {

    @Container
    static final RabbitMQContainer rabbit = new RabbitMQContainer(RabbitAvailable.IMAGE);

    private static BrokerSettings settings() {
        return BrokerSettings.builder()
                .host(rabbit.getHost())
                .port(rabbit.getAmqpPort())
                .username(rabbit.getAdminUsername())
                .password(rabbit.getAdminPassword())
                .build();
    }

    @Test
    void activityReachesObservingRole() throws Exception {
        BlockingQueue<MessageEnvelope> received = new LinkedBlockingQueue<>();
        try (RoleRouter governor = RoleRouters.forRole(Role.GOVERNOR,
                MessageBuses.open(settings(), new CountingMetrics(), "governor"));
             RoleRouter hub = RoleRouters.forRole(Role.HUB,
                     MessageBuses.open(settings(), new CountingMetrics(), "hub"))) {
            assertInstanceOf(BusRoleRouter.class, governor);
            assertTrue(governor.listenForActivities(Role.HUB, received::add));
            assertTrue(governor.startConsuming(ConsumeMode.BACKGROUND));

            assertTrue(hub.sendActivity("user_prompt", Map.of("prompt", "add retries to the client")));

            MessageEnvelope message = received.poll(10, TimeUnit.SECONDS);
            assertNotNull(message, "activity not delivered");
            assertEquals("hub", message.sourceRole());
            assertEquals("agent.activities", message.exchange());
            assertEquals("add retries to the client", message.payloadString("prompt", null));
        }
    }

    @Test
    void failedHandlerDropsMessageWithoutRedelivery() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        CountingMetrics metrics = new CountingMetrics();
        try (MessageBus fixerBus = MessageBuses.open(settings(), metrics, "fixer");
             MessageBus governorBus = MessageBuses.open(settings(), new CountingMetrics(), "governor")) {
            RoleRouter fixer = RoleRouters.forRole(Role.FIXER, fixerBus);
            RoleRouter governor = RoleRouters.forRole(Role.GOVERNOR, governorBus);
            assertTrue(fixer.listenForProtocolUpdates(message -> {
                seen.add(message.payloadString("rule", ""));
                if ("poison".equals(message.payloadString("rule", ""))) {
                    throw new IllegalStateException("cannot apply rule");
                }
            }));
            assertTrue(fixer.startConsuming(ConsumeMode.BACKGROUND));

            assertTrue(governor.sendProtocolUpdate("rule_added", Map.of("rule", "poison")));
            assertTrue(governor.sendProtocolUpdate("rule_added", Map.of("rule", "max_file_lines")));

            long deadline = System.currentTimeMillis() + 10_000;
            while (seen.size() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            Thread.sleep(500);
            assertEquals(List.of("poison", "max_file_lines"), seen);
            assertEquals(1, metrics.rejected.get());
        }
    }

    @Test
    void privilegedExchangeRejectsOtherRoles() {
        CountingMetrics metrics = new CountingMetrics();
        try (RoleRouter hub = RoleRouters.forRole(Role.HUB, MessageBuses.open(settings(), metrics, "hub"))) {
            assertTrue(hub.isOnline());
            assertFalse(hub.sendProtocolUpdate("rule_added", Map.of("rule", "x")));
            assertFalse(hub.sendGovernanceReview("review", Map.of()));
            assertFalse(hub.listenForGovernanceFeedback(message -> { }));
            assertEquals(0, metrics.published.get());
        }
    }

    @Test
    void defaultQueuesAreDrainedByTheirRoles() throws Exception {
        String marker = "drain-" + System.nanoTime();
        Map<Role, List<String>> seen = new EnumMap<>(Role.class);
        List<RoleRouter> routers = new ArrayList<>();
        try {
            for (Role role : Role.values()) {
                List<String> received = new CopyOnWriteArrayList<>();
                seen.put(role, received);
                RoleRouter router = RoleRouters.forRole(role,
                        MessageBuses.open(settings(), new CountingMetrics(), role.id()));
                routers.add(router);
                MessageHandler handler = message -> received.add(message.payloadString("marker", ""));
                if (role == Role.GOVERNOR) {
                    assertTrue(router.listenForGovernanceFeedback(handler));
                } else {
                    assertTrue(router.listenOnDefaultQueue(handler));
                }
                assertTrue(router.startConsuming(ConsumeMode.BACKGROUND));
            }
            RoleRouter hub = routers.get(Role.HUB.ordinal());
            RoleRouter auditor = routers.get(Role.AUDITOR.ordinal());
            for (int i = 0; i < 3; i++) {
                assertTrue(hub.sendActivity("user_prompt", Map.of("marker", marker)));
            }
            assertTrue(hub.sendCodeChange("refactor", Map.of("marker", marker)));
            assertTrue(auditor.sendGovernanceReview("review", Map.of("marker", marker)));

            Map<Role, Long> expected = new EnumMap<>(Role.class);
            expected.put(Role.HUB, 3L);
            expected.put(Role.INSIGHTS, 3L);
            expected.put(Role.FIXER, 1L);
            expected.put(Role.AUDITOR, 1L);
            expected.put(Role.GOVERNOR, 1L);
            long deadline = System.currentTimeMillis() + 10_000;
            while (!allSeen(seen, expected, marker) && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            assertTrue(allSeen(seen, expected, marker), seen.toString());
            Thread.sleep(500);

            ConnectionFactory factory = new ConnectionFactory();
            factory.setHost(rabbit.getHost());
            factory.setPort(rabbit.getAmqpPort());
            factory.setUsername(rabbit.getAdminUsername());
            factory.setPassword(rabbit.getAdminPassword());
            try (Connection connection = factory.newConnection();
                 Channel channel = connection.createChannel()) {
                for (Role role : Role.values()) {
                    String queue = Topology.defaultQueue(role).queue();
                    assertEquals(0, channel.queueDeclarePassive(queue).getMessageCount(), queue);
                }
            }
        } finally {
            routers.forEach(RoleRouter::close);
        }
    }

    private static boolean allSeen(Map<Role, List<String>> seen, Map<Role, Long> expected, String marker) {
        for (Map.Entry<Role, Long> entry : expected.entrySet()) {
            long count = seen.get(entry.getKey()).stream().filter(marker::equals).count();
            if (count < entry.getValue()) {
                return false;
            }
        }
        return true;
    }
}
