package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.ConnectionState;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.NoopMessageBus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoleRoutersTest {

    @Test
    void connectedBusGetsBusRouter() {
        RoleRouter router = RoleRouters.forRole(Role.HUB, new RecordingMessageBus());

        assertInstanceOf(BusRoleRouter.class, router);
        assertTrue(router.isOnline());
    }

    @Test
    void disconnectedBusGetsOfflineRouter() {
        RecordingMessageBus bus = new RecordingMessageBus();
        bus.state = ConnectionState.DISCONNECTED;

        RoleRouter router = RoleRouters.forRole(Role.FIXER, bus);

        assertInstanceOf(OfflineRoleRouter.class, router);
        assertFalse(router.isOnline());
    }

    @Test
    void offlineRouterAnswersSynchronously() {
        RoleRouter router = RoleRouters.forRole(Role.HUB, new NoopMessageBus());

        assertTimeoutPreemptively(Duration.ofMillis(500), () -> {
            assertTrue(router.sendActivity("user_prompt", Map.of("prompt", "x")));
            assertTrue(router.sendCodeChange("file_modified", Map.of()));
            assertTrue(router.listenForProtocolUpdates(m -> {
            }));
            assertTrue(router.listenForActivities(Role.FIXER, m -> {
            }));
            assertTrue(router.startConsuming(ConsumeMode.BLOCKING));
        });
    }

    @Test
    void offlineRouterStillAppliesPermissions() {
        RoleRouter router = new OfflineRoleRouter(Role.HUB);

        assertFalse(router.publish(Exchange.PROTOCOL_UPDATES, "rule_added", Map.of()));
        assertTrue(new OfflineRoleRouter(Role.GOVERNOR).publish(Exchange.PROTOCOL_UPDATES, "rule_added", Map.of()));
    }
}
