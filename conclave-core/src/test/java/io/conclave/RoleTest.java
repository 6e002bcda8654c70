package io.conclave;

import io.conclave.bus.ConsumeMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RoleTest {

    @Test
    void resolvesByIdOrNameIgnoringCase() {
        assertEquals(Role.GOVERNOR, Role.fromId("governor"));
        assertEquals(Role.INSIGHTS, Role.fromId("INSIGHTS"));
        assertEquals(Role.HUB, Role.fromId(" Hub "));
    }

    @Test
    void unknownRoleThrows() {
        assertThrows(IllegalArgumentException.class, () -> Role.fromId("window_a"));
    }

    @Test
    void onlyHubConsumesInBackground() {
        for (Role role : Role.values()) {
            ConsumeMode expected = role == Role.HUB ? ConsumeMode.BACKGROUND : ConsumeMode.BLOCKING;
            assertEquals(expected, role.consumeMode(), role.id());
        }
    }
}
