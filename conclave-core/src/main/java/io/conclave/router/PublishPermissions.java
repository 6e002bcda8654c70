package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.Exchange;

import java.util.EnumSet;
import java.util.Set;

/**
 * The fixed role/exchange permission table.
 */
public final class PublishPermissions {
    private static final Set<Role> PROTOCOL_LISTENERS = EnumSet.of(Role.HUB, Role.FIXER);
    private static final Set<Role> GOVERNANCE_LISTENERS = EnumSet.of(Role.GOVERNOR);

    private PublishPermissions() {
    }

    public static boolean canPublish(Role role, Exchange exchange) {
        return exchange.publisher().map(role::equals).orElse(true);
    }

    public static boolean canListenForProtocolUpdates(Role role) {
        return PROTOCOL_LISTENERS.contains(role);
    }

    public static boolean canListenForGovernanceFeedback(Role role) {
        return GOVERNANCE_LISTENERS.contains(role);
    }
}
