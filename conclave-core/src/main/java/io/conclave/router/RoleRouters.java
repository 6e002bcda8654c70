package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.MessageBus;

import java.util.logging.Logger;

/**
 * Chooses the router implementation for a role once, from the bus state at construction.
 */
public final class RoleRouters {
    private static final Logger logger = Logger.getLogger(RoleRouters.class.getName());

    private RoleRouters() {
    }

    public static RoleRouter forRole(Role role, MessageBus bus) {
        if (bus != null && bus.isConnected()) {
            return new BusRoleRouter(role, bus);
        }
        logger.warning("Broker not connected; " + role.id() + " running in offline mode");
        if (bus != null) {
            bus.close();
        }
        return new OfflineRoleRouter(role);
    }
}
