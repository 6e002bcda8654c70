package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.MessageHandler;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link RoleRouter} used when no broker is reachable.
 *
 * <p>Sends are logged locally with an {@code [OFFLINE]} prefix and report success; listens
 * register nothing and report success. Permission checks still apply, so a role publishing
 * outside its table gets the same {@code false} it would get online.
 */
public final class OfflineRoleRouter implements RoleRouter {
    private final Role role;
    private final Logger logger;

    public OfflineRoleRouter(Role role) {
        this.role = Objects.requireNonNull(role, "role");
        this.logger = Logger.getLogger(OfflineRoleRouter.class.getName() + "." + role.id());
    }

    @Override
    public Role role() {
        return role;
    }

    @Override
    public boolean publish(Exchange exchange, String type, Map<String, Object> payload) {
        Objects.requireNonNull(exchange, "exchange");
        if (!PublishPermissions.canPublish(role, exchange)) {
            logger.warning("Role " + role.id() + " may not publish to " + exchange.exchangeName());
            return false;
        }
        logger.info("[OFFLINE] " + exchange.exchangeName() + " " + exchange.routingKey(role, type)
                + " " + (payload == null ? "{}" : payload));
        return true;
    }

    @Override
    public boolean listenForProtocolUpdates(MessageHandler handler) {
        logger.fine("[OFFLINE] protocol update listener not registered");
        return true;
    }

    @Override
    public boolean listenForGovernanceFeedback(MessageHandler handler) {
        logger.fine("[OFFLINE] governance feedback listener not registered");
        return true;
    }

    @Override
    public boolean listenForActivities(Role source, MessageHandler handler) {
        logger.fine("[OFFLINE] activity listener for " + source + " not registered");
        return true;
    }

    @Override
    public boolean listenOnDefaultQueue(MessageHandler handler) {
        logger.fine("[OFFLINE] default queue listener not registered");
        return true;
    }

    /**
     * Returns immediately; there is nothing to consume.
     */
    @Override
    public boolean startConsuming(ConsumeMode mode) {
        return true;
    }

    @Override
    public boolean isOnline() {
        return false;
    }

    @Override
    public void close() {
    }
}
