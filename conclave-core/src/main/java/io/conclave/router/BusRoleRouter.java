package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.MessageBus;
import io.conclave.bus.MessageHandler;
import io.conclave.bus.QueueBinding;
import io.conclave.bus.Topology;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link RoleRouter} over a connected {@link MessageBus}.
 */
public final class BusRoleRouter implements RoleRouter {
    private final Role role;
    private final MessageBus bus;
    private final Logger logger;

    public BusRoleRouter(Role role, MessageBus bus) {
        this.role = Objects.requireNonNull(role, "role");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.logger = Logger.getLogger(BusRoleRouter.class.getName() + "." + role.id());
    }

    @Override
    public Role role() {
        return role;
    }

    @Override
    public boolean publish(Exchange exchange, String type, Map<String, Object> payload) {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(type, "type");
        if (!PublishPermissions.canPublish(role, exchange)) {
            logger.warning("Role " + role.id() + " may not publish to " + exchange.exchangeName()
                    + "; only " + exchange.publisher().map(Role::id).orElse("any") + " may");
            return false;
        }
        return bus.publish(exchange.exchangeName(), exchange.routingKey(role, type), payload, role.id());
    }

    @Override
    public boolean listenForProtocolUpdates(MessageHandler handler) {
        if (!PublishPermissions.canListenForProtocolUpdates(role)) {
            logger.warning("Role " + role.id() + " may not listen for protocol updates");
            return false;
        }
        Exchange exchange = Exchange.PROTOCOL_UPDATES;
        return listen(new QueueBinding(role.id() + "_protocol_updates",
                exchange.exchangeName(), exchange.pattern(null)), handler);
    }

    @Override
    public boolean listenForGovernanceFeedback(MessageHandler handler) {
        if (!PublishPermissions.canListenForGovernanceFeedback(role)) {
            logger.warning("Role " + role.id() + " may not listen for governance feedback");
            return false;
        }
        return listen(Topology.defaultQueue(role), handler);
    }

    @Override
    public boolean listenForActivities(Role source, MessageHandler handler) {
        Objects.requireNonNull(source, "source");
        Exchange exchange = Exchange.AGENT_ACTIVITIES;
        return listen(new QueueBinding(role.id() + "_" + source.id() + "_activities",
                exchange.exchangeName(), exchange.pattern(source)), handler);
    }

    @Override
    public boolean listenOnDefaultQueue(MessageHandler handler) {
        return listen(Topology.defaultQueue(role), handler);
    }

    private boolean listen(QueueBinding binding, MessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (!bus.declareQueue(binding)) {
            logger.warning("Could not declare queue " + binding.queue());
            return false;
        }
        return bus.subscribe(binding.queue(), handler, role.id());
    }

    @Override
    public boolean startConsuming(ConsumeMode mode) {
        return bus.startConsuming(mode);
    }

    @Override
    public boolean isOnline() {
        return bus.isConnected();
    }

    @Override
    public void close() {
        bus.close();
    }
}
