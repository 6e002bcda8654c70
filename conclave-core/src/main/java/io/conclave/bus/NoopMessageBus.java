package io.conclave.bus;

import io.conclave.config.BrokerSettings;
import io.conclave.spi.BusMetrics;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Bus used when no broker is reachable. It is permanently {@link ConnectionState#DISCONNECTED}:
 * every operation returns {@code false} synchronously, and published messages are counted as
 * dropped.
 */
public final class NoopMessageBus implements MessageBus {
    private final Logger logger;
    private final BusMetrics metrics;

    public NoopMessageBus() {
        this(BusMetrics.NOOP);
    }

    public NoopMessageBus(BusMetrics metrics) {
        this.logger = Logger.getLogger(NoopMessageBus.class.getName());
        this.metrics = metrics != null ? metrics : BusMetrics.NOOP;
    }

    @Override
    public ConnectionState connect(BrokerSettings settings) {
        logger.fine("No broker client available; staying disconnected");
        return ConnectionState.DISCONNECTED;
    }

    @Override
    public ConnectionState state() {
        return ConnectionState.DISCONNECTED;
    }

    @Override
    public boolean declareTopology() {
        return false;
    }

    @Override
    public boolean declareQueue(QueueBinding binding) {
        return false;
    }

    @Override
    public boolean publish(String exchange, String routingKey, Map<String, Object> payload, String sourceRole) {
        logger.fine("Not connected; dropping " + exchange + "/" + routingKey);
        metrics.incrementPublishDropped();
        return false;
    }

    @Override
    public boolean subscribe(String queue, MessageHandler handler, String role) {
        logger.fine("Not connected; cannot subscribe to " + queue);
        return false;
    }

    @Override
    public boolean startConsuming(ConsumeMode mode) {
        return false;
    }

    @Override
    public void close() {
    }
}
