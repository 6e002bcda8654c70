package io.conclave.amqp;

import io.conclave.bus.ConnectionState;
import io.conclave.bus.MessageBus;
import io.conclave.bus.NoopMessageBus;
import io.conclave.config.BrokerSettings;
import io.conclave.spi.BusMetrics;

import java.util.logging.Logger;

/**
 * Opens the bus for an agent, choosing the live or no-op implementation once.
 */
public final class MessageBuses {
    private static final Logger logger = Logger.getLogger(MessageBuses.class.getName());
    private static final int MIN_BUFFER = 256;

    private MessageBuses() {
    }

    /**
     * Connects to the broker and declares the topology. Falls back to a {@link NoopMessageBus}
     * when the broker is unreachable.
     *
     * @param settings       broker settings
     * @param metrics        metrics sink
     * @param connectionName client-provided connection name, usually the role id
     * @return a connected {@link RabbitMessageBus}, or a {@link NoopMessageBus}
     */
    public static MessageBus open(BrokerSettings settings, BusMetrics metrics, String connectionName) {
        RabbitMessageBus bus = RabbitMessageBus.builder()
                .connectionName(connectionName)
                .metrics(metrics)
                .bufferCapacity(Math.max(MIN_BUFFER, settings.prefetchCount() * 2))
                .build();
        if (bus.connect(settings) == ConnectionState.CONNECTED) {
            if (!bus.declareTopology()) {
                logger.warning("Topology declaration incomplete; continuing with declared parts");
            }
            return bus;
        }
        bus.close();
        logger.warning("Broker unavailable; using offline bus");
        return new NoopMessageBus(metrics);
    }
}
