package io.conclave.bus;

import io.conclave.config.BrokerSettings;

import java.util.Map;

/**
 * Publish/subscribe capability over the conclave broker.
 *
 * <p>Two implementations exist: a live one backed by the broker client, and
 * {@link NoopMessageBus}, which is substituted once at construction when the broker cannot be
 * reached. Call sites never branch on which one they hold.
 *
 * <p>No method throws on broker failure. Failures are logged and reported as
 * {@code false} or {@link ConnectionState#DISCONNECTED}.
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Opens the broker connection using bounded connection and handshake timeouts.
     *
     * @param settings broker address, credentials and timeouts
     * @return the resulting state; never throws
     */
    ConnectionState connect(BrokerSettings settings);

    ConnectionState state();

    default boolean isConnected() {
        return state() == ConnectionState.CONNECTED;
    }

    /**
     * Declares every configured exchange as a durable topic exchange and one durable queue per
     * consumer role bound with its wildcard pattern.
     *
     * @return {@code true} if the whole topology was declared
     */
    boolean declareTopology();

    /**
     * Declares and binds a single durable queue.
     *
     * @param binding queue, exchange and pattern
     * @return {@code true} if declared and bound
     */
    boolean declareQueue(QueueBinding binding);

    /**
     * Wraps the payload in a {@link MessageEnvelope} stamped now with {@code sourceRole} and
     * publishes it persistently. A message that cannot be published is logged and dropped,
     * never queued for retry.
     *
     * @param exchange   the exchange name
     * @param routingKey the routing key
     * @param payload    the opaque payload
     * @param sourceRole the publishing role id
     * @return {@code true} if the broker accepted the message
     */
    boolean publish(String exchange, String routingKey, Map<String, Object> payload, String sourceRole);

    /**
     * Registers a handler for a queue. Deliveries are handed to the consumption loop, which
     * only runs after {@link #startConsuming(ConsumeMode)}.
     *
     * @param queue   the queue name
     * @param handler invoked once per delivered message
     * @param role    the subscribing role id, used in the consumer tag
     * @return {@code true} if the subscription was registered
     */
    boolean subscribe(String queue, MessageHandler handler, String role);

    /**
     * Starts the single consumption loop of this bus.
     *
     * @param mode {@link ConsumeMode#BLOCKING} to run on the caller's thread until
     *             {@link #close()} or interruption, {@link ConsumeMode#BACKGROUND} to run on a
     *             daemon thread and return immediately
     * @return {@code false} if disconnected or a loop is already active
     */
    boolean startConsuming(ConsumeMode mode);

    /**
     * Stops consumption and closes the connection. Idempotent.
     */
    @Override
    void close();
}
