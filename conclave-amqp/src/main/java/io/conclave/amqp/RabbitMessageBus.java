package io.conclave.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.conclave.bus.ConnectionState;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.ConsumptionLoop;
import io.conclave.bus.EnvelopeCodec;
import io.conclave.bus.Exchange;
import io.conclave.bus.InboundDelivery;
import io.conclave.bus.MessageBus;
import io.conclave.bus.MessageEnvelope;
import io.conclave.bus.MessageHandler;
import io.conclave.bus.QueueBinding;
import io.conclave.bus.Topology;
import io.conclave.config.BrokerSettings;
import io.conclave.spi.BusMetrics;
import io.conclave.util.DaemonThreadFactory;

import java.io.IOException;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MessageBus} on the RabbitMQ Java client.
 *
 * <p>One connection carries two channels: a publish channel guarded by its own lock, and a
 * consume channel used for declarations, subscriptions and acknowledgements. Broker callbacks
 * hand raw deliveries to a {@link ConsumptionLoop}, which runs the handlers and settles each
 * delivery: ack on success, nack without requeue on failure.
 *
 * <p>Automatic connection recovery is off. When the broker connection drops, the bus reports
 * {@link ConnectionState#DISCONNECTED}, later publishes return {@code false}, and the
 * consumption loop stops so a blocking agent can exit.
 *
 * <p>Create instances via {@link #builder()} and open them with {@link #connect(BrokerSettings)},
 * or use {@link MessageBuses#open(BrokerSettings, BusMetrics, String)}.
 */
public final class RabbitMessageBus implements MessageBus {
    private static final String CONTENT_TYPE = "application/json";
    private static final int PERSISTENT = 2;
    private static final int CLOSE_TIMEOUT_MS = 2000;

    private final Logger logger;
    private final BusMetrics metrics;
    private final EnvelopeCodec codec;
    private final ConsumptionLoop loop;
    private final String connectionName;
    private final Supplier<ConnectionFactory> connectionFactory;
    private final Object publishLock = new Object();
    private final Object consumeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile BrokerSettings settings;
    private volatile ExecutorService callbackExecutor;
    private volatile Connection connection;
    private volatile Channel publishChannel;
    private volatile Channel consumeChannel;

    private RabbitMessageBus(Builder builder) {
        this.connectionName = builder.connectionName;
        this.connectionFactory = builder.connectionFactory;
        this.logger = Logger.getLogger(RabbitMessageBus.class.getName() + "." + connectionName);
        this.metrics = builder.metrics != null ? builder.metrics : BusMetrics.NOOP;
        this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
        this.loop = ConsumptionLoop.builder(connectionName)
                .bufferCapacity(builder.bufferCapacity)
                .codec(codec)
                .metrics(metrics)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public synchronized ConnectionState connect(BrokerSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (closed.get()) {
            logger.warning("Bus is closed; not connecting");
            return ConnectionState.DISCONNECTED;
        }
        if (isConnected()) {
            return ConnectionState.CONNECTED;
        }
        this.settings = settings;
        ConnectionFactory factory = connectionFactory.get();
        factory.setHost(settings.host());
        factory.setPort(settings.port());
        factory.setVirtualHost(settings.virtualHost());
        factory.setUsername(settings.username());
        factory.setPassword(settings.password());
        factory.setConnectionTimeout(settings.connectionTimeoutMs());
        factory.setHandshakeTimeout(settings.handshakeTimeoutMs());
        factory.setChannelRpcTimeout(settings.rpcTimeoutMs());
        factory.setRequestedHeartbeat(settings.heartbeatSeconds());
        factory.setShutdownTimeout(CLOSE_TIMEOUT_MS);
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        factory.setThreadFactory(new DaemonThreadFactory("conclave-amqp-io-"));

        ExecutorService executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("conclave-amqp-callback-"));
        Connection newConnection = null;
        try {
            newConnection = factory.newConnection(executor, connectionName);
            Channel publish = newConnection.createChannel();
            Channel consume = newConnection.createChannel();
            consume.basicQos(settings.prefetchCount());
            newConnection.addShutdownListener(this::onShutdown);
            this.callbackExecutor = executor;
            this.connection = newConnection;
            this.publishChannel = publish;
            this.consumeChannel = consume;
            logger.info("Connected to broker " + settings);
            return ConnectionState.CONNECTED;
        } catch (IOException | TimeoutException | RuntimeException e) {
            logger.log(Level.WARNING, "Broker unreachable at " + settings.host() + ":" + settings.port(), e);
            if (newConnection != null) {
                newConnection.abort(CLOSE_TIMEOUT_MS);
            }
            executor.shutdownNow();
            return ConnectionState.DISCONNECTED;
        }
    }

    private void onShutdown(ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            return;
        }
        logger.warning("Broker connection lost: " + cause.getMessage());
        loop.close();
    }

    @Override
    public ConnectionState state() {
        Connection current = connection;
        Channel publish = publishChannel;
        if (current != null && current.isOpen() && publish != null && publish.isOpen()) {
            return ConnectionState.CONNECTED;
        }
        return ConnectionState.DISCONNECTED;
    }

    @Override
    public boolean declareTopology() {
        BrokerSettings current = settings;
        if (!isConnected() || current == null) {
            logger.warning("Not connected; cannot declare topology");
            return false;
        }
        Topology topology = Topology.forExchanges(current.exchanges());
        try {
            synchronized (consumeLock) {
                for (Map.Entry<String, String> exchange : topology.exchanges().entrySet()) {
                    consumeChannel.exchangeDeclare(exchange.getKey(), exchange.getValue(), true);
                }
            }
        } catch (IOException | AlreadyClosedException e) {
            logger.log(Level.WARNING, "Failed to declare exchanges", e);
            return false;
        }
        boolean declared = true;
        for (QueueBinding binding : topology.bindings()) {
            declared &= declareQueue(binding);
        }
        if (declared) {
            logger.fine("Declared " + topology.exchanges().size() + " exchanges and "
                    + topology.bindings().size() + " queues");
        }
        return declared;
    }

    @Override
    public boolean declareQueue(QueueBinding binding) {
        Objects.requireNonNull(binding, "binding");
        if (!isConnected()) {
            logger.warning("Not connected; cannot declare queue " + binding.queue());
            return false;
        }
        String type = settings.exchanges().getOrDefault(binding.exchange(), Exchange.TOPIC);
        try {
            synchronized (consumeLock) {
                consumeChannel.exchangeDeclare(binding.exchange(), type, true);
                consumeChannel.queueDeclare(binding.queue(), true, false, false, null);
                consumeChannel.queueBind(binding.queue(), binding.exchange(), binding.pattern());
            }
            return true;
        } catch (IOException | AlreadyClosedException e) {
            logger.log(Level.WARNING, "Failed to declare queue " + binding.queue(), e);
            return false;
        }
    }

    @Override
    public boolean publish(String exchange, String routingKey, Map<String, Object> payload, String sourceRole) {
        if (!isConnected()) {
            logger.warning("Not connected; dropping message " + exchange + "/" + routingKey);
            metrics.incrementPublishDropped();
            return false;
        }
        MessageEnvelope envelope = MessageEnvelope.builder(routingKey)
                .exchange(exchange)
                .sourceRole(sourceRole)
                .payload(payload)
                .build();
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .messageId(envelope.messageId())
                .timestamp(Date.from(envelope.timestamp()))
                .appId(sourceRole)
                .build();
        try {
            byte[] body = codec.encode(envelope);
            synchronized (publishLock) {
                publishChannel.basicPublish(exchange, routingKey, properties, body);
            }
            metrics.incrementPublished();
            logger.fine("Published " + envelope);
            return true;
        } catch (IOException | AlreadyClosedException | IllegalArgumentException e) {
            logger.log(Level.WARNING, "Failed to publish " + exchange + "/" + routingKey + "; dropping", e);
            metrics.incrementPublishDropped();
            return false;
        }
    }

    @Override
    public boolean subscribe(String queue, MessageHandler handler, String role) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(handler, "handler");
        if (!isConnected()) {
            logger.warning("Not connected; cannot subscribe to " + queue);
            return false;
        }
        try {
            synchronized (consumeLock) {
                Channel channel = consumeChannel;
                channel.basicConsume(queue, false, role + "-" + queue, new DefaultConsumer(channel) {
                    @Override
                    public void handleDelivery(String consumerTag, Envelope envelope,
                                               AMQP.BasicProperties properties, byte[] body) {
                        loop.offer(new InboundDelivery(queue, body, handler, acknowledger(envelope.getDeliveryTag())));
                    }
                });
            }
            logger.info("Subscribed " + role + " to " + queue);
            return true;
        } catch (IOException | AlreadyClosedException e) {
            logger.log(Level.WARNING, "Failed to subscribe to " + queue, e);
            return false;
        }
    }

    private InboundDelivery.Acknowledger acknowledger(long deliveryTag) {
        return new InboundDelivery.Acknowledger() {
            @Override
            public void ack() throws IOException {
                synchronized (consumeLock) {
                    consumeChannel.basicAck(deliveryTag, false);
                }
            }

            @Override
            public void reject() throws IOException {
                synchronized (consumeLock) {
                    consumeChannel.basicNack(deliveryTag, false, false);
                }
            }
        };
    }

    @Override
    public boolean startConsuming(ConsumeMode mode) {
        if (!isConnected()) {
            logger.warning("Not connected; consumption not started");
            return false;
        }
        return loop.start(mode);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        loop.close();
        Connection current = connection;
        if (current != null) {
            try {
                current.close(CLOSE_TIMEOUT_MS);
            } catch (IOException | AlreadyClosedException e) {
                logger.log(Level.FINE, "Connection already closed", e);
            }
        }
        ExecutorService executor = callbackExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
        logger.fine("Bus closed");
    }

    /** Builder for {@link RabbitMessageBus}. */
    public static final class Builder {
        private String connectionName = "conclave";
        private BusMetrics metrics;
        private EnvelopeCodec codec;
        private int bufferCapacity = 256;
        private Supplier<ConnectionFactory> connectionFactory = ConnectionFactory::new;

        private Builder() {
        }

        /**
         * Sets the client-provided connection name shown by the broker, usually the role id.
         *
         * <p>Optional. Defaults to {@code conclave}.
         *
         * @param connectionName the connection name
         * @return this builder
         */
        public Builder connectionName(String connectionName) {
            this.connectionName = Objects.requireNonNull(connectionName, "connectionName");
            return this;
        }

        public Builder metrics(BusMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Optional. Defaults to {@code 256}; keep it above the broker prefetch count.
         *
         * @param bufferCapacity capacity of the local delivery buffer
         * @return this builder
         */
        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        Builder connectionFactory(Supplier<ConnectionFactory> connectionFactory) {
            this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
            return this;
        }

        public RabbitMessageBus build() {
            return new RabbitMessageBus(this);
        }
    }
}
