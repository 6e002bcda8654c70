package io.conclave.bus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope wrapping a bus message with its routing metadata.
 *
 * <p>The bus enriches a payload into an envelope exactly once, at publish time: the
 * {@code timestamp} and {@code sourceRole} are fixed then and never rewritten afterwards.
 * Each envelope carries a ULID {@code messageId}; since delivery is best-effort and
 * handlers may be invoked again after a broker reconnect, consumers that care about
 * duplicates should key on it.
 *
 * @see EnvelopeCodec
 */
public final class MessageEnvelope {
    private final String messageId;
    private final Instant timestamp;
    private final String sourceRole;
    private final String exchange;
    private final String routingKey;
    private final Map<String, Object> payload;

    private MessageEnvelope(Builder builder) {
        this.messageId = builder.messageId == null ? newMessageId() : builder.messageId;
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.routingKey = Objects.requireNonNull(builder.routingKey, "routingKey");
        if (this.routingKey.isEmpty()) {
            throw new IllegalArgumentException("routingKey cannot be empty");
        }
        this.exchange = builder.exchange == null ? "" : builder.exchange;
        this.sourceRole = builder.sourceRole;
        this.payload = builder.payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    }

    /**
     * Creates a builder for an envelope with the given routing key.
     *
     * @param routingKey the routing key
     * @return a new builder
     */
    public static Builder builder(String routingKey) {
        return new Builder(routingKey);
    }

    public String messageId() {
        return messageId;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns the id of the publishing role, or {@code null} for anonymous publishers.
     *
     * @return the source role id
     */
    public String sourceRole() {
        return sourceRole;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    /**
     * Returns the opaque payload. The bus never inspects it.
     *
     * @return an unmodifiable view of the payload
     */
    public Map<String, Object> payload() {
        return payload;
    }

    /**
     * Returns a payload entry rendered as a string.
     *
     * @param key the payload key
     * @param defaultValue value returned when the key is absent or {@code null}
     * @return the entry as a string
     */
    public String payloadString(String key, String defaultValue) {
        Object value = payload.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    @Override
    public String toString() {
        return "MessageEnvelope{messageId=" + messageId
                + ", exchange=" + exchange
                + ", routingKey=" + routingKey
                + ", sourceRole=" + sourceRole + '}';
    }

    /**
     * Builder for {@link MessageEnvelope}.
     */
    public static final class Builder {
        private final String routingKey;
        private String messageId;
        private Instant timestamp;
        private String sourceRole;
        private String exchange;
        private Map<String, Object> payload;

        private Builder(String routingKey) {
            this.routingKey = routingKey;
        }

        /**
         * Sets a custom message identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID. Set when decoding a received envelope.
         *
         * @param messageId the message identifier
         * @return this builder
         */
        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        /**
         * Sets the publish timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param timestamp the timestamp
         * @return this builder
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceRole(String sourceRole) {
            this.sourceRole = sourceRole;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        /**
         * Sets the payload. The map is copied at build time.
         *
         * @param payload the payload, {@code null} for an empty payload
         * @return this builder
         */
        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Builds an immutable {@link MessageEnvelope}.
         *
         * @return a new envelope
         * @throws NullPointerException     if {@code routingKey} is null
         * @throws IllegalArgumentException if {@code routingKey} is empty
         */
        public MessageEnvelope build() {
            return new MessageEnvelope(this);
        }
    }

    private static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
