package io.conclave.config;

import io.conclave.bus.Topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Broker address, credentials, exchange map and client timeouts.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class BrokerSettings {
    private final String host;
    private final int port;
    private final String virtualHost;
    private final String username;
    private final String password;
    private final Map<String, String> exchanges;
    private final int connectionTimeoutMs;
    private final int handshakeTimeoutMs;
    private final int rpcTimeoutMs;
    private final int prefetchCount;
    private final int heartbeatSeconds;

    private BrokerSettings(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "host");
        this.virtualHost = Objects.requireNonNull(builder.virtualHost, "virtualHost");
        this.username = Objects.requireNonNull(builder.username, "username");
        this.password = Objects.requireNonNull(builder.password, "password");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (builder.port < 1 || builder.port > 65535) {
            throw new IllegalArgumentException("port must be in [1, 65535]");
        }
        if (builder.connectionTimeoutMs <= 0 || builder.handshakeTimeoutMs <= 0 || builder.rpcTimeoutMs <= 0) {
            throw new IllegalArgumentException("Timeouts must be > 0");
        }
        if (builder.prefetchCount <= 0) {
            throw new IllegalArgumentException("prefetchCount must be > 0");
        }
        if (builder.heartbeatSeconds < 0) {
            throw new IllegalArgumentException("heartbeatSeconds must be >= 0");
        }
        this.port = builder.port;
        this.exchanges = Collections.unmodifiableMap(new LinkedHashMap<>(
                builder.exchanges != null ? builder.exchanges : Topology.defaultExchanges()));
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.handshakeTimeoutMs = builder.handshakeTimeoutMs;
        this.rpcTimeoutMs = builder.rpcTimeoutMs;
        this.prefetchCount = builder.prefetchCount;
        this.heartbeatSeconds = builder.heartbeatSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings for a local broker: {@code localhost:5672}, virtual host {@code /},
     * {@code guest}/{@code guest}, the five fixed exchanges.
     *
     * @return default settings
     */
    public static BrokerSettings defaults() {
        return builder().build();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String virtualHost() {
        return virtualHost;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    /** Exchange name to exchange type, in declaration order. */
    public Map<String, String> exchanges() {
        return exchanges;
    }

    public int connectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public int handshakeTimeoutMs() {
        return handshakeTimeoutMs;
    }

    /** Upper bound for any single channel operation, publish included. */
    public int rpcTimeoutMs() {
        return rpcTimeoutMs;
    }

    public int prefetchCount() {
        return prefetchCount;
    }

    public int heartbeatSeconds() {
        return heartbeatSeconds;
    }

    public Builder toBuilder() {
        return builder()
                .host(host)
                .port(port)
                .virtualHost(virtualHost)
                .username(username)
                .password(password)
                .exchanges(exchanges)
                .connectionTimeoutMs(connectionTimeoutMs)
                .handshakeTimeoutMs(handshakeTimeoutMs)
                .rpcTimeoutMs(rpcTimeoutMs)
                .prefetchCount(prefetchCount)
                .heartbeatSeconds(heartbeatSeconds);
    }

    @Override
    public String toString() {
        return "BrokerSettings{" + username + "@" + host + ":" + port + virtualHost + '}';
    }

    /** Builder for {@link BrokerSettings}. */
    public static final class Builder {
        private String host = "localhost";
        private int port = 5672;
        private String virtualHost = "/";
        private String username = "guest";
        private String password = "guest";
        private Map<String, String> exchanges;
        private int connectionTimeoutMs = 5000;
        private int handshakeTimeoutMs = 5000;
        private int rpcTimeoutMs = 10_000;
        private int prefetchCount = 50;
        private int heartbeatSeconds = 60;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder virtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * Sets the exchange map.
         *
         * <p>Optional. Defaults to the five fixed topic exchanges.
         *
         * @param exchanges exchange name to exchange type
         * @return this builder
         */
        public Builder exchanges(Map<String, String> exchanges) {
            this.exchanges = exchanges;
            return this;
        }

        /**
         * Sets the TCP connection timeout.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param connectionTimeoutMs the timeout
         * @return this builder
         */
        public Builder connectionTimeoutMs(int connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
            return this;
        }

        /**
         * Sets the AMQP handshake timeout.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param handshakeTimeoutMs the timeout
         * @return this builder
         */
        public Builder handshakeTimeoutMs(int handshakeTimeoutMs) {
            this.handshakeTimeoutMs = handshakeTimeoutMs;
            return this;
        }

        /**
         * Sets the channel RPC timeout.
         *
         * <p>Optional. Defaults to {@code 10000} ms.
         *
         * @param rpcTimeoutMs the timeout
         * @return this builder
         */
        public Builder rpcTimeoutMs(int rpcTimeoutMs) {
            this.rpcTimeoutMs = rpcTimeoutMs;
            return this;
        }

        /**
         * Sets the number of unacknowledged deliveries the broker may push per consumer.
         *
         * <p>Optional. Defaults to {@code 50}.
         *
         * @param prefetchCount the prefetch limit
         * @return this builder
         */
        public Builder prefetchCount(int prefetchCount) {
            this.prefetchCount = prefetchCount;
            return this;
        }

        public Builder heartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = heartbeatSeconds;
            return this;
        }

        /**
         * @throws NullPointerException     if a required string is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public BrokerSettings build() {
            return new BrokerSettings(this);
        }
    }
}
