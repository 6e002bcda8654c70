package io.conclave.bus;

import io.conclave.Role;

import java.util.Optional;

/**
 * The five fixed topic exchanges of a conclave.
 *
 * <p>Three exchanges are <em>privileged</em>: exactly one role may publish to each of them.
 * The other two accept events from every role, with routing keys scoped under the
 * publisher's own id ({@code <roleId>.activity.<type>}, {@code <roleId>.code.<type>}).
 */
public enum Exchange {
    AGENT_ACTIVITIES("agent.activities", "activity", null),
    CODE_CHANGES("code.changes", "code", null),
    PROTOCOL_UPDATES("protocol.updates", "protocol", Role.GOVERNOR),
    GOVERNANCE_REVIEWS("governance.reviews", "governance", Role.AUDITOR),
    FEATURE_INSIGHTS("feature.insights", "feature", Role.INSIGHTS);

    /** Exchange type used for every exchange. */
    public static final String TOPIC = "topic";

    private final String exchangeName;
    private final String segment;
    private final Role publisher;

    Exchange(String exchangeName, String segment, Role publisher) {
        this.exchangeName = exchangeName;
        this.segment = segment;
        this.publisher = publisher;
    }

    public String exchangeName() {
        return exchangeName;
    }

    /**
     * Returns the designated publisher, or empty if every role may publish.
     *
     * @return the only role allowed to publish here, if any
     */
    public Optional<Role> publisher() {
        return Optional.ofNullable(publisher);
    }

    public boolean isPrivileged() {
        return publisher != null;
    }

    /**
     * Builds the routing key for an event of {@code type} published by {@code source}.
     *
     * @param source the publishing role
     * @param type   the event type, e.g. {@code user_prompt}
     * @return the routing key
     */
    public String routingKey(Role source, String type) {
        if (isPrivileged()) {
            return segment + "." + type;
        }
        return source.id() + "." + segment + "." + type;
    }

    /**
     * Wildcard pattern matching every event on this exchange, optionally narrowed to one
     * source role on the open exchanges.
     *
     * @param source the source role, or {@code null} for every source
     * @return the binding pattern
     */
    public String pattern(Role source) {
        if (isPrivileged()) {
            return segment + ".*";
        }
        return (source == null ? "*" : source.id()) + "." + segment + ".*";
    }

    /**
     * Looks up an exchange by its broker name.
     *
     * @param exchangeName the broker-side name, e.g. {@code protocol.updates}
     * @return the matching exchange, or empty
     */
    public static Optional<Exchange> fromName(String exchangeName) {
        for (Exchange exchange : values()) {
            if (exchange.exchangeName.equals(exchangeName)) {
                return Optional.of(exchange);
            }
        }
        return Optional.empty();
    }
}
