package io.conclave.bus;

import io.conclave.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exchanges and default per-role queues declared by {@link MessageBus#declareTopology()}.
 *
 * <p>Every exchange is a durable topic exchange. Each consumer role owns one durable queue
 * bound with a wildcard pattern:
 * <ul>
 *   <li>{@code hub_activities} &larr; {@code agent.activities} / {@code *.activity.*}</li>
 *   <li>{@code fixer_fixes} &larr; {@code code.changes} / {@code *.code.*}</li>
 *   <li>{@code governor_governance} &larr; {@code governance.reviews} / {@code governance.*}</li>
 *   <li>{@code auditor_audits} &larr; {@code code.changes} / {@code *.code.*}</li>
 *   <li>{@code insights_features} &larr; {@code agent.activities} / {@code *.activity.*}</li>
 * </ul>
 */
public final class Topology {
    private static final Map<Role, QueueBinding> DEFAULT_QUEUES = defaultQueues();

    private final Map<String, String> exchanges;
    private final List<QueueBinding> bindings;

    private Topology(Map<String, String> exchanges, List<QueueBinding> bindings) {
        this.exchanges = Collections.unmodifiableMap(new LinkedHashMap<>(exchanges));
        this.bindings = List.copyOf(bindings);
    }

    /**
     * Returns the five fixed exchanges with the default per-role queues.
     *
     * @return the default topology
     */
    public static Topology defaults() {
        return forExchanges(defaultExchanges());
    }

    /**
     * Builds a topology for a configured exchange map. Default queues whose exchange is not
     * in the map are left out.
     *
     * @param exchanges exchange name to exchange type
     * @return the topology
     */
    public static Topology forExchanges(Map<String, String> exchanges) {
        Objects.requireNonNull(exchanges, "exchanges");
        List<QueueBinding> bindings = new ArrayList<>();
        for (QueueBinding binding : DEFAULT_QUEUES.values()) {
            if (exchanges.containsKey(binding.exchange())) {
                bindings.add(binding);
            }
        }
        return new Topology(exchanges, bindings);
    }

    /**
     * Returns the fixed exchange-name to exchange-type map.
     *
     * @return a new mutable map in declaration order
     */
    public static Map<String, String> defaultExchanges() {
        Map<String, String> exchanges = new LinkedHashMap<>();
        for (Exchange exchange : Exchange.values()) {
            exchanges.put(exchange.exchangeName(), Exchange.TOPIC);
        }
        return exchanges;
    }

    /**
     * Returns the default queue of a consumer role.
     *
     * @param role the consuming role
     * @return its queue binding
     */
    public static QueueBinding defaultQueue(Role role) {
        return DEFAULT_QUEUES.get(role);
    }

    public Map<String, String> exchanges() {
        return exchanges;
    }

    public List<QueueBinding> bindings() {
        return bindings;
    }

    private static Map<Role, QueueBinding> defaultQueues() {
        Map<Role, QueueBinding> queues = new EnumMap<>(Role.class);
        queues.put(Role.HUB, new QueueBinding("hub_activities",
                Exchange.AGENT_ACTIVITIES.exchangeName(), Exchange.AGENT_ACTIVITIES.pattern(null)));
        queues.put(Role.FIXER, new QueueBinding("fixer_fixes",
                Exchange.CODE_CHANGES.exchangeName(), Exchange.CODE_CHANGES.pattern(null)));
        queues.put(Role.GOVERNOR, new QueueBinding("governor_governance",
                Exchange.GOVERNANCE_REVIEWS.exchangeName(), Exchange.GOVERNANCE_REVIEWS.pattern(null)));
        queues.put(Role.AUDITOR, new QueueBinding("auditor_audits",
                Exchange.CODE_CHANGES.exchangeName(), Exchange.CODE_CHANGES.pattern(null)));
        queues.put(Role.INSIGHTS, new QueueBinding("insights_features",
                Exchange.AGENT_ACTIVITIES.exchangeName(), Exchange.AGENT_ACTIVITIES.pattern(null)));
        return Collections.unmodifiableMap(queues);
    }
}
