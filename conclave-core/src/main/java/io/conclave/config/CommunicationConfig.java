package io.conclave.config;

import io.conclave.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of {@code .conclave/communication/config.json}: broker settings plus per-agent
 * settings.
 */
public final class CommunicationConfig {
    private final BrokerSettings broker;
    private final Map<Role, AgentSettings> agents;

    public CommunicationConfig(BrokerSettings broker, Map<Role, AgentSettings> agents) {
        this.broker = Objects.requireNonNull(broker, "broker");
        Map<Role, AgentSettings> copy = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            AgentSettings settings = agents == null ? null : agents.get(role);
            copy.put(role, settings != null ? settings : new AgentSettings(role.title(), null));
        }
        this.agents = Collections.unmodifiableMap(copy);
    }

    /**
     * Default configuration: local broker and every agent with its default title and command.
     *
     * @return the defaults
     */
    public static CommunicationConfig defaults() {
        return new CommunicationConfig(BrokerSettings.defaults(), null);
    }

    public BrokerSettings broker() {
        return broker;
    }

    public AgentSettings agent(Role role) {
        return agents.get(role);
    }

    public Map<Role, AgentSettings> agents() {
        return agents;
    }
}
