package io.conclave;

import io.conclave.bus.ConsumeMode;

import java.util.Locale;
import java.util.Objects;

/**
 * The five fixed agent roles that make up a conclave.
 *
 * <p>Each role runs as its own OS process. Only {@link #HUB} talks to a human, so it is the
 * only role that consumes in the {@linkplain ConsumeMode#BACKGROUND background}; every other
 * role spends its whole lifetime in a blocking consumption loop.
 */
public enum Role {
    HUB("hub", "Conclave-Dev-Interactive", ConsumeMode.BACKGROUND),
    FIXER("fixer", "Conclave-QA-Fixer", ConsumeMode.BLOCKING),
    GOVERNOR("governor", "Conclave-Protocol-Manager", ConsumeMode.BLOCKING),
    AUDITOR("auditor", "Conclave-Governance-Auditor", ConsumeMode.BLOCKING),
    INSIGHTS("insights", "Conclave-Feature-Intelligence", ConsumeMode.BLOCKING);

    private final String id;
    private final String title;
    private final ConsumeMode consumeMode;

    Role(String id, String title, ConsumeMode consumeMode) {
        this.id = id;
        this.title = title;
        this.consumeMode = consumeMode;
    }

    /** Stable identifier used in routing keys, queue names and the PID registry. */
    public String id() {
        return id;
    }

    /** Display title of the agent process. */
    public String title() {
        return title;
    }

    public ConsumeMode consumeMode() {
        return consumeMode;
    }

    /**
     * Resolves a role from its {@linkplain #id() id} or enum name, ignoring case.
     *
     * @param value the role id or name
     * @return the matching role
     * @throws IllegalArgumentException if no role matches
     */
    public static Role fromId(String value) {
        Objects.requireNonNull(value, "value");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.id.equals(normalized) || role.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
