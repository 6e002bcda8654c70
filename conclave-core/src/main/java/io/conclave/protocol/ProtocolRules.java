package io.conclave.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of {@code .conclave/protocols/essential_rules.json}.
 *
 * <p>The governor publishes changes to these rules on {@code protocol.updates}; the hub and the
 * fixer reload the file when one arrives.
 */
public final class ProtocolRules {
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final int DEFAULT_MAX_RULES = 10;

    private final String version;
    private final String created;
    private final boolean repositoryGoalFocus;
    private final int maxRulesLimit;
    private final Map<String, String> rules;
    private final Map<String, Boolean> autoFixPatterns;

    public ProtocolRules(String version, String created, boolean repositoryGoalFocus, int maxRulesLimit,
                         Map<String, String> rules, Map<String, Boolean> autoFixPatterns) {
        this.version = Objects.requireNonNull(version, "version");
        this.created = created == null ? "" : created;
        if (maxRulesLimit < 0) {
            throw new IllegalArgumentException("maxRulesLimit must be >= 0");
        }
        this.repositoryGoalFocus = repositoryGoalFocus;
        this.maxRulesLimit = maxRulesLimit;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.autoFixPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(autoFixPatterns));
    }

    /** Rules set used when no file exists or it cannot be read: no rules, auto-fix disabled. */
    public static ProtocolRules empty() {
        return new ProtocolRules(DEFAULT_VERSION, "", true, DEFAULT_MAX_RULES, Map.of(), Map.of());
    }

    /**
     * The rules written by {@code init}.
     *
     * @param created creation timestamp
     * @return the essential rules
     */
    public static ProtocolRules essential(String created) {
        Map<String, String> rules = new LinkedHashMap<>();
        rules.put("goal_alignment", "Every change must serve the repository goal");
        rules.put("simplicity_first", "Choose simple solutions over complex ones");
        rules.put("user_friendly", "Use clear, understandable language in all communications");
        Map<String, Boolean> autoFix = new LinkedHashMap<>();
        autoFix.put("enabled", true);
        autoFix.put("performance_first", true);
        autoFix.put("escalate_complex", true);
        return new ProtocolRules(DEFAULT_VERSION, created, true, DEFAULT_MAX_RULES, rules, autoFix);
    }

    public String version() {
        return version;
    }

    public String created() {
        return created;
    }

    public boolean repositoryGoalFocus() {
        return repositoryGoalFocus;
    }

    public int maxRulesLimit() {
        return maxRulesLimit;
    }

    public Map<String, String> rules() {
        return rules;
    }

    public Map<String, Boolean> autoFixPatterns() {
        return autoFixPatterns;
    }

    /**
     * @param flag an auto-fix flag such as {@code escalate_complex}
     * @return the flag's value, {@code false} when absent
     */
    public boolean autoFix(String flag) {
        return autoFixPatterns.getOrDefault(flag, false);
    }

    /** Whether more rules are defined than {@link #maxRulesLimit()} allows. */
    public boolean exceedsLimit() {
        return rules.size() > maxRulesLimit;
    }
}
