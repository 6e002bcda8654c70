package io.conclave.goal;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The declared objective of the target repository.
 *
 * <p>{@code primary} is never blank. All string fields are stored stripped of surrounding
 * whitespace, so a block scalar and its single-line equivalent compare equal. Instances are
 * immutable; {@link #withPrimary(String, Clock)} is the only update path and also stamps
 * {@code lastUpdated}.
 */
public final class RepositoryGoal {
    /** Timestamp layout used for {@code created} and {@code last_updated}. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String primary;
    private final String description;
    private final List<String> successCriteria;
    private final Map<String, String> constraints;
    private final Map<String, String> stakeholders;
    private final GoalScope scope;
    private final GoalMetadata metadata;

    private RepositoryGoal(Builder builder) {
        Objects.requireNonNull(builder.primary, "primary");
        this.primary = builder.primary.strip();
        if (primary.isEmpty()) {
            throw new IllegalArgumentException("primary cannot be blank");
        }
        this.description = builder.description == null ? "" : builder.description.strip();
        this.successCriteria = List.copyOf(builder.successCriteria);
        this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constraints));
        this.stakeholders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stakeholders));
        this.scope = builder.scope == null ? GoalScope.EMPTY : builder.scope;
        this.metadata = builder.metadata == null ? new GoalMetadata(null, null, null) : builder.metadata;
    }

    public static Builder builder(String primary) {
        return new Builder(primary);
    }

    public String primary() {
        return primary;
    }

    public String description() {
        return description;
    }

    public List<String> successCriteria() {
        return successCriteria;
    }

    public Map<String, String> constraints() {
        return constraints;
    }

    public Map<String, String> stakeholders() {
        return stakeholders;
    }

    public GoalScope scope() {
        return scope;
    }

    public GoalMetadata metadata() {
        return metadata;
    }

    /**
     * Returns a copy with a new primary objective and {@code lastUpdated} set to the current
     * time of {@code clock}.
     *
     * @param primary the new objective
     * @param clock   source of the update time
     * @return the updated goal
     * @throws IllegalArgumentException if {@code primary} is blank
     */
    public RepositoryGoal withPrimary(String primary, Clock clock) {
        String now = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        return toBuilder()
                .primary(primary)
                .metadata(metadata.withLastUpdated(now))
                .build();
    }

    /**
     * One-line summary of the goal for display.
     *
     * @return primary objective, description, criteria, constraints and exclusions joined by {@code ||}
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        parts.add("PRIMARY GOAL: " + primary);
        if (!description.isEmpty()) {
            parts.add("DESCRIPTION: " + description.replace('\n', ' '));
        }
        if (!successCriteria.isEmpty()) {
            parts.add("SUCCESS CRITERIA: " + String.join(" | ", successCriteria));
        }
        if (!constraints.isEmpty()) {
            List<String> items = new ArrayList<>();
            constraints.forEach((key, value) -> items.add(key.toUpperCase(Locale.ROOT) + ": " + value));
            parts.add("CONSTRAINTS: " + String.join(" | ", items));
        }
        if (scope.hasExclusions()) {
            parts.add("EXCLUDED: " + scope.excluded().replace('\n', ' '));
        }
        return String.join(" || ", parts);
    }

    public Builder toBuilder() {
        return builder(primary)
                .description(description)
                .successCriteria(successCriteria)
                .constraints(constraints)
                .stakeholders(stakeholders)
                .scope(scope)
                .metadata(metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RepositoryGoal)) return false;
        RepositoryGoal that = (RepositoryGoal) o;
        return primary.equals(that.primary)
                && description.equals(that.description)
                && successCriteria.equals(that.successCriteria)
                && constraints.equals(that.constraints)
                && stakeholders.equals(that.stakeholders)
                && scope.equals(that.scope)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primary, description, successCriteria, constraints, stakeholders, scope, metadata);
    }

    @Override
    public String toString() {
        return "RepositoryGoal{primary='" + primary + "'}";
    }

    /** Builder for {@link RepositoryGoal}. */
    public static final class Builder {
        private String primary;
        private String description;
        private final List<String> successCriteria = new ArrayList<>();
        private final Map<String, String> constraints = new LinkedHashMap<>();
        private final Map<String, String> stakeholders = new LinkedHashMap<>();
        private GoalScope scope;
        private GoalMetadata metadata;

        private Builder(String primary) {
            this.primary = primary;
        }

        public Builder primary(String primary) {
            this.primary = primary;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder successCriteria(List<String> successCriteria) {
            this.successCriteria.clear();
            for (String criterion : successCriteria) {
                this.successCriteria.add(Objects.requireNonNull(criterion, "criterion").strip());
            }
            return this;
        }

        public Builder addSuccessCriterion(String criterion) {
            this.successCriteria.add(Objects.requireNonNull(criterion, "criterion").strip());
            return this;
        }

        /**
         * Sets the constraints, in iteration order.
         *
         * @param constraints constraint name to requirement
         * @return this builder
         */
        public Builder constraints(Map<String, String> constraints) {
            this.constraints.clear();
            constraints.forEach(this::constraint);
            return this;
        }

        public Builder constraint(String name, String requirement) {
            this.constraints.put(Objects.requireNonNull(name, "name"),
                    requirement == null ? "" : requirement.strip());
            return this;
        }

        public Builder stakeholders(Map<String, String> stakeholders) {
            this.stakeholders.clear();
            stakeholders.forEach(this::stakeholder);
            return this;
        }

        public Builder stakeholder(String name, String description) {
            this.stakeholders.put(Objects.requireNonNull(name, "name"),
                    description == null ? "" : description.strip());
            return this;
        }

        public Builder scope(GoalScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder metadata(GoalMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code primary} is null
         * @throws IllegalArgumentException if {@code primary} is blank
         */
        public RepositoryGoal build() {
            return new RepositoryGoal(this);
        }
    }
}
