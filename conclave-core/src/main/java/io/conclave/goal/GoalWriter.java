package io.conclave.goal;

import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link RepositoryGoal} in the canonical goal file layout.
 *
 * <p>The output stays within the syntax both parser tiers accept: single-line values are
 * double-quoted, multi-line values and list items become {@code |} block scalars, and metadata is written as
 * top-level keys after a {@code # Metadata} marker.
 */
public final class GoalWriter {
    private static final String INDENT = "  ";

    public String write(RepositoryGoal goal) {
        StringBuilder out = new StringBuilder();
        out.append("# Conclave repository goal\n\n");

        out.append("goal:\n");
        field(out, INDENT, "primary", goal.primary());
        field(out, INDENT, "description", goal.description());
        out.append('\n');

        out.append("success_criteria:\n");
        for (String criterion : goal.successCriteria()) {
            out.append(INDENT).append('-');
            value(out, INDENT, criterion);
        }
        out.append('\n');

        section(out, "constraints", goal.constraints());
        section(out, "stakeholders", goal.stakeholders());

        out.append("scope:\n");
        field(out, INDENT, "included", goal.scope().included());
        field(out, INDENT, "excluded", goal.scope().excluded());
        out.append('\n');

        out.append("# Metadata\n");
        GoalMetadata metadata = goal.metadata();
        field(out, "", "created", metadata.created());
        field(out, "", "last_updated", metadata.lastUpdated());
        field(out, "", "version", metadata.version());
        return out.toString();
    }

    private static void section(StringBuilder out, String name, Map<String, String> entries) {
        out.append(name).append(":\n");
        entries.forEach((key, value) -> field(out, INDENT, key, value));
        out.append('\n');
    }

    private static void field(StringBuilder out, String indent, String key, String value) {
        out.append(indent).append(key).append(':');
        value(out, indent, value);
    }

    private static void value(StringBuilder out, String indent, String value) {
        if (value.indexOf('\n') < 0) {
            out.append(' ').append(quote(value)).append('\n');
            return;
        }
        out.append(" |\n");
        for (String line : List.of(value.split("\n", -1))) {
            if (line.isEmpty()) {
                out.append('\n');
            } else {
                out.append(indent).append(INDENT).append(line).append('\n');
            }
        }
    }

    static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
