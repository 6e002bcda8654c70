package io.conclave.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-agent settings.
 *
 * @param title   display title of the agent process
 * @param command launch command overriding the default one, or an empty list
 */
public record AgentSettings(String title, List<String> command) {
    public AgentSettings {
        Objects.requireNonNull(title, "title");
        command = command == null ? List.of() : List.copyOf(command);
    }

    public Optional<List<String>> commandOverride() {
        return command.isEmpty() ? Optional.empty() : Optional.of(command);
    }
}
