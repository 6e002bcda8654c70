package io.conclave.supervisor;

import io.conclave.Role;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to spawn one agent process.
 *
 * @param role             the agent role
 * @param command          executable and arguments
 * @param workingDirectory the target project directory
 * @param environment      variables added to the inherited environment
 * @param outputFile       file receiving stdout and stderr, or {@code null} to discard them
 */
public record LaunchSpec(Role role, List<String> command, Path workingDirectory,
                         Map<String, String> environment, Path outputFile) {
    public LaunchSpec {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        command = List.copyOf(Objects.requireNonNull(command, "command"));
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
