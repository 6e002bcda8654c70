package io.conclave.cli;

import io.conclave.Role;
import io.conclave.config.CommunicationConfig;
import io.conclave.spi.LaunchCommandResolver;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the command that runs one agent: the override from the communication config when
 * present, otherwise {@code java io.conclave.cli.ConclaveCommand --project <dir> agent <role>}
 * on the current JVM. The class path is passed through the {@code CLASSPATH} environment.
 */
public final class AgentCommandResolver implements LaunchCommandResolver {
    private final CommunicationConfig config;
    private final Path projectDir;
    private final String javaExecutable;

    public AgentCommandResolver(CommunicationConfig config, Path projectDir, String javaExecutable) {
        this.config = Objects.requireNonNull(config, "config");
        this.projectDir = Objects.requireNonNull(projectDir, "projectDir");
        this.javaExecutable = javaExecutable;
    }

    /**
     * @return the {@code java} launcher of the running JVM, or {@code null} if unknown
     */
    public static String currentJava() {
        return ProcessHandle.current().info().command().orElse(null);
    }

    @Override
    public Optional<List<String>> resolve(Role role) {
        Optional<List<String>> override = config.agent(role).commandOverride();
        if (override.isPresent()) {
            return override;
        }
        if (javaExecutable == null || javaExecutable.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.of(javaExecutable, ConclaveCommand.class.getName(),
                "--project", projectDir.toString(), "agent", role.id()));
    }
}
