package io.conclave.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * File layout of a target project managed by conclave.
 *
 * <pre>
 * &lt;project&gt;/
 *   features/
 *   .conclave/
 *     goal.yaml
 *     protocols/essential_rules.json
 *     communication/config.json
 *     communication/pids.json
 *     logs/
 * </pre>
 */
public final class Workspace {
    private final Path projectDir;
    private final Path conclaveDir;

    private Workspace(Path projectDir) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.conclaveDir = this.projectDir.resolve(".conclave");
    }

    public static Workspace of(Path projectDir) {
        return new Workspace(Objects.requireNonNull(projectDir, "projectDir"));
    }

    /**
     * Finds the nearest directory at or above {@code start} that contains {@code .git}.
     *
     * @param start the directory to start from
     * @return the repository root, or empty if there is none
     */
    public static Optional<Path> findProjectRoot(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            if (Files.exists(current.resolve(".git"))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public Path projectDir() {
        return projectDir;
    }

    public Path conclaveDir() {
        return conclaveDir;
    }

    public Path goalFile() {
        return conclaveDir.resolve("goal.yaml");
    }

    public Path protocolsDir() {
        return conclaveDir.resolve("protocols");
    }

    public Path rulesFile() {
        return protocolsDir().resolve("essential_rules.json");
    }

    public Path communicationDir() {
        return conclaveDir.resolve("communication");
    }

    public Path configFile() {
        return communicationDir().resolve("config.json");
    }

    public Path registryFile() {
        return communicationDir().resolve("pids.json");
    }

    public Path logsDir() {
        return conclaveDir.resolve("logs");
    }

    public Path featuresDir() {
        return projectDir.resolve("features");
    }

    public String name() {
        Path fileName = projectDir.getFileName();
        return fileName == null ? projectDir.toString() : fileName.toString();
    }

    @Override
    public String toString() {
        return projectDir.toString();
    }
}
