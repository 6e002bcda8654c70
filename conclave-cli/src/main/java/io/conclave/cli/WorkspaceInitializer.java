package io.conclave.cli;

import io.conclave.config.CommunicationConfig;
import io.conclave.config.ConfigLoader;
import io.conclave.protocol.ProtocolRules;
import io.conclave.protocol.ProtocolRulesLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates the conclave directory structure and the initial goal, rules and communication
 * files. Existing files are left untouched.
 */
public final class WorkspaceInitializer {
    static final String GOAL_TEMPLATE = "goal-template.yaml";
    private static final DateTimeFormatter GOAL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Logger logger = Logger.getLogger(WorkspaceInitializer.class.getName());
    private final ConfigLoader configLoader;
    private final ProtocolRulesLoader rulesLoader;
    private final Clock clock;

    public WorkspaceInitializer() {
        this(new ConfigLoader(), new ProtocolRulesLoader(), Clock.systemDefaultZone());
    }

    public WorkspaceInitializer(ConfigLoader configLoader, ProtocolRulesLoader rulesLoader, Clock clock) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.rulesLoader = Objects.requireNonNull(rulesLoader, "rulesLoader");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Initializes {@code workspace}.
     *
     * @param workspace the target project
     * @return the files created by this call
     * @throws IOException if a directory or file cannot be created
     */
    public List<Path> initialize(Workspace workspace) throws IOException {
        for (Path dir : List.of(workspace.conclaveDir(), workspace.protocolsDir(), workspace.logsDir(),
                workspace.communicationDir(), workspace.featuresDir())) {
            Files.createDirectories(dir);
        }
        List<Path> created = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);

        Path goal = workspace.goalFile();
        if (!Files.exists(goal)) {
            Files.writeString(goal, goalTemplate().replace("${timestamp}", GOAL_TIMESTAMP.format(now)),
                    StandardCharsets.UTF_8);
            created.add(goal);
        }
        Path rules = workspace.rulesFile();
        if (!Files.exists(rules)) {
            rulesLoader.write(rules, ProtocolRules.essential(now.toString()));
            created.add(rules);
        }
        Path config = workspace.configFile();
        if (!Files.exists(config)) {
            configLoader.write(config, CommunicationConfig.defaults());
            created.add(config);
        }
        for (Path file : created) {
            logger.info("Created " + file);
        }
        logger.info("Initialized workspace " + workspace);
        return created;
    }

    static String goalTemplate() {
        try (InputStream in = WorkspaceInitializer.class.getResourceAsStream(GOAL_TEMPLATE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + GOAL_TEMPLATE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
