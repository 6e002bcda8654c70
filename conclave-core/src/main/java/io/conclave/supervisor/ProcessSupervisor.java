package io.conclave.supervisor;

import io.conclave.Role;
import io.conclave.spi.LaunchCommandResolver;
import io.conclave.spi.ProcessLauncher;
import io.conclave.spi.ProcessSignaller;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launches, tracks and terminates the agent processes of one project.
 *
 * <p>The PID registry file is the only state shared across invocations: {@link #launchAll}
 * writes it, {@link #status()} reads it and {@link #stopAll()} deletes it. Liveness is inferred
 * from the registry alone. A recorded PID may belong to a process that has already exited, and
 * {@code status()} keeps reporting it until {@code stopAll()} runs.
 *
 * <p>Spawn and signal failures are logged per process and never abort work on the other
 * processes. The registry assumes a single writer; concurrent supervisors on one project are
 * unsupported.
 */
public final class ProcessSupervisor {
    private final Logger logger = Logger.getLogger(ProcessSupervisor.class.getName());

    private final Path projectDir;
    private final PidRegistry registry;
    private final ProcessLauncher launcher;
    private final ProcessSignaller signaller;
    private final LaunchCommandResolver commandResolver;
    private final Duration gracePeriod;
    private final String modulePath;
    private final Path logDirectory;
    private final Clock clock;
    private final Map<Role, AgentProcess> processes = new EnumMap<>(Role.class);

    private ProcessSupervisor(Builder builder) {
        this.projectDir = Objects.requireNonNull(builder.projectDir, "projectDir");
        this.commandResolver = Objects.requireNonNull(builder.commandResolver, "commandResolver");
        this.registry = new PidRegistry(builder.registryFile != null
                ? builder.registryFile
                : projectDir.resolve(".conclave").resolve("communication").resolve("pids.json"));
        this.launcher = builder.launcher != null ? builder.launcher : new OsProcessLauncher();
        this.signaller = builder.signaller != null ? builder.signaller : new OsProcessSignaller();
        this.gracePeriod = Objects.requireNonNull(builder.gracePeriod, "gracePeriod");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must be >= 0");
        }
        this.modulePath = builder.modulePath;
        this.logDirectory = builder.logDirectory != null
                ? builder.logDirectory
                : projectDir.resolve(".conclave").resolve("logs");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public PidRegistry registry() {
        return registry;
    }

    /**
     * Launches one process per role and persists the PIDs of those that started.
     *
     * <p>A role without a resolvable command, or whose spawn fails, is marked
     * {@link ProcessStatus#FAILED} and skipped. The registry is written even when nothing
     * started.
     *
     * @param roles the roles to launch, in order
     * @return role id to PID of the processes that started
     */
    public synchronized Map<String, Long> launchAll(Collection<Role> roles) {
        Map<String, Long> launched = new LinkedHashMap<>();
        for (Role role : roles) {
            Optional<List<String>> command = commandResolver.resolve(role);
            AgentProcess process = new AgentProcess(role, role.title(), command.orElse(null));
            processes.put(role, process);
            if (command.isEmpty() || command.get().isEmpty()) {
                process.markFailed("No launch command for " + role.id());
                logger.severe("No launch command for " + role.id() + "; skipping");
                continue;
            }
            try {
                long pid = launcher.launch(launchSpec(role, command.get()));
                process.markRunning(pid, clock.instant());
                launched.put(role.id(), pid);
                logger.info("Launched " + role.id() + " (" + role.title() + ", PID " + pid + ")");
            } catch (ProcessException e) {
                process.markFailed(e.getMessage());
                logger.log(Level.SEVERE, "Failed to launch " + role.id(), e);
            }
        }
        try {
            registry.write(launched);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write PID registry " + registry.file(), e);
        }
        logger.info("Launched " + launched.size() + " of " + roles.size() + " agents");
        return launched;
    }

    private LaunchSpec launchSpec(Role role, List<String> command) {
        Map<String, String> environment = new LinkedHashMap<>();
        if (modulePath != null && !modulePath.isEmpty()) {
            environment.put("CLASSPATH", modulePath);
        }
        return new LaunchSpec(role, command, projectDir, environment, logDirectory.resolve(role.id() + ".out"));
    }

    /**
     * Reads the PID registry without checking whether the processes are alive.
     *
     * @return role id to PID; empty when not running or the registry is unreadable
     */
    public Map<String, Long> status() {
        try {
            return registry.read();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot read PID registry " + registry.file(), e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Terminates every registered process and deletes the registry.
     *
     * <p>Phase one requests graceful termination of every PID. After the grace period, phase two
     * kills each PID that is still reachable. Failures are warnings. The registry is deleted
     * whether or not every process exited.
     *
     * @return {@code false} if there was no registry, i.e. nothing was running
     */
    public synchronized boolean stopAll() {
        if (!registry.exists()) {
            logger.warning("No PID registry found; agents may not be running");
            return false;
        }
        Map<String, Long> pids = status();

        for (Map.Entry<String, Long> entry : pids.entrySet()) {
            try {
                signaller.terminate(entry.getValue());
                logger.info("Sent terminate to " + entry.getKey() + " (PID " + entry.getValue() + ")");
            } catch (ProcessException e) {
                logger.warning("Failed to terminate " + entry.getKey() + " (PID " + entry.getValue()
                        + "); may already be stopped: " + e.getMessage());
            }
        }

        if (!pids.isEmpty() && !gracePeriod.isZero()) {
            try {
                Thread.sleep(gracePeriod.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (Map.Entry<String, Long> entry : pids.entrySet()) {
            long pid = entry.getValue();
            if (!signaller.isReachable(pid)) {
                continue;
            }
            try {
                signaller.kill(pid);
                logger.info("Killed " + entry.getKey() + " (PID " + pid + ")");
            } catch (ProcessException e) {
                logger.warning("Failed to kill " + entry.getKey() + " (PID " + pid + "): " + e.getMessage());
            }
        }

        try {
            registry.delete();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete PID registry " + registry.file(), e);
        }
        for (AgentProcess process : processes.values()) {
            if (process.status() == ProcessStatus.RUNNING) {
                process.markStopped();
            }
        }
        logger.info("Stopped " + pids.size() + " agents");
        return true;
    }

    /**
     * @return the processes launched by this supervisor instance, in role order
     */
    public synchronized List<AgentProcess> processes() {
        return new ArrayList<>(processes.values());
    }

    /** Builder for {@link ProcessSupervisor}. */
    public static final class Builder {
        private Path projectDir;
        private Path registryFile;
        private ProcessLauncher launcher;
        private ProcessSignaller signaller;
        private LaunchCommandResolver commandResolver;
        private Duration gracePeriod = Duration.ofSeconds(2);
        private String modulePath;
        private Path logDirectory;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the target project; agents run with it as their working directory.
         *
         * <p><b>Required.</b>
         *
         * @param projectDir the project root
         * @return this builder
         */
        public Builder projectDir(Path projectDir) {
            this.projectDir = projectDir;
            return this;
        }

        /**
         * Optional. Defaults to {@code <project>/.conclave/communication/pids.json}.
         *
         * @param registryFile the PID registry file
         * @return this builder
         */
        public Builder registryFile(Path registryFile) {
            this.registryFile = registryFile;
            return this;
        }

        /**
         * Optional. Defaults to {@link OsProcessLauncher}.
         *
         * @param launcher the spawn primitive
         * @return this builder
         */
        public Builder launcher(ProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        /**
         * Optional. Defaults to {@link OsProcessSignaller}.
         *
         * @param signaller the signal primitive
         * @return this builder
         */
        public Builder signaller(ProcessSignaller signaller) {
            this.signaller = signaller;
            return this;
        }

        /**
         * <b>Required.</b>
         *
         * @param commandResolver resolves each role's launch command
         * @return this builder
         */
        public Builder commandResolver(LaunchCommandResolver commandResolver) {
            this.commandResolver = commandResolver;
            return this;
        }

        /**
         * Sets the wait between graceful terminate and forceful kill.
         *
         * <p>Optional. Defaults to 2 seconds.
         *
         * @param gracePeriod the grace period
         * @return this builder
         */
        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        /**
         * Sets the module search path exported to agents as {@code CLASSPATH}.
         *
         * @param modulePath the class path, or {@code null} to leave the environment unchanged
         * @return this builder
         */
        public Builder modulePath(String modulePath) {
            this.modulePath = modulePath;
            return this;
        }

        /**
         * Optional. Defaults to {@code <project>/.conclave/logs}.
         *
         * @param logDirectory directory receiving {@code <role>.out} files
         * @return this builder
         */
        public Builder logDirectory(Path logDirectory) {
            this.logDirectory = logDirectory;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ProcessSupervisor build() {
            return new ProcessSupervisor(this);
        }
    }
}
