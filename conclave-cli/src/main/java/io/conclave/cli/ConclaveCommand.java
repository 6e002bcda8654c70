package io.conclave.cli;

import io.conclave.Role;
import io.conclave.amqp.MessageBuses;
import io.conclave.cli.agent.AgentContext;
import io.conclave.cli.agent.AgentRuntime;
import io.conclave.cli.agent.AgentRuntimes;
import io.conclave.config.CommunicationConfig;
import io.conclave.config.ConfigLoader;
import io.conclave.micrometer.MicrometerBusMetrics;
import io.conclave.router.RoleRouter;
import io.conclave.router.RoleRouters;
import io.conclave.supervisor.OsProcessLauncher;
import io.conclave.supervisor.OsProcessSignaller;
import io.conclave.supervisor.ProcessSupervisor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * conclave [--project &lt;dir&gt;] [init | start | stop | status | agent &lt;role&gt;]
 * </pre>
 *
 * Without a command, {@code start} runs. Exit code is {@code 0} on success and {@code 1} on
 * any failure or invalid input.
 */
@Command(
        name = "conclave",
        mixinStandardHelpOptions = true,
        version = "conclave 0.3.0",
        description = "Coordinates five cooperating agents over a message broker",
        exitCodeOnInvalidInput = 1,
        exitCodeOnExecutionException = 1,
        subcommands = {
                ConclaveCommand.InitCommand.class,
                ConclaveCommand.StartCommand.class,
                ConclaveCommand.StopCommand.class,
                ConclaveCommand.StatusCommand.class,
                ConclaveCommand.AgentCommand.class
        }
)
public final class ConclaveCommand implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(ConclaveCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Option(names = {"--project"}, description = "Target project (default: nearest git repository)")
    Path project;

    public static void main(String[] args) {
        RunLogging.configureDefaults();
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        return new CommandLine(new ConclaveCommand());
    }

    @Override
    public Integer call() throws IOException {
        return start();
    }

    Workspace workspace() {
        if (project != null) {
            return Workspace.of(project);
        }
        Path cwd = Paths.get("").toAbsolutePath();
        return Workspace.of(Workspace.findProjectRoot(cwd).orElseThrow(() -> new ParameterException(
                spec.commandLine(), "No git repository found in " + cwd
                + " or its parents; run inside a repository or pass --project <dir>")));
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    Workspace initialize(String logPrefix) throws IOException {
        Workspace workspace = workspace();
        new WorkspaceInitializer().initialize(workspace);
        RunLogging.attachFile(workspace.logsDir(), logPrefix);
        return workspace;
    }

    int start() throws IOException {
        Workspace workspace = initialize("conclave");
        List<String> missing = new DependencyCheck().missing();
        if (!missing.isEmpty()) {
            out().println("Warning: missing " + missing + "; agents will run in offline mode");
        }
        ProcessSupervisor supervisor = supervisor(workspace);
        if (supervisor.registry().exists()) {
            out().println("Conclave already running in " + workspace.name() + "; run 'conclave stop' first");
            return 1;
        }
        Map<String, Long> launched = supervisor.launchAll(Arrays.asList(Role.values()));
        if (launched.isEmpty()) {
            out().println("Failed to start: no agent launched (see " + workspace.logsDir() + ")");
            return 1;
        }
        out().println("Conclave active in " + workspace.name() + ": " + launched.size() + " of "
                + Role.values().length + " agents launched");
        return launched.size() == Role.values().length ? 0 : 1;
    }

    ProcessSupervisor supervisor(Workspace workspace) {
        CommunicationConfig config = new ConfigLoader().loadOrDefault(workspace.configFile());
        return ProcessSupervisor.builder()
                .projectDir(workspace.projectDir())
                .registryFile(workspace.registryFile())
                .logDirectory(workspace.logsDir())
                .launcher(new OsProcessLauncher())
                .signaller(new OsProcessSignaller())
                .commandResolver(new AgentCommandResolver(config, workspace.projectDir(),
                        AgentCommandResolver.currentJava()))
                .modulePath(System.getProperty("java.class.path"))
                .build();
    }

    @Command(name = "init", description = "Create the .conclave structure and initial files")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ConclaveCommand parent;

        @Override
        public Integer call() throws IOException {
            Workspace workspace = parent.initialize("conclave");
            List<String> missing = new DependencyCheck().missing();
            if (missing.isEmpty()) {
                parent.out().println(workspace.name() + " initialized; edit " + workspace.goalFile()
                        + " then run 'conclave start'");
            } else {
                parent.out().println(workspace.name() + " initialized, but " + missing
                        + " is missing; agents will run in offline mode");
            }
            return 0;
        }
    }

    @Command(name = "start", description = "Initialize, then launch the five agents")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        ConclaveCommand parent;

        @Override
        public Integer call() throws IOException {
            return parent.start();
        }
    }

    @Command(name = "stop", description = "Terminate every launched agent")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        ConclaveCommand parent;

        @Override
        public Integer call() {
            Workspace workspace = parent.workspace();
            RunLogging.attachFile(workspace.logsDir(), "conclave");
            if (!parent.supervisor(workspace).stopAll()) {
                parent.out().println("Conclave is not running in " + workspace.name() + "; nothing to stop");
                return 0;
            }
            parent.out().println("Conclave stopped in " + workspace.name());
            return 0;
        }
    }

    @Command(name = "status", description = "Show the launched agents")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ConclaveCommand parent;

        @Override
        public Integer call() {
            Workspace workspace = parent.workspace();
            ProcessSupervisor supervisor = parent.supervisor(workspace);
            if (!supervisor.registry().exists()) {
                parent.out().println("Conclave is not currently running in " + workspace.name());
                return 0;
            }
            Map<String, Long> pids = supervisor.status();
            StringJoiner agents = new StringJoiner(", ");
            pids.forEach((role, pid) -> agents.add(role + "=" + pid));
            parent.out().println("Conclave is running with " + pids.size() + " agents: " + agents);
            return 0;
        }
    }

    @Command(name = "agent", description = "Run one agent in this process")
    static final class AgentCommand implements Callable<Integer> {
        @ParentCommand
        ConclaveCommand parent;

        @Parameters(index = "0", paramLabel = "<role>", description = "hub, fixer, governor, auditor or insights")
        String roleId;

        @Override
        public Integer call() {
            Role role;
            try {
                role = Role.fromId(roleId);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(parent.spec.commandLine(), e.getMessage());
            }
            Workspace workspace = parent.workspace();
            RunLogging.attachFile(workspace.logsDir(), role.id());
            CommunicationConfig config = new ConfigLoader().loadOrDefault(workspace.configFile());

            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MicrometerBusMetrics metrics = new MicrometerBusMetrics(registry, role.id());
            RoleRouter router = RoleRouters.forRole(role,
                    MessageBuses.open(config.broker(), metrics, role.id()));
            AgentContext context = AgentContext.builder()
                    .workspace(workspace)
                    .router(router)
                    .in(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)))
                    .out(System.out)
                    .build();
            AgentRuntime runtime = AgentRuntimes.create(context);
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "conclave-shutdown"));
            int exitCode = runtime.run();
            for (Counter counter : registry.find("conclave.publish.success").counters()) {
                logger.info(role.id() + " published " + (long) counter.count() + " messages");
            }
            metrics.close();
            return exitCode;
        }
    }
}
