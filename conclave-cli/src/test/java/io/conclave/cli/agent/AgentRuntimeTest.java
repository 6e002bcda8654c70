package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.cli.Workspace;
import io.conclave.protocol.ProtocolRules;
import io.conclave.protocol.ProtocolRulesLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AgentRuntimeTest {

    @TempDir
    Path projectDir;

    private AgentContext context(RecordingRouter router) {
        return AgentContext.builder()
                .workspace(Workspace.of(projectDir))
                .router(router)
                .in(new BufferedReader(new StringReader("")))
                .out(new PrintStream(new ByteArrayOutputStream()))
                .build();
    }

    @Test
    void createsRuntimePerRole() {
        assertInstanceOf(HubAgent.class, AgentRuntimes.create(context(new RecordingRouter(Role.HUB))));
        assertInstanceOf(FixerAgent.class, AgentRuntimes.create(context(new RecordingRouter(Role.FIXER))));
        assertInstanceOf(GovernorAgent.class, AgentRuntimes.create(context(new RecordingRouter(Role.GOVERNOR))));
        assertInstanceOf(ObserverAgent.class, AgentRuntimes.create(context(new RecordingRouter(Role.AUDITOR))));
        assertInstanceOf(ObserverAgent.class, AgentRuntimes.create(context(new RecordingRouter(Role.INSIGHTS))));
    }

    @Test
    void blockingAgentRunsUntilClosed() throws Exception {
        Files.createDirectories(Workspace.of(projectDir).protocolsDir());
        new ProtocolRulesLoader().write(Workspace.of(projectDir).rulesFile(), ProtocolRules.essential("now"));
        RecordingRouter router = new RecordingRouter(Role.AUDITOR);
        AgentRuntime auditor = AgentRuntimes.create(context(router));
        AtomicInteger exitCode = new AtomicInteger(-1);
        Thread runner = new Thread(() -> exitCode.set(auditor.run()));
        runner.start();

        assertTrue(router.consuming.await(5, TimeUnit.SECONDS));
        assertTrue(runner.isAlive());
        assertEquals(List.of(ConsumeMode.BLOCKING), router.consumeCalls);
        assertTrue(router.handlers.containsKey("default"));
        assertEquals(3, router.lastOfType("startup").payload().get("protocols_loaded"));

        auditor.close();
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertEquals(0, exitCode.get());
        assertEquals(List.of("startup", "shutdown"), router.sentTypes());
    }

    @Test
    void closeIsIdempotent() {
        RecordingRouter router = new RecordingRouter(Role.INSIGHTS);
        AgentRuntime insights = AgentRuntimes.create(context(router));

        insights.close();
        insights.close();

        assertEquals(1, router.closeCalls);
        assertEquals(List.of("shutdown"), router.sentTypes());
    }
}
