package io.conclave.supervisor;

import io.conclave.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessSupervisorTest {
    @TempDir
    Path projectDir;

    private StubProcessTable table;

    @BeforeEach
    void setUp() {
        table = new StubProcessTable();
    }

    private ProcessSupervisor.Builder supervisor() {
        return ProcessSupervisor.builder()
                .projectDir(projectDir)
                .launcher(table)
                .signaller(table)
                .gracePeriod(Duration.ZERO)
                .commandResolver(role -> Optional.of(List.of("agent", role.id())));
    }

    @Test
    void launchAllRecordsEveryRole() {
        ProcessSupervisor supervisor = supervisor().build();

        Map<String, Long> launched = supervisor.launchAll(Arrays.asList(Role.values()));

        assertEquals(5, launched.size());
        assertEquals(launched, supervisor.status());
        assertTrue(Files.exists(projectDir.resolve(".conclave/communication/pids.json")));
        supervisor.processes().forEach(p -> assertEquals(ProcessStatus.RUNNING, p.status()));
    }

    @Test
    void launchSpecCarriesProjectDirModulePathAndOutputFile() {
        ProcessSupervisor supervisor = supervisor().modulePath("/opt/conclave/lib/*").build();

        supervisor.launchAll(List.of(Role.FIXER));

        LaunchSpec spec = table.launched.get(0);
        assertEquals(projectDir, spec.workingDirectory());
        assertEquals("/opt/conclave/lib/*", spec.environment().get("CLASSPATH"));
        assertEquals(List.of("agent", "fixer"), spec.command());
        assertEquals(projectDir.resolve(".conclave/logs/fixer.out"), spec.outputFile());
    }

    @Test
    void killedProcessStaysRegisteredUntilStopAll() {
        ProcessSupervisor supervisor = supervisor().build();
        Map<String, Long> launched = supervisor.launchAll(Arrays.asList(Role.values()));

        table.killExternally(launched.get("auditor"));

        assertEquals(5, supervisor.status().size());
        assertTrue(supervisor.stopAll());
        assertTrue(supervisor.status().isEmpty());
    }

    @Test
    void launchThenStopIsIdempotent() {
        ProcessSupervisor supervisor = supervisor().build();
        supervisor.launchAll(Arrays.asList(Role.values()));

        assertTrue(supervisor.stopAll());
        assertTrue(supervisor.status().isEmpty());
        assertFalse(supervisor.registry().exists());

        assertFalse(supervisor.stopAll());
        assertTrue(supervisor.status().isEmpty());
        assertEquals(5, table.terminated.size());
    }

    @Test
    void stopAllKillsProcessesThatIgnoreTerminate() {
        ProcessSupervisor supervisor = supervisor().build();
        Map<String, Long> launched = supervisor.launchAll(List.of(Role.HUB, Role.FIXER));
        long stubborn = launched.get("fixer");
        table.ignoreTerminate.add(stubborn);

        supervisor.stopAll();

        assertEquals(List.of(stubborn), table.killed);
        assertTrue(table.alive.isEmpty());
        supervisor.processes().forEach(p -> assertEquals(ProcessStatus.STOPPED, p.status()));
    }

    @Test
    void missingCommandIsSkippedWithoutAbortingOthers() {
        ProcessSupervisor supervisor = supervisor()
                .commandResolver(role -> role == Role.GOVERNOR ? Optional.empty() : Optional.of(List.of("agent")))
                .build();

        Map<String, Long> launched = supervisor.launchAll(Arrays.asList(Role.values()));

        assertEquals(4, launched.size());
        assertFalse(launched.containsKey("governor"));
        AgentProcess governor = supervisor.processes().get(Role.GOVERNOR.ordinal());
        assertEquals(ProcessStatus.FAILED, governor.status());
        assertTrue(governor.failureReason().contains("governor"));
    }

    @Test
    void spawnFailureMarksFailedAndContinues() {
        table.failingRoles.add("hub");
        ProcessSupervisor supervisor = supervisor().build();

        Map<String, Long> launched = supervisor.launchAll(Arrays.asList(Role.values()));

        assertEquals(4, launched.size());
        assertEquals(ProcessStatus.FAILED, supervisor.processes().get(0).status());
    }

    @Test
    void registryWrittenEvenWhenNothingStarted() {
        ProcessSupervisor supervisor = supervisor().commandResolver(role -> Optional.empty()).build();

        supervisor.launchAll(Arrays.asList(Role.values()));

        assertTrue(supervisor.registry().exists());
        assertTrue(supervisor.status().isEmpty());
        assertTrue(supervisor.stopAll());
    }

    @Test
    void stopAllToleratesProcessesAlreadyGone() {
        ProcessSupervisor supervisor = supervisor().build();
        Map<String, Long> launched = supervisor.launchAll(List.of(Role.HUB));
        table.killExternally(launched.get("hub"));

        assertTrue(supervisor.stopAll());
        assertTrue(table.killed.isEmpty());
    }

    @Test
    void stopAllWithoutRegistryReturnsFalse() {
        assertFalse(supervisor().build().stopAll());
    }

    @Test
    void stateMachineRejectsIllegalTransitions() {
        AgentProcess process = new AgentProcess(Role.HUB, "t", List.of("x"));

        assertThrows(IllegalStateException.class, process::markStopped);
        process.markFailed("nope");
        assertThrows(IllegalStateException.class, () -> process.markRunning(1, null));
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> ProcessSupervisor.builder()
                .commandResolver(role -> Optional.empty()).build());
        assertThrows(IllegalArgumentException.class, () -> supervisor().gracePeriod(Duration.ofSeconds(-1)).build());
    }
}
