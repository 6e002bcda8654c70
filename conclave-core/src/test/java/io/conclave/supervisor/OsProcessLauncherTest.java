package io.conclave.supervisor;

import io.conclave.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class OsProcessLauncherTest {
    @TempDir
    Path dir;

    @Test
    void launchesAndStopsRealProcesses() throws Exception {
        ProcessSupervisor supervisor = ProcessSupervisor.builder()
                .projectDir(dir)
                .gracePeriod(Duration.ofMillis(200))
                .commandResolver(role -> Optional.of(List.of("sleep", "30")))
                .build();
        OsProcessSignaller signaller = new OsProcessSignaller();

        Map<String, Long> pids = supervisor.launchAll(List.of(Role.AUDITOR, Role.INSIGHTS));

        assertEquals(2, pids.size());
        pids.values().forEach(pid -> assertTrue(signaller.isReachable(pid)));

        assertTrue(supervisor.stopAll());
        for (long pid : pids.values()) {
            waitUntilGone(signaller, pid);
        }
    }

    @Test
    void writesOutputToFileInWorkingDirectory() throws Exception {
        Path out = dir.resolve("logs/echo.out");
        long pid = new OsProcessLauncher().launch(new LaunchSpec(Role.HUB,
                List.of("sh", "-c", "pwd; echo \"$CONCLAVE_TEST\""), dir, Map.of("CONCLAVE_TEST", "hello"), out));

        waitUntilGone(new OsProcessSignaller(), pid);

        List<String> lines = Files.readAllLines(out);
        assertEquals(dir.toRealPath().toString(), Path.of(lines.get(0)).toRealPath().toString());
        assertEquals("hello", lines.get(1));
    }

    @Test
    void missingExecutableThrows() {
        assertThrows(ProcessException.class, () -> new OsProcessLauncher().launch(new LaunchSpec(Role.HUB,
                List.of("definitely-not-a-conclave-binary"), dir, Map.of(), null)));
    }

    @Test
    void signallingUnknownPidThrows() {
        OsProcessSignaller signaller = new OsProcessSignaller();

        assertFalse(signaller.isReachable(Long.MAX_VALUE));
        assertThrows(ProcessException.class, () -> signaller.terminate(Long.MAX_VALUE));
    }

    private static void waitUntilGone(OsProcessSignaller signaller, long pid) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (signaller.isReachable(pid) && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(signaller.isReachable(pid));
    }
}
