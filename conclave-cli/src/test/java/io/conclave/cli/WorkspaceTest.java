package io.conclave.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceTest {

    @TempDir
    Path dir;

    @Test
    void findsNearestGitAncestor() throws Exception {
        Path repo = dir.resolve("repo");
        Path nested = repo.resolve("src/main");
        Files.createDirectories(nested);
        Files.createDirectories(repo.resolve(".git"));

        assertEquals(Optional.of(repo.toAbsolutePath().normalize()), Workspace.findProjectRoot(nested));
        assertEquals(Optional.of(repo.toAbsolutePath().normalize()), Workspace.findProjectRoot(repo));
    }

    @Test
    void gitFileMarksWorktreeRoot() throws Exception {
        Path worktree = dir.resolve("worktree");
        Files.createDirectories(worktree);
        Files.writeString(worktree.resolve(".git"), "gitdir: /elsewhere\n");

        assertEquals(Optional.of(worktree.toAbsolutePath().normalize()), Workspace.findProjectRoot(worktree));
    }

    @Test
    void layoutUnderProject() {
        Workspace workspace = Workspace.of(dir);

        assertEquals(dir.resolve(".conclave/goal.yaml"), workspace.goalFile());
        assertEquals(dir.resolve(".conclave/protocols/essential_rules.json"), workspace.rulesFile());
        assertEquals(dir.resolve(".conclave/communication/config.json"), workspace.configFile());
        assertEquals(dir.resolve(".conclave/communication/pids.json"), workspace.registryFile());
        assertEquals(dir.resolve(".conclave/logs"), workspace.logsDir());
        assertEquals(dir.resolve("features"), workspace.featuresDir());
        assertEquals(dir.getFileName().toString(), workspace.name());
    }
}
