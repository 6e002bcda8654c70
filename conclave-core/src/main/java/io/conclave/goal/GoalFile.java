package io.conclave.goal;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Reads and rewrites the goal file of a project.
 */
public final class GoalFile {
    private final Path file;
    private final GoalParser parser;
    private final GoalWriter writer;
    private final Clock clock;

    public GoalFile(Path file) {
        this(file, new GoalParser(), new GoalWriter(), Clock.systemDefaultZone());
    }

    public GoalFile(Path file, GoalParser parser, GoalWriter writer, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path path() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    /**
     * @return the parsed goal, or {@code null} if missing or invalid
     */
    public RepositoryGoal read() {
        return parser.parseFile(file);
    }

    public void write(RepositoryGoal goal) throws IOException {
        Files.writeString(file, writer.write(goal), StandardCharsets.UTF_8);
    }

    /**
     * Replaces {@code goal.primary} and stamps {@code last_updated}. When the current file is
     * missing or invalid, a new goal holding only the primary objective is written.
     *
     * @param primary the new objective
     * @return the goal as written
     * @throws IOException              if the file cannot be written
     * @throws IllegalArgumentException if {@code primary} is blank
     */
    public RepositoryGoal updatePrimary(String primary) throws IOException {
        RepositoryGoal current = read();
        RepositoryGoal updated;
        if (current == null) {
            updated = RepositoryGoal.builder(primary).build().withPrimary(primary, clock);
        } else {
            updated = current.withPrimary(primary, clock);
        }
        write(updated);
        return updated;
    }
}
