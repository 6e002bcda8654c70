package io.conclave.cli;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Looks up external executables on the {@code PATH}.
 */
public final class DependencyCheck {
    static final List<String> EXTERNAL = List.of("rabbitmq-server");
    static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final Logger logger = Logger.getLogger(DependencyCheck.class.getName());
    private final List<String> executables;
    private final Duration timeout;

    public DependencyCheck() {
        this(EXTERNAL, TIMEOUT);
    }

    DependencyCheck(List<String> executables, Duration timeout) {
        this.executables = List.copyOf(executables);
        this.timeout = timeout;
    }

    /**
     * @return the executables that could not be found, empty when all are present
     */
    public List<String> missing() {
        List<String> missing = new ArrayList<>();
        for (String executable : executables) {
            if (!isOnPath(executable)) {
                missing.add(executable);
            }
        }
        if (!missing.isEmpty()) {
            logger.warning("Missing dependencies: " + missing
                    + "; install RabbitMQ (e.g. 'sudo apt-get install rabbitmq-server' or 'brew install rabbitmq')");
        }
        return missing;
    }

    private boolean isOnPath(String executable) {
        Process process;
        try {
            process = new ProcessBuilder("which", executable)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            logger.warning("Could not check dependency " + executable + ": " + e.getMessage());
            return false;
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                logger.warning("Timed out checking dependency " + executable);
                return false;
            }
            return process.exitValue() == 0;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
