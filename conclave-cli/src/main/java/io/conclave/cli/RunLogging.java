package io.conclave.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Per-run {@code java.util.logging} setup: console output for warnings, a log file per run for
 * everything at {@code INFO} and above.
 */
final class RunLogging {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private RunLogging() {
    }

    /** Loads {@code logging.properties} from the classpath unless a config was given explicitly. */
    static void configureDefaults() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = RunLogging.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(RunLogging.class.getName()).log(Level.WARNING, "Cannot read logging.properties", e);
        }
    }

    /**
     * Attaches a file handler writing {@code <logs>/<prefix>_<yyyyMMdd_HHmmss>.log}.
     *
     * @return the log file, or {@code null} if it could not be opened
     */
    static Path attachFile(Path logsDir, String prefix) {
        Path file = logsDir.resolve(prefix + "_" + FILE_STAMP.format(LocalDateTime.now()) + ".log");
        try {
            Files.createDirectories(logsDir);
            FileHandler handler = new FileHandler(file.toString(), true);
            handler.setFormatter(new SimpleFormatter());
            handler.setLevel(Level.INFO);
            Logger.getLogger("").addHandler(handler);
            return file;
        } catch (IOException e) {
            Logger.getLogger(RunLogging.class.getName()).log(Level.WARNING, "Cannot open log file " + file, e);
            return null;
        }
    }
}
