package io.conclave.supervisor;

import io.conclave.spi.ProcessLauncher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * <p>The child inherits the current environment plus {@link LaunchSpec#environment()}. Its stdout and stderr
 * are appended to the output file. Its stdin is closed right away, so an agent never waits on a
 * terminal it does not have.
 */
public final class OsProcessLauncher implements ProcessLauncher {
    private static final Logger logger = Logger.getLogger(OsProcessLauncher.class.getName());

    @Override
    public long launch(LaunchSpec spec) throws ProcessException {
        ProcessBuilder builder = new ProcessBuilder(spec.command())
                .directory(spec.workingDirectory().toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(spec.environment());
        Path output = spec.outputFile();
        try {
            if (output != null) {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                builder.redirectOutput(ProcessBuilder.Redirect.appendTo(output.toFile()));
            } else {
                builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            }
            Process process = builder.start();
            try {
                process.getOutputStream().close();
            } catch (IOException e) {
                logger.log(Level.FINE, "Could not close stdin of " + spec.role().id(), e);
            }
            return process.pid();
        } catch (IOException | SecurityException | UnsupportedOperationException e) {
            throw new ProcessException("Cannot start " + spec.role().id() + ": " + spec.command(), e);
        }
    }
}
