package io.conclave.config;

/**
 * Unchecked exception for a missing or malformed configuration file.
 *
 * <p>Loaders catch it at their boundary, log it, and fall back to built-in defaults.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
