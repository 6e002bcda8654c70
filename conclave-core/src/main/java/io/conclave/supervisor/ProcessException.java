package io.conclave.supervisor;

/**
 * Failure to spawn or signal an OS process.
 *
 * <p>The supervisor catches it per process and logs it; it never aborts operations on sibling
 * processes.
 */
public final class ProcessException extends Exception {
    public ProcessException(String message) {
        super(message);
    }

    public ProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
