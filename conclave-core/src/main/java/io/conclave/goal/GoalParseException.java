package io.conclave.goal;

/**
 * Thrown when goal text uses syntax outside the subset the line-oriented parser supports.
 */
public final class GoalParseException extends Exception {
    private final int lineNumber;

    public GoalParseException(String message, int lineNumber) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /** One-based line number of the offending line in the cleaned text. */
    public int lineNumber() {
        return lineNumber;
    }
}
