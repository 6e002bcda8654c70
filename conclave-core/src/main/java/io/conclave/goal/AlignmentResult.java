package io.conclave.goal;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one alignment check.
 *
 * @param aligned          whether the request looks like it serves the goal
 * @param confidence       in {@code [0.0, 1.0]}
 * @param matchingKeywords goal keywords found in the request
 * @param reason           human-readable explanation
 */
public record AlignmentResult(boolean aligned, double confidence, Set<String> matchingKeywords, String reason) {
    public AlignmentResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        matchingKeywords = matchingKeywords == null ? Set.of() : Set.copyOf(matchingKeywords);
        Objects.requireNonNull(reason, "reason");
    }
}
