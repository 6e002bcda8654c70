package io.conclave.goal;

/**
 * What the repository is and is not responsible for.
 *
 * @param included free text describing what is in scope
 * @param excluded free text describing what is explicitly out of scope
 */
public record GoalScope(String included, String excluded) {
    public static final GoalScope EMPTY = new GoalScope("", "");

    public GoalScope {
        included = included == null ? "" : included.strip();
        excluded = excluded == null ? "" : excluded.strip();
    }

    public boolean hasExclusions() {
        return !excluded.isEmpty();
    }
}
