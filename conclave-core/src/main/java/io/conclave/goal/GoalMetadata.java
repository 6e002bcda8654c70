package io.conclave.goal;

/**
 * Bookkeeping fields of a goal file.
 *
 * @param created     creation time as written in the file
 * @param lastUpdated time of the last update of {@code goal.primary}
 * @param version     format version, {@code 1.0} when absent
 */
public record GoalMetadata(String created, String lastUpdated, String version) {
    public static final String DEFAULT_VERSION = "1.0";

    public GoalMetadata {
        created = created == null ? "" : created.strip();
        lastUpdated = lastUpdated == null ? "" : lastUpdated.strip();
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version.strip();
    }

    public GoalMetadata withLastUpdated(String lastUpdated) {
        return new GoalMetadata(created, lastUpdated, version);
    }
}
