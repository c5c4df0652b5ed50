package io.middleware4j.core;

/**
 * Snapshot of a job's progress. Every field may be null until the body reports something.
 */
public record JobProgress(Double percent, String description, Object extra) {

    public static JobProgress empty() {
        return new JobProgress(null, null, null);
    }
}
