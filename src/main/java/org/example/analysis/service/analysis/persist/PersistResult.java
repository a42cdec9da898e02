package org.example.analysis.service.analysis.persist;

/**
 * Counts of items stored and items skipped after a per-item failure.
 */
public record PersistResult(int persistedCount, int failures) {

    public static PersistResult empty() {
        return new PersistResult(0, 0);
    }

    /** True when there was something to store and none of it was stored. */
    public boolean isTotalFailure() {
        return persistedCount == 0 && failures > 0;
    }
}
