package org.iceforge.warden.cache;

/** Read-only view of one tier's counters. */
public interface CacheMetrics {
    long hits();

    long misses();

    /** Store failures that were degraded to a miss or a skipped write. */
    long errors();

    default double hitRatio() {
        long total = hits() + misses();
        return total == 0 ? 0.0 : (double) hits() / total;
    }
}
