package com.pitlane.timing.domain.model;

/**
 * Lookup counters of the cache-aside coordinator
 */
public record CacheStats(
        long volatileHits,
        long durableHits,
        long misses,
        long errors,
        long invalidations
) {
    public long hits() {
        return volatileHits + durableHits;
    }

    public double hitRatio() {
        long total = hits() + misses;
        return total > 0 ? (double) hits() / total : 0.0;
    }

    public double volatileHitRatio() {
        long total = hits() + misses;
        return total > 0 ? (double) volatileHits / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%% (volatile %.1f%%), misses: %d",
                hitRatio() * 100, volatileHitRatio() * 100, misses);
    }
}
