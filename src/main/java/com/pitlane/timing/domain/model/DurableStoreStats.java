package com.pitlane.timing.domain.model;

import java.util.Map;

public record DurableStoreStats(
        long seasons,
        long events,
        long sessions,
        Map<Integer, Long> sessionsByYear,
        long sizeBytes
) {
    public DurableStoreStats {
        sessionsByYear = sessionsByYear != null ? Map.copyOf(sessionsByYear) : Map.of();
    }

    public static DurableStoreStats empty() {
        return new DurableStoreStats(0, 0, 0, Map.of(), 0);
    }

    public double sizeMegabytes() {
        return sizeBytes / (1024.0 * 1024.0);
    }
}
