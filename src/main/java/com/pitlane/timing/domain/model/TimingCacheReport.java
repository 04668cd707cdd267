package com.pitlane.timing.domain.model;

/**
 * Point-in-time view over both tiers, as served by the stats endpoint.
 * {@code volatileKeys} is -1 when the count could not be taken.
 */
public record TimingCacheReport(
        boolean connected,
        long defaultTtlSeconds,
        int fallbackEntries,
        long volatileKeys,
        DurableStoreStats durable,
        CacheStats lookups
) {}
