package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.CacheStats;
import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.TimingCacheReport;
import java.util.Map;

public record CacheStatsResponse(
        boolean connected,
        long default_ttl_seconds,
        int fallback_entries,
        long volatile_keys,
        DurableDto durable,
        LookupsDto lookups
) {
    public static CacheStatsResponse fromReport(TimingCacheReport report) {
        return new CacheStatsResponse(
                report.connected(),
                report.defaultTtlSeconds(),
                report.fallbackEntries(),
                report.volatileKeys(),
                DurableDto.fromStats(report.durable()),
                LookupsDto.fromStats(report.lookups())
        );
    }

    public record DurableDto(
            long seasons,
            long events,
            long sessions,
            Map<Integer, Long> sessions_by_year,
            double size_mb
    ) {
        public static DurableDto fromStats(DurableStoreStats stats) {
            return new DurableDto(
                    stats.seasons(),
                    stats.events(),
                    stats.sessions(),
                    stats.sessionsByYear(),
                    Math.round(stats.sizeMegabytes() * 100) / 100.0
            );
        }
    }

    public record LookupsDto(
            long volatile_hits,
            long durable_hits,
            long misses,
            long errors,
            long invalidations,
            double hit_ratio
    ) {
        public static LookupsDto fromStats(CacheStats stats) {
            return new LookupsDto(
                    stats.volatileHits(),
                    stats.durableHits(),
                    stats.misses(),
                    stats.errors(),
                    stats.invalidations(),
                    stats.hitRatio()
            );
        }
    }
}
