package com.pitlane.timing.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-process stand-in for Redis while it is unreachable.
 * <p>
 * Same TTL rule as the shared cache, enforced lazily: an entry is dropped when it is read
 * after {@code now - insertedAt > ttl}. There is no background sweep. Every entry carries a
 * positive TTL.
 */
@Component
public class InProcessTtlCache {

    record Entry(String value, Instant insertedAt, Duration ttl) {

        boolean isExpired(Instant now) {
            return Duration.between(insertedAt, now).compareTo(ttl) > 0;
        }

        Duration remainingTtl(Instant now) {
            return ttl.minus(Duration.between(insertedAt, now));
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InProcessTtlCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // Only drops the entry we saw expire, not one written concurrently
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl + " for " + key);
        }
        entries.put(key, new Entry(value, clock.instant(), ttl));
    }

    public boolean remove(String key) {
        return entries.remove(key) != null;
    }

    public long removeByPrefix(String prefix) {
        long removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Entries that have not expired yet, keyed by cache key.
     */
    Map<String, Entry> liveEntries() {
        Instant now = clock.instant();
        Map<String, Entry> live = new LinkedHashMap<>();
        entries.forEach((key, entry) -> {
            if (!entry.isExpired(now)) {
                live.put(key, entry);
            }
        });
        return live;
    }

    Duration remainingTtl(Entry entry) {
        return entry.remainingTtl(clock.instant());
    }

    /**
     * Drops {@code entry} unless {@code key} was overwritten since it was read.
     */
    boolean removeIfUnchanged(String key, Entry entry) {
        return entries.remove(key, entry);
    }

    public long countByPrefix(String prefix) {
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .filter(e -> !e.getValue().isExpired(now))
                .count();
    }

    /**
     * Raw entry count, including entries that expired but were not read since.
     */
    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
