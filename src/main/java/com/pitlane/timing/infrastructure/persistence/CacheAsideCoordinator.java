package com.pitlane.timing.infrastructure.persistence;

import com.pitlane.timing.domain.model.CacheStats;
import com.pitlane.timing.domain.model.ErrorKind;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.domain.port.in.RecordLookup;
import com.pitlane.timing.domain.port.in.RecordStore;
import com.pitlane.timing.domain.port.out.DurableStore;
import com.pitlane.timing.domain.port.out.VolatileCache;
import com.pitlane.timing.infrastructure.cache.CacheKeys;
import com.pitlane.timing.infrastructure.cache.PayloadCodec;
import com.pitlane.timing.infrastructure.cache.TimingCacheProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Cache-aside coordinator over the volatile and durable tiers.
 * <p>
 * Reads try the volatile tier, then the durable tier; a durable hit re-populates the volatile
 * tier in the background. Writes go to the durable tier first and refresh the volatile tier
 * best-effort. The coordinator never calls the remote origin itself.
 * <p>
 * Every volatile call is bounded by {@link TimingCacheProperties#volatileTimeout()}; a timeout
 * is handled like a connectivity failure.
 * <p>
 * Invalidations bump a generation counter. A background re-population only writes when no
 * invalidation started since its lookup began, and undoes its write when one started meanwhile.
 */
@Repository
public class CacheAsideCoordinator implements RecordLookup, RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(CacheAsideCoordinator.class);

    private final VolatileCache volatileCache;
    private final DurableStore durableStore;
    private final PayloadCodec codec;
    private final CacheKeys keys;
    private final TimingCacheProperties properties;
    private final Executor executor;
    private final Clock clock;

    private final AtomicLong volatileHits = new AtomicLong();
    private final AtomicLong durableHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong invalidationGeneration = new AtomicLong();

    public CacheAsideCoordinator(VolatileCache volatileCache,
                                 DurableStore durableStore,
                                 PayloadCodec codec,
                                 CacheKeys keys,
                                 TimingCacheProperties properties,
                                 @Qualifier("asyncExecutor") Executor executor,
                                 Clock clock) {
        this.volatileCache = volatileCache;
        this.durableStore = durableStore;
        this.codec = codec;
        this.keys = keys;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    // ===== Lookups =====

    @Override
    public CompletableFuture<Optional<SessionResult>> lookupSessionResult(int year, int round, String sessionKey) {
        SessionId id = SessionId.of(year, round, sessionKey);
        String key = keys.session(id);

        return lookup(key,
                codec::decodeSessionResult,
                () -> durableStore.getSessionResult(id.value()),
                properties.defaultTtl());
    }

    @Override
    public CompletableFuture<Optional<List<Event>>> lookupSchedule(int year) {
        return lookup(keys.schedule(year),
                codec::decodeSchedule,
                () -> nonEmpty(durableStore.listEventsByYear(year)),
                properties.scheduleTtl());
    }

    @Override
    public CompletableFuture<Optional<List<SessionSummary>>> lookupEventSessions(int year, int round) {
        return lookup(keys.event(year, round),
                codec::decodeSessionSummaries,
                () -> nonEmpty(durableStore.listSessionsForEvent(Event.idFor(year, round))),
                properties.defaultTtl());
    }

    @Override
    public CompletableFuture<List<Integer>> lookupSeasons() {
        return CompletableFuture.supplyAsync(durableStore::listSeasons, executor)
                .exceptionally(e -> {
                    errors.incrementAndGet();
                    logger.error("Season lookup failed", e);
                    return List.of();
                });
    }

    private <T> CompletableFuture<Optional<T>> lookup(String key,
                                                       Function<String, Optional<T>> decoder,
                                                       Supplier<Optional<T>> durableRead,
                                                       Duration repopulateTtl) {
        long generation = invalidationGeneration.get();
        return volatileGet(key, decoder).thenCompose(cached -> {
            if (cached.isPresent()) {
                volatileHits.incrementAndGet();
                logger.debug("Volatile hit: {}", key);
                return CompletableFuture.completedFuture(cached);
            }

            return CompletableFuture.supplyAsync(durableRead, executor)
                    .exceptionally(e -> {
                        errors.incrementAndGet();
                        logger.error("Durable lookup failed for {}, treating as miss", key, e);
                        return Optional.empty();
                    })
                    .thenApply(stored -> {
                        if (stored.isPresent()) {
                            durableHits.incrementAndGet();
                            logger.debug("Durable hit: {}", key);
                            populateVolatileAsync(key, stored.get(), repopulateTtl, generation);
                        } else {
                            misses.incrementAndGet();
                            logger.debug("Miss in both tiers: {}", key);
                        }
                        return stored;
                    });
        });
    }

    // ===== Writes =====

    @Override
    public CompletableFuture<StoreOutcome> storeSessionResult(SessionResult result) {
        return storeSessionResult(result, null);
    }

    @Override
    public CompletableFuture<StoreOutcome> storeSessionResult(SessionResult result, Duration ttlOverride) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant fetchedAt = result.fetchedAt() != null ? result.fetchedAt().truncatedTo(ChronoUnit.MILLIS) : now;
        SessionResult stamped = result.withTimestamps(fetchedAt, now);
        SessionId id = stamped.id();
        Duration ttl = effectiveTtl(ttlOverride, properties.defaultTtl());

        return durableWrite("session " + id, () -> durableStore.upsertSessionResult(stamped))
                .thenCompose(outcome -> volatileSet(keys.session(id), stamped, ttl)
                        .thenCompose(written -> volatileDelete(keys.event(id.year(), id.round())))
                        .thenApply(ignored -> outcome));
    }

    @Override
    public CompletableFuture<StoreOutcome> storeSchedule(int year, List<Event> events) {
        return storeSchedule(year, events, null);
    }

    @Override
    public CompletableFuture<StoreOutcome> storeSchedule(int year, List<Event> events, Duration ttlOverride) {
        List<Event> schedule = List.copyOf(events);
        for (Event event : schedule) {
            if (event.year() != year) {
                throw new IllegalArgumentException(
                        "Event " + event.eventId() + " belongs to " + event.year() + ", not " + year);
            }
        }
        Duration ttl = effectiveTtl(ttlOverride, properties.scheduleTtl());

        return durableWrite("schedule " + year, () -> durableStore.upsertEvents(schedule))
                .thenCompose(outcome -> {
                    if (schedule.isEmpty()) {
                        return CompletableFuture.completedFuture(outcome);
                    }
                    return volatileSet(keys.schedule(year), schedule, ttl).thenApply(ignored -> outcome);
                });
    }

    @Override
    public CompletableFuture<StoreOutcome> invalidateSession(int year, int round, String sessionKey) {
        SessionId id = SessionId.of(year, round, sessionKey);
        invalidations.incrementAndGet();
        invalidationGeneration.incrementAndGet();

        return volatileDelete(keys.session(id))
                .thenCompose(ignored -> volatileDelete(keys.event(year, round)))
                .thenCompose(ignored -> durableWrite("invalidation of " + id,
                        () -> durableStore.deleteSession(id.value())));
    }

    @Override
    public CompletableFuture<StoreOutcome> invalidateEvent(int year, int round) {
        String eventId = Event.idFor(year, round);
        invalidations.incrementAndGet();
        invalidationGeneration.incrementAndGet();

        return volatileCall(() -> volatileCache.deleteByPrefix(keys.sessionPrefix(year, round)), -1L)
                .thenCompose(removed -> {
                    logger.debug("Removed {} cached sessions of event {}", removed, eventId);
                    return volatileDelete(keys.event(year, round));
                })
                .thenCompose(ignored -> durableWrite("invalidation of event " + eventId,
                        () -> durableStore.deleteSessionsForEvent(eventId)));
    }

    @Override
    public CompletableFuture<StoreOutcome> clearAll() {
        invalidations.incrementAndGet();
        invalidationGeneration.incrementAndGet();

        return CompletableFuture.supplyAsync(() -> {
            long removed = volatileCache.deleteByPrefix(keys.namespacePrefix());
            volatileCache.clearFallback();
            logger.info("Cleared volatile tier: {} keys removed", removed);
            return StoreOutcome.ok();
        }, executor).exceptionally(e -> {
            errors.incrementAndGet();
            logger.warn("Clearing the volatile tier failed: {}", e.getMessage());
            return StoreOutcome.failure(ErrorKind.INTERNAL, e.getMessage());
        });
    }

    @Override
    public CompletableFuture<Integer> purgeOlderThan(int days) {
        return CompletableFuture.supplyAsync(() -> durableStore.purgeOlderThan(days), executor)
                .exceptionally(e -> {
                    errors.incrementAndGet();
                    logger.error("Retention sweep failed", e);
                    return 0;
                });
    }

    public CacheStats lookupStats() {
        return new CacheStats(
                volatileHits.get(),
                durableHits.get(),
                misses.get(),
                errors.get(),
                invalidations.get());
    }

    // ===== Tier helpers =====

    private <T> CompletableFuture<Optional<T>> volatileGet(String key, Function<String, Optional<T>> decoder) {
        return volatileCall(() -> volatileCache.get(key).flatMap(decoder), Optional.<T>empty());
    }

    private CompletableFuture<Boolean> volatileSet(String key, Object value, Duration ttl) {
        return volatileCall(() -> codec.encode(value, ttl)
                .map(json -> volatileCache.set(key, json, ttl))
                .orElse(false), false)
                .thenApply(written -> {
                    if (!written) {
                        logger.warn("Volatile write failed for {}, durable copy still stored", key);
                    }
                    return written;
                });
    }

    private CompletableFuture<Boolean> volatileDelete(String key) {
        return volatileCall(() -> volatileCache.delete(key), false);
    }

    private <T> CompletableFuture<T> volatileCall(Supplier<T> call, T onFailure) {
        return CompletableFuture.supplyAsync(call, executor)
                .completeOnTimeout(onFailure, properties.getVolatileTimeoutMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    errors.incrementAndGet();
                    logger.warn("Volatile tier call failed: {}", e.getMessage());
                    return onFailure;
                });
    }

    private CompletableFuture<StoreOutcome> durableWrite(String description, Supplier<StoreOutcome> write) {
        return CompletableFuture.supplyAsync(write, executor)
                .exceptionally(e -> StoreOutcome.failure(ErrorKind.INTERNAL, e.getMessage()))
                .thenApply(outcome -> {
                    if (outcome.failed()) {
                        errors.incrementAndGet();
                        logger.error("Durable write of {} failed: {} {}", description,
                                outcome.errorKind(), outcome.detail());
                    }
                    return outcome;
                });
    }

    private void populateVolatileAsync(String key, Object value, Duration ttl, long generation) {
        if (value instanceof List<?> list && list.isEmpty()) {
            return;
        }
        volatileCall(() -> populateIfCurrent(key, value, ttl, generation), false).thenAccept(written -> {
            if (written) {
                logger.debug("Volatile tier re-populated: {}", key);
            }
        });
    }

    private boolean populateIfCurrent(String key, Object value, Duration ttl, long generation) {
        if (invalidationGeneration.get() != generation) {
            logger.debug("Skipping re-population of {}, invalidated during lookup", key);
            return false;
        }
        boolean written = codec.encode(value, ttl)
                .map(json -> volatileCache.set(key, json, ttl))
                .orElse(false);
        if (written && invalidationGeneration.get() != generation) {
            // An invalidation may have deleted the key before this write landed
            volatileCache.delete(key);
            return false;
        }
        return written;
    }

    private static Duration effectiveTtl(Duration override, Duration fallbackTtl) {
        if (override == null || override.isZero() || override.isNegative()) {
            return fallbackTtl;
        }
        return override;
    }

    private static <T> Optional<List<T>> nonEmpty(List<T> values) {
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }
}
