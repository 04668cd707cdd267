package com.pitlane.timing.domain.port.in;

import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.StoreOutcome;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Write side of the tiered cache.
 * The durable tier is always written first; the volatile tier is best-effort and never turns
 * a durable success into a failure.
 */
public interface RecordStore {

    CompletableFuture<StoreOutcome> storeSessionResult(SessionResult result);

    /**
     * @param ttlOverride volatile-tier TTL for this entry; null, zero or negative means the default TTL
     */
    CompletableFuture<StoreOutcome> storeSessionResult(SessionResult result, Duration ttlOverride);

    CompletableFuture<StoreOutcome> storeSchedule(int year, List<Event> events);

    /**
     * @param ttlOverride volatile-tier TTL for this schedule; null, zero or negative means the schedule TTL
     */
    CompletableFuture<StoreOutcome> storeSchedule(int year, List<Event> events, Duration ttlOverride);

    /**
     * Removes one session from both tiers. Invalidating an unknown session succeeds.
     */
    CompletableFuture<StoreOutcome> invalidateSession(int year, int round, String sessionKey);

    /**
     * Removes every session of an event, and the event's session list, from both tiers.
     */
    CompletableFuture<StoreOutcome> invalidateEvent(int year, int round);

    /**
     * Empties the volatile tier (and its in-process fallback). Durable history is untouched.
     */
    CompletableFuture<StoreOutcome> clearAll();

    /**
     * Retention sweep over durable session results.
     *
     * @return number of session results deleted
     */
    CompletableFuture<Integer> purgeOlderThan(int days);
}
