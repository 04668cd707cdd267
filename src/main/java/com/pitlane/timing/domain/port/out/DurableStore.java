package com.pitlane.timing.domain.port.out;

import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import com.pitlane.timing.domain.model.StoreOutcome;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier holding seasons, events and session results.
 * <p>
 * Upserts replace by key and never duplicate rows. Multi-row writes are a single
 * transaction. Failures are logged and reported, never thrown: callers treat them as
 * "no durable record".
 */
public interface DurableStore {

    StoreOutcome upsertSeason(int year);

    StoreOutcome upsertSeasons(Collection<Integer> years);

    /**
     * @return seasons, most recent first
     */
    List<Integer> listSeasons();

    StoreOutcome upsertEvent(Event event);

    /**
     * Upserts the events and their seasons in one transaction.
     */
    StoreOutcome upsertEvents(List<Event> events);

    /**
     * @return events of the season ordered by round
     */
    List<Event> listEventsByYear(int year);

    Optional<Event> getEvent(String eventId);

    StoreOutcome upsertSessionResult(SessionResult result);

    Optional<SessionResult> getSessionResult(String sessionId);

    boolean sessionExists(String sessionId);

    List<SessionSummary> listSessionsForEvent(String eventId);

    StoreOutcome deleteSession(String sessionId);

    StoreOutcome deleteSessionsForEvent(String eventId);

    /**
     * @return number of session results fetched more than {@code days} ago that were deleted
     */
    int purgeOlderThan(int days);

    DurableStoreStats stats();
}
