package com.pitlane.timing.domain.port.in;

import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read side of the tiered cache.
 * An empty result is a miss in every tier; callers are expected to go to the remote origin
 * and hand the fresh value back through {@link RecordStore}.
 */
public interface RecordLookup {

    /**
     * Looks a session up in the volatile tier, then in the durable tier.
     * A durable hit re-populates the volatile tier in the background.
     */
    CompletableFuture<Optional<SessionResult>> lookupSessionResult(int year, int round, String sessionKey);

    /**
     * Season schedule ordered by round. Served from the same two tiers as sessions.
     */
    CompletableFuture<Optional<List<Event>>> lookupSchedule(int year);

    /**
     * Summaries of the sessions stored for one event.
     */
    CompletableFuture<Optional<List<SessionSummary>>> lookupEventSessions(int year, int round);

    /**
     * Known seasons, most recent first. Durable tier only.
     */
    CompletableFuture<List<Integer>> lookupSeasons();
}
