package com.pitlane.timing.domain.port.out;

import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Slow remote source of timing data.
 */
public interface TimingOrigin {

    /**
     * @return the session results, or empty when the origin cannot provide them
     */
    CompletableFuture<Optional<SessionResult>> fetchSessionResult(SessionId sessionId);

    /**
     * @return the season schedule ordered by round, empty when unavailable
     */
    CompletableFuture<List<Event>> fetchSchedule(int year);
}
