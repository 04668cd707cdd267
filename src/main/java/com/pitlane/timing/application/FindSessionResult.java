package com.pitlane.timing.application;

import com.pitlane.timing.domain.model.SessionResult;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read-through access to one session's results: cached tiers first, then the remote origin.
 */
public interface FindSessionResult {

    /**
     * @return the session results, or empty when neither the cache nor the origin has them
     */
    CompletableFuture<Optional<SessionResult>> execute(int year, int round, String sessionKey);
}
