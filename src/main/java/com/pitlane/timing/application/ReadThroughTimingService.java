package com.pitlane.timing.application;

import com.pitlane.timing.domain.ScheduleCompletenessPolicy;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.port.in.RecordLookup;
import com.pitlane.timing.domain.port.in.RecordStore;
import com.pitlane.timing.domain.port.out.TimingOrigin;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lookup, then origin on a miss, then store. Concurrent misses for the same session or
 * season share one origin fetch.
 */
@Service
public class ReadThroughTimingService implements FindSessionResult, FindSchedule {

    private static final Logger logger = LoggerFactory.getLogger(ReadThroughTimingService.class);

    private final RecordLookup recordLookup;
    private final RecordStore recordStore;
    private final TimingOrigin origin;
    private final ScheduleCompletenessPolicy completenessPolicy;

    private final SingleFlight<String, Optional<SessionResult>> sessionFlights = new SingleFlight<>();
    private final SingleFlight<Integer, List<Event>> scheduleFlights = new SingleFlight<>();

    public ReadThroughTimingService(RecordLookup recordLookup,
                                    RecordStore recordStore,
                                    TimingOrigin origin,
                                    ScheduleCompletenessPolicy completenessPolicy) {
        this.recordLookup = recordLookup;
        this.recordStore = recordStore;
        this.origin = origin;
        this.completenessPolicy = completenessPolicy;
    }

    @Override
    public CompletableFuture<Optional<SessionResult>> execute(int year, int round, String sessionKey) {
        SessionId id = SessionId.of(year, round, sessionKey);
        return sessionFlights.execute(id.value(), () -> readThroughSession(id));
    }

    @Override
    public CompletableFuture<List<Event>> execute(int year) {
        return scheduleFlights.execute(year, () -> readThroughSchedule(year));
    }

    private CompletableFuture<Optional<SessionResult>> readThroughSession(SessionId id) {
        return recordLookup.lookupSessionResult(id.year(), id.round(), id.sessionKey())
                .thenCompose(cached -> {
                    if (cached.isPresent()) {
                        return CompletableFuture.completedFuture(cached);
                    }

                    logger.debug("Session {} not cached, fetching from origin", id);
                    return origin.fetchSessionResult(id)
                            .exceptionally(e -> {
                                logger.warn("Origin fetch of {} failed: {}", id, e.getMessage());
                                return Optional.empty();
                            })
                            .thenCompose(fetched -> fetched
                                    .map(result -> recordStore.storeSessionResult(result)
                                            .thenApply(outcome -> {
                                                if (outcome.failed()) {
                                                    logger.warn("Fetched {} but could not store it: {}",
                                                            id, outcome.detail());
                                                }
                                                return fetched;
                                            }))
                                    .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty())));
                });
    }

    private CompletableFuture<List<Event>> readThroughSchedule(int year) {
        return recordLookup.lookupSchedule(year).thenCompose(cached -> {
            int stored = cached.map(List::size).orElse(0);
            if (cached.isPresent() && completenessPolicy.isComplete(year, stored)) {
                return CompletableFuture.completedFuture(cached.get());
            }

            logger.debug("Schedule {} has {} of {} expected races, refreshing from origin",
                    year, stored, completenessPolicy.minimumRaces(year));
            return origin.fetchSchedule(year)
                    .exceptionally(e -> {
                        logger.warn("Origin fetch of {} schedule failed: {}", year, e.getMessage());
                        return List.of();
                    })
                    .thenCompose(fresh -> {
                        if (fresh.isEmpty()) {
                            return CompletableFuture.completedFuture(cached.orElse(List.of()));
                        }
                        return recordStore.storeSchedule(year, fresh).thenApply(outcome -> fresh);
                    });
        });
    }
}
