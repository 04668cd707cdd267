package com.pitlane.timing.infrastructure.adapter.origin;

import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.port.out.TimingOrigin;
import com.pitlane.timing.infrastructure.adapter.mapper.ErgastMapper;
import com.pitlane.timing.infrastructure.adapter.origin.json.ErgastResponse;
import com.pitlane.timing.infrastructure.adapter.origin.json.RaceJson;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Call;
import retrofit2.Response;

/**
 * Remote origin backed by the Jolpica-Ergast API. Races ({@code R}), qualifying ({@code Q})
 * and sprints ({@code S}) are available; other session codes are reported as unavailable.
 */
@Component
public class ErgastOriginClient implements TimingOrigin {

    private static final Logger logger = LoggerFactory.getLogger(ErgastOriginClient.class);

    private static final int PAGE_LIMIT = 100;

    private final ErgastTimingApi api;
    private final ErgastMapper mapper;

    public ErgastOriginClient(ErgastTimingApi api, ErgastMapper mapper) {
        this.api = api;
        this.mapper = mapper;
    }

    @Override
    @CircuitBreaker(name = "timing-origin", fallbackMethod = "fallbackFetchSessionResult")
    @Retry(name = "timing-origin")
    @TimeLimiter(name = "timing-origin")
    public CompletableFuture<Optional<SessionResult>> fetchSessionResult(SessionId sessionId) {
        return CompletableFuture.supplyAsync(() -> {
            int year = sessionId.year();
            int round = sessionId.round();

            return switch (sessionId.sessionKey()) {
                case "R" -> firstRace(execute(api.fetchRaceResults(year, round, PAGE_LIMIT)))
                        .flatMap(race -> mapper.mapClassification(sessionId, "Race", race.results()));
                case "S" -> firstRace(execute(api.fetchSprintResults(year, round, PAGE_LIMIT)))
                        .flatMap(race -> mapper.mapClassification(sessionId, "Sprint", race.sprintResults()));
                case "Q" -> firstRace(execute(api.fetchQualifyingResults(year, round, PAGE_LIMIT)))
                        .flatMap(race -> mapper.mapQualifying(sessionId, race.qualifyingResults()));
                default -> {
                    logger.debug("Session {} is not served by the origin", sessionId);
                    yield Optional.<SessionResult>empty();
                }
            };
        });
    }

    @Override
    @CircuitBreaker(name = "timing-origin", fallbackMethod = "fallbackFetchSchedule")
    @Retry(name = "timing-origin")
    @TimeLimiter(name = "timing-origin")
    public CompletableFuture<List<Event>> fetchSchedule(int year) {
        return CompletableFuture.supplyAsync(() -> {
            logger.debug("Fetching {} schedule from origin", year);
            ErgastResponse response = execute(api.fetchSchedule(year, PAGE_LIMIT));
            if (response == null) {
                return Collections.<Event>emptyList();
            }
            return mapper.mapSchedule(year, response.races());
        });
    }

    public CompletableFuture<Optional<SessionResult>> fallbackFetchSessionResult(SessionId sessionId, Exception ex) {
        logger.warn("Fallback triggered fetching {} from origin: {}", sessionId, ex.getMessage());
        return CompletableFuture.completedFuture(Optional.empty());
    }

    public CompletableFuture<List<Event>> fallbackFetchSchedule(int year, Exception ex) {
        logger.warn("Fallback triggered fetching {} schedule from origin: {}", year, ex.getMessage());
        return CompletableFuture.completedFuture(Collections.emptyList());
    }

    /**
     * @return the body, or null when the origin answered without one
     */
    private ErgastResponse execute(Call<ErgastResponse> call) {
        try {
            Response<ErgastResponse> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            if (response.code() >= 500) {
                throw new OriginUnavailableException("Origin answered " + response.code());
            }
            logger.warn("Origin answered {} for {}", response.code(), call.request().url());
            return null;
        } catch (IOException e) {
            logger.error("Exception calling origin: {}", e.getMessage());
            throw new OriginUnavailableException("Failed to reach timing origin", e);
        }
    }

    private static Optional<RaceJson> firstRace(ErgastResponse response) {
        if (response == null) {
            return Optional.empty();
        }
        return response.races().stream().findFirst();
    }
}
