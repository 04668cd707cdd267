package com.pitlane.timing.infrastructure.web;

import com.pitlane.timing.application.FindSchedule;
import com.pitlane.timing.application.FindSessionResult;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.HealthStatus;
import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.domain.port.in.CacheStatusService;
import com.pitlane.timing.domain.port.in.RecordLookup;
import com.pitlane.timing.domain.port.in.RecordStore;
import com.pitlane.timing.infrastructure.web.dto.CacheStatsResponse;
import com.pitlane.timing.infrastructure.web.dto.EventSessionsResponse;
import com.pitlane.timing.infrastructure.web.dto.HealthResponse;
import com.pitlane.timing.infrastructure.web.dto.OperationResponse;
import com.pitlane.timing.infrastructure.web.dto.ScheduleResponse;
import com.pitlane.timing.infrastructure.web.dto.SeasonsResponse;
import com.pitlane.timing.infrastructure.web.dto.SessionResultResponse;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimingController {

    private static final Logger logger = LoggerFactory.getLogger(TimingController.class);

    private final FindSessionResult findSessionResult;
    private final FindSchedule findSchedule;
    private final RecordLookup recordLookup;
    private final RecordStore recordStore;
    private final CacheStatusService cacheStatus;
    private final Clock clock;

    public TimingController(FindSessionResult findSessionResult,
                            FindSchedule findSchedule,
                            RecordLookup recordLookup,
                            RecordStore recordStore,
                            CacheStatusService cacheStatus,
                            Clock clock) {
        this.findSessionResult = findSessionResult;
        this.findSchedule = findSchedule;
        this.recordLookup = recordLookup;
        this.recordStore = recordStore;
        this.cacheStatus = cacheStatus;
        this.clock = clock;
    }

    @GetMapping("/sessions/{year}/{round}/{sessionKey}")
    public CompletableFuture<ResponseEntity<SessionResultResponse>> getSession(
            @PathVariable("year") @Min(1950) int year,
            @PathVariable("round") @Min(0) int round,
            @PathVariable("sessionKey") String sessionKey
    ) {
        logger.info("Fetching session {}_{}_{}", year, round, sessionKey);

        return findSessionResult.execute(year, round, sessionKey)
                .thenApply(result -> result
                        .map(SessionResultResponse::fromResult)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @GetMapping("/schedules/{year}")
    public CompletableFuture<ResponseEntity<ScheduleResponse>> getSchedule(
            @PathVariable("year") @Min(1950) int year
    ) {
        logger.info("Fetching schedule for {}", year);

        return findSchedule.execute(year)
                .thenApply(events -> {
                    if (events.isEmpty()) {
                        return ResponseEntity.notFound().<ScheduleResponse>build();
                    }
                    return ResponseEntity.ok(ScheduleResponse.fromEvents(year, events, today()));
                });
    }

    @GetMapping("/events/{year}/{round}/sessions")
    public CompletableFuture<ResponseEntity<EventSessionsResponse>> getEventSessions(
            @PathVariable("year") @Min(1950) int year,
            @PathVariable("round") @Min(0) int round
    ) {
        String eventId = Event.idFor(year, round);
        return recordLookup.lookupEventSessions(year, round)
                .thenApply(sessions -> ResponseEntity.ok(
                        EventSessionsResponse.fromSummaries(eventId, sessions.orElse(List.of()))));
    }

    @GetMapping("/seasons")
    public CompletableFuture<ResponseEntity<SeasonsResponse>> getSeasons() {
        return recordLookup.lookupSeasons()
                .thenApply(seasons -> ResponseEntity.ok(new SeasonsResponse(seasons)));
    }

    @DeleteMapping("/cache/sessions/{year}/{round}/{sessionKey}")
    public CompletableFuture<ResponseEntity<OperationResponse>> invalidateSession(
            @PathVariable("year") @Min(1950) int year,
            @PathVariable("round") @Min(0) int round,
            @PathVariable("sessionKey") String sessionKey
    ) {
        logger.info("Invalidating session {}_{}_{}", year, round, sessionKey);
        return recordStore.invalidateSession(year, round, sessionKey).thenApply(TimingController::toResponse);
    }

    @DeleteMapping("/cache/events/{year}/{round}")
    public CompletableFuture<ResponseEntity<OperationResponse>> invalidateEvent(
            @PathVariable("year") @Min(1950) int year,
            @PathVariable("round") @Min(0) int round
    ) {
        logger.info("Invalidating event {}_{}", year, round);
        return recordStore.invalidateEvent(year, round).thenApply(TimingController::toResponse);
    }

    @DeleteMapping("/cache")
    public CompletableFuture<ResponseEntity<OperationResponse>> clearCache() {
        logger.info("Clearing volatile cache");
        return recordStore.clearAll().thenApply(TimingController::toResponse);
    }

    @GetMapping("/cache/stats")
    public CompletableFuture<ResponseEntity<CacheStatsResponse>> getStats() {
        return cacheStatus.stats()
                .thenApply(report -> ResponseEntity.ok(CacheStatsResponse.fromReport(report)));
    }

    @GetMapping("/cache/health")
    public CompletableFuture<ResponseEntity<HealthResponse>> getHealth() {
        return cacheStatus.healthCheck()
                .thenApply(report -> {
                    HttpStatus status = report.status() == HealthStatus.ERROR
                            ? HttpStatus.SERVICE_UNAVAILABLE
                            : HttpStatus.OK;
                    return ResponseEntity.status(status).body(HealthResponse.fromReport(report));
                });
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<OperationResponse> handleInvalidRequest(IllegalArgumentException e) {
        logger.warn("Invalid request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(OperationResponse.invalid(e.getMessage()));
    }

    private static ResponseEntity<OperationResponse> toResponse(StoreOutcome outcome) {
        OperationResponse body = OperationResponse.fromOutcome(outcome);
        return outcome.success()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
