package com.pitlane.timing.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.infrastructure.config.DurableStoreConfig;
import com.pitlane.timing.infrastructure.config.DurableStoreProperties;
import com.pitlane.timing.support.MutableClock;
import com.pitlane.timing.support.TimingFixtures;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcDurableStoreIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-05-05T12:00:00Z");

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private MutableClock clock;
    private JdbcDurableStore store;

    @BeforeEach
    void setUp() {
        DurableStoreProperties properties = new DurableStoreProperties();
        properties.setPath(tempDir.resolve("timing.db").toString());
        dataSource = new HikariDataSource(DurableStoreConfig.hikariConfig(properties));

        Flyway.configure().dataSource(dataSource).load().migrate();

        jdbcTemplate = new JdbcTemplate(dataSource);
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        clock = new MutableClock(NOW);

        store = new JdbcDurableStore(jdbcTemplate, new DataSourceTransactionManager(dataSource), objectMapper, clock);
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void shouldListSeasonsMostRecentFirst() {
        // When
        StoreOutcome outcome = store.upsertSeasons(List.of(2022, 2024, 2023, 2024));

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(store.listSeasons()).containsExactly(2024, 2023, 2022);
    }

    @Test
    void shouldUpsertEventsAndCreateTheirSeason() {
        // Given
        List<Event> schedule = TimingFixtures.schedule(2024, 3);

        // When
        StoreOutcome outcome = store.upsertEvents(List.of(schedule.get(2), schedule.get(0), schedule.get(1)));

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(store.listEventsByYear(2024)).containsExactlyElementsOf(schedule);
        assertThat(store.listSeasons()).containsExactly(2024);
        assertThat(store.getEvent("2024_2")).contains(schedule.get(1));
    }

    @Test
    void shouldReplaceEventWithSameRound() {
        // Given
        Event original = Event.of(2024, 5, "Chinese Grand Prix", LocalDate.of(2024, 4, 21), "China", "Shanghai");
        Event renamed = Event.of(2024, 5, "Chinese GP", LocalDate.of(2024, 4, 21), "China", "Shanghai");
        store.upsertEvent(original);

        // When
        store.upsertEvent(renamed);

        // Then
        assertThat(store.listEventsByYear(2024)).containsExactly(renamed);
    }

    @Test
    void shouldSnapshotStatusAtWriteTime() {
        store.upsertEvent(Event.of(2024, 1, "Bahrain Grand Prix", LocalDate.of(2024, 3, 2), "Bahrain", "Sakhir"));

        String status = jdbcTemplate.queryForObject(
                "SELECT status FROM events WHERE event_id = '2024_1'", String.class);

        assertThat(status).isEqualTo("completed");
    }

    @Test
    void shouldRollBackWholeBatchOnFailure() {
        // Given - the third round of the batch is rejected by the database
        jdbcTemplate.execute("CREATE TRIGGER reject_round_3 BEFORE INSERT ON events "
                + "WHEN NEW.round_number = 3 BEGIN SELECT RAISE(ABORT, 'rejected'); END");

        // When
        StoreOutcome outcome = store.upsertEvents(TimingFixtures.schedule(2024, 3));

        // Then
        assertThat(outcome.failed()).isTrue();
        assertThat(store.listEventsByYear(2024)).isEmpty();
    }

    @Test
    void shouldRoundTripSessionResult() {
        // Given
        SessionResult result = TimingFixtures.raceResult(2024, 5)
                .withTimestamps(NOW.minusSeconds(60), NOW);

        // When
        StoreOutcome outcome = store.upsertSessionResult(result);

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(store.getSessionResult("2024_5_R")).contains(result);
        assertThat(store.sessionExists("2024_5_R")).isTrue();
        assertThat(store.sessionExists("2024_5_Q")).isFalse();
    }

    @Test
    void shouldKeepOneRowPerSession() {
        // Given
        SessionResult first = TimingFixtures.raceResult(2024, 5).withTimestamps(NOW, NOW);
        SessionResult second = SessionResult.of(SessionId.of(2024, 5, "R"), "Race", "race",
                List.of(List.of(1, "LEC")), List.of(), List.of("Pos", "Driver"))
                .withTimestamps(NOW.plusSeconds(10), NOW.plusSeconds(10));

        // When
        store.upsertSessionResult(first);
        store.upsertSessionResult(first);
        store.upsertSessionResult(second);

        // Then
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM session_results WHERE session_id = '2024_5_R'", Integer.class);
        assertThat(rows).isEqualTo(1);
        assertThat(store.getSessionResult("2024_5_R")).contains(second);
    }

    @Test
    void shouldTreatCorruptPayloadAsMissing() {
        // Given
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 5).withTimestamps(NOW, NOW));
        jdbcTemplate.update("UPDATE session_results SET data_json = '{broken' WHERE session_id = '2024_5_R'");

        // Then
        assertThat(store.getSessionResult("2024_5_R")).isEmpty();
    }

    @Test
    void shouldListAndDeleteSessionsOfAnEvent() {
        // Given
        store.upsertSessionResult(TimingFixtures.sessionResult(SessionId.of(2024, 5, "FP1"), "Practice 1", "practice")
                .withTimestamps(NOW, NOW));
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 5).withTimestamps(NOW, NOW));
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 6).withTimestamps(NOW, NOW));

        // When
        List<SessionSummary> sessions = store.listSessionsForEvent("2024_5");
        StoreOutcome deleted = store.deleteSessionsForEvent("2024_5");

        // Then
        assertThat(sessions).extracting(SessionSummary::sessionKey).containsExactly("FP1", "R");
        assertThat(deleted.success()).isTrue();
        assertThat(store.listSessionsForEvent("2024_5")).isEmpty();
        assertThat(store.sessionExists("2024_6_R")).isTrue();
    }

    @Test
    void shouldSucceedDeletingUnknownSession() {
        assertThat(store.deleteSession("1999_1_R").success()).isTrue();
    }

    @Test
    void shouldPurgeOnlySessionsOlderThanRetention() {
        // Given
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 1).withTimestamps(NOW.minus(Duration.ofDays(40)), NOW));
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 2).withTimestamps(NOW.minus(Duration.ofDays(10)), NOW));
        store.upsertEvents(TimingFixtures.schedule(2024, 2));

        // When
        int purged = store.purgeOlderThan(30);

        // Then
        assertThat(purged).isEqualTo(1);
        assertThat(store.sessionExists("2024_1_R")).isFalse();
        assertThat(store.sessionExists("2024_2_R")).isTrue();
        assertThat(store.listEventsByYear(2024)).hasSize(2);
    }

    @Test
    void shouldReportStats() {
        // Given
        store.upsertEvents(TimingFixtures.schedule(2024, 2));
        store.upsertSeason(2023);
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 1).withTimestamps(NOW, NOW));
        store.upsertSessionResult(TimingFixtures.raceResult(2023, 1).withTimestamps(NOW, NOW));
        store.upsertSessionResult(TimingFixtures.raceResult(2024, 2).withTimestamps(NOW, NOW));

        // When
        DurableStoreStats stats = store.stats();

        // Then
        assertThat(stats.seasons()).isEqualTo(2);
        assertThat(stats.events()).isEqualTo(2);
        assertThat(stats.sessions()).isEqualTo(3);
        assertThat(stats.sessionsByYear()).containsEntry(2024, 2L).containsEntry(2023, 1L);
        assertThat(stats.sizeBytes()).isPositive();
    }

    @Test
    void shouldKeepOneRowUnderConcurrentWrites() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<SessionResult> versions = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            versions.add(SessionResult.of(SessionId.of(2024, 5, "R"), "Race", "race",
                            List.of(List.of(i, "VER")), List.of(), List.of("Pos", "Driver"))
                    .withTimestamps(NOW, NOW));
        }

        // When
        List<CompletableFuture<StoreOutcome>> writes = versions.stream()
                .map(version -> CompletableFuture.supplyAsync(() -> store.upsertSessionResult(version), executor))
                .toList();
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertThat(writes).allSatisfy(write -> assertThat(write.join().success()).isTrue());
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM session_results", Integer.class);
        assertThat(rows).isEqualTo(1);
        assertThat(versions).contains(store.getSessionResult("2024_5_R").orElseThrow());
    }
}
