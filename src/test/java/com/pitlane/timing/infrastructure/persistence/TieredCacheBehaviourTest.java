package com.pitlane.timing.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.infrastructure.cache.CacheKeys;
import com.pitlane.timing.infrastructure.cache.InProcessTtlCache;
import com.pitlane.timing.infrastructure.cache.PayloadCodec;
import com.pitlane.timing.infrastructure.cache.RedisVolatileCache;
import com.pitlane.timing.infrastructure.cache.TimingCacheProperties;
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
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Both tiers for real: SQLite on disk and the volatile tier running on its in-process fallback.
 */
class TieredCacheBehaviourTest {

    private static final Instant NOW = Instant.parse("2024-05-05T12:00:00Z");

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private ExecutorService executor;
    private MutableClock clock;
    private JdbcDurableStore durableStore;
    private RedisVolatileCache volatileCache;
    private CacheAsideCoordinator coordinator;

    @BeforeEach
    void setUp() {
        DurableStoreProperties storeProperties = new DurableStoreProperties();
        storeProperties.setPath(tempDir.resolve("timing.db").toString());
        dataSource = new HikariDataSource(DurableStoreConfig.hikariConfig(storeProperties));
        Flyway.configure().dataSource(dataSource).load().migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        clock = new MutableClock(NOW);
        executor = Executors.newFixedThreadPool(8);

        TimingCacheProperties cacheProperties = new TimingCacheProperties();
        cacheProperties.setRedisEnabled(false);

        durableStore = new JdbcDurableStore(jdbcTemplate, new DataSourceTransactionManager(dataSource),
                objectMapper, clock);
        volatileCache = new RedisVolatileCache(new StringRedisTemplate(), new InProcessTtlCache(clock), cacheProperties);
        volatileCache.connect();

        coordinator = new CacheAsideCoordinator(volatileCache, durableStore, new PayloadCodec(objectMapper, clock),
                new CacheKeys("f1dash"), cacheProperties, executor, clock);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
        dataSource.close();
    }

    @Test
    void shouldReturnWhatWasStored() {
        // Given
        SessionResult result = TimingFixtures.raceResult(2024, 5);

        // When
        coordinator.storeSessionResult(result).join();

        // Then
        assertThat(coordinator.lookupSessionResult(2024, 5, "R").join())
                .contains(result.withTimestamps(NOW, NOW));
    }

    @Test
    void shouldReturnWhatWasStoredOnceOnlyTheDurableTierHasIt() {
        // Given
        SessionResult result = TimingFixtures.raceResult(2024, 5);
        coordinator.storeSessionResult(result).join();

        // When
        coordinator.clearAll().join();

        // Then
        assertThat(volatileCache.get("f1dash:session:2024:5:R")).isEmpty();
        assertThat(durableStore.getSessionResult("2024_5_R")).isPresent();
        assertThat(coordinator.lookupSessionResult(2024, 5, "R").join())
                .contains(result.withTimestamps(NOW, NOW));
    }

    @Test
    void shouldKeepOneDurableRowForRepeatedStores() {
        // Given
        SessionResult result = TimingFixtures.raceResult(2024, 5);

        // When
        coordinator.storeSessionResult(result).join();
        coordinator.storeSessionResult(result).join();

        // Then
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM session_results WHERE session_id = '2024_5_R'", Integer.class);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void shouldExpireVolatileCopyButKeepDurableCopy() {
        // Given
        coordinator.storeSessionResult(TimingFixtures.raceResult(2024, 5), Duration.ofSeconds(1)).join();

        // When
        clock.advance(Duration.ofSeconds(2));

        // Then
        assertThat(volatileCache.get("f1dash:session:2024:5:R")).isEmpty();
        assertThat(coordinator.lookupSessionResult(2024, 5, "R").join()).isPresent();
        assertThat(coordinator.lookupStats().durableHits()).isEqualTo(1);
    }

    @Test
    void shouldInvalidateOnlyTheTargetedEvent() {
        // Given
        coordinator.storeSessionResult(TimingFixtures.sessionResult(SessionId.of(2024, 5, "FP1"), "Practice 1", "practice")).join();
        coordinator.storeSessionResult(TimingFixtures.raceResult(2024, 5)).join();
        coordinator.storeSessionResult(TimingFixtures.raceResult(2024, 6)).join();
        coordinator.storeSchedule(2024, TimingFixtures.schedule(2024, 6)).join();
        assertThat(coordinator.lookupEventSessions(2024, 5).join()).hasValueSatisfying(list -> assertThat(list).hasSize(2));
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> volatileCache.get("f1dash:event:2024:5").isPresent());

        // When
        StoreOutcome outcome = coordinator.invalidateEvent(2024, 5).join();

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(coordinator.lookupSessionResult(2024, 5, "FP1").join()).isEmpty();
        assertThat(coordinator.lookupSessionResult(2024, 5, "R").join()).isEmpty();
        assertThat(coordinator.lookupEventSessions(2024, 5).join()).isEmpty();
        assertThat(coordinator.lookupSessionResult(2024, 6, "R").join()).isPresent();
        assertThat(coordinator.lookupSchedule(2024).join()).hasValueSatisfying(events -> assertThat(events).hasSize(6));
    }

    @Test
    void shouldInvalidateMissingSessionAsNoOp() {
        StoreOutcome outcome = coordinator.invalidateSession(2024, 9, "Q").join();

        assertThat(outcome.success()).isTrue();
    }

    @Test
    void shouldDropEventSessionListWhenSessionIsStored() {
        // Given
        coordinator.storeSessionResult(TimingFixtures.raceResult(2024, 5)).join();
        coordinator.lookupEventSessions(2024, 5).join();
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> volatileCache.get("f1dash:event:2024:5").isPresent());

        // When
        coordinator.storeSessionResult(TimingFixtures.sessionResult(SessionId.of(2024, 5, "Q"), "Qualifying", "qualifying")).join();

        // Then
        assertThat(volatileCache.get("f1dash:event:2024:5")).isEmpty();
        assertThat(coordinator.lookupEventSessions(2024, 5).join())
                .hasValueSatisfying(list -> assertThat(list).hasSize(2));
    }

    @Test
    void shouldConvergeOnOneWrittenValueUnderConcurrentStores() {
        // Given
        List<SessionResult> versions = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            versions.add(SessionResult.of(SessionId.of(2024, 5, "R"), "Race", "race",
                    List.of(List.of(i, "VER")), List.of(), List.of("Pos", "Driver")));
        }

        // When
        List<CompletableFuture<StoreOutcome>> writes = versions.stream()
                .map(coordinator::storeSessionResult)
                .toList();
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

        // Then
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM session_results", Integer.class);
        assertThat(rows).isEqualTo(1);
        SessionResult stored = durableStore.getSessionResult("2024_5_R").orElseThrow();
        assertThat(versions.stream().map(version -> version.withTimestamps(NOW, NOW)).toList()).contains(stored);
    }
}
