package com.pitlane.timing.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitlane.timing.domain.model.DriverEntry;
import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.ErrorKind;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.domain.port.out.DurableStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite implementation of the durable tier.
 * <p>
 * One logical write is one transaction, and writes from this process are serialized by a
 * lock so concurrent upserts never race on the database file. Reads run without the lock.
 */
@Repository
public class JdbcDurableStore implements DurableStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcDurableStore.class);

    private static final TypeReference<List<List<Object>>> ROWS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<DriverEntry>> DRIVERS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> COLUMNS_TYPE = new TypeReference<>() {};

    private static final String UPSERT_SEASON_SQL = """
            INSERT INTO seasons (year, created_at, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT (year) DO UPDATE SET updated_at = excluded.updated_at
            """;

    // REPLACE also resolves a (year, round_number) clash with a differently named event
    private static final String UPSERT_EVENT_SQL = """
            INSERT OR REPLACE INTO events (
                event_id, year, round_number, event_name, event_date, country, location,
                status, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?,
                COALESCE((SELECT created_at FROM events WHERE event_id = ?), ?), ?)
            """;

    private static final String UPSERT_SESSION_SQL = """
            INSERT INTO session_results (
                session_id, event_id, year, session_key, session_name, session_type,
                data_json, drivers_json, columns_json, fetched_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id) DO UPDATE SET
                event_id = excluded.event_id,
                year = excluded.year,
                session_key = excluded.session_key,
                session_name = excluded.session_name,
                session_type = excluded.session_type,
                data_json = excluded.data_json,
                drivers_json = excluded.drivers_json,
                columns_json = excluded.columns_json,
                fetched_at = excluded.fetched_at,
                updated_at = excluded.updated_at
            """;

    private static final String EVENT_COLUMNS =
            "event_id, year, round_number, event_name, event_date, country, location";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcDurableStore(JdbcTemplate jdbcTemplate,
                            PlatformTransactionManager transactionManager,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ===== Seasons =====

    @Override
    public StoreOutcome upsertSeason(int year) {
        return upsertSeasons(List.of(year));
    }

    @Override
    public StoreOutcome upsertSeasons(Collection<Integer> years) {
        if (years.isEmpty()) {
            return StoreOutcome.ok();
        }
        long now = clock.millis();
        List<Object[]> batch = years.stream()
                .distinct()
                .map(year -> new Object[] {year, now, now})
                .toList();

        return write("saving seasons " + years, () -> jdbcTemplate.batchUpdate(UPSERT_SEASON_SQL, batch));
    }

    @Override
    public List<Integer> listSeasons() {
        try {
            return jdbcTemplate.queryForList("SELECT year FROM seasons ORDER BY year DESC", Integer.class);
        } catch (DataAccessException e) {
            logger.error("Error listing seasons", e);
            return Collections.emptyList();
        }
    }

    // ===== Events =====

    @Override
    public StoreOutcome upsertEvent(Event event) {
        return upsertEvents(List.of(event));
    }

    @Override
    public StoreOutcome upsertEvents(List<Event> events) {
        if (events.isEmpty()) {
            logger.debug("No events to save");
            return StoreOutcome.ok();
        }

        long now = clock.millis();
        LocalDate today = LocalDate.ofInstant(clock.instant(), clock.getZone());

        List<Object[]> seasons = events.stream()
                .map(Event::year)
                .distinct()
                .map(year -> new Object[] {year, now, now})
                .toList();

        List<Object[]> rows = events.stream()
                .map(event -> new Object[] {
                        event.eventId(),
                        event.year(),
                        event.roundNumber(),
                        event.name(),
                        event.date() != null ? event.date().toString() : null,
                        event.country(),
                        event.location(),
                        event.statusOn(today).label(),
                        event.eventId(),
                        now,
                        now
                })
                .toList();

        StoreOutcome outcome = write("saving " + events.size() + " events", () -> {
            jdbcTemplate.batchUpdate(UPSERT_SEASON_SQL, seasons);
            jdbcTemplate.batchUpdate(UPSERT_EVENT_SQL, rows);
        });
        if (outcome.success()) {
            logger.debug("Saved {} events", events.size());
        }
        return outcome;
    }

    @Override
    public List<Event> listEventsByYear(int year) {
        try {
            return jdbcTemplate.query(
                    "SELECT " + EVENT_COLUMNS + " FROM events WHERE year = ? ORDER BY round_number",
                    this::mapEvent, year);
        } catch (DataAccessException e) {
            logger.error("Error getting events for year {}", year, e);
            return Collections.emptyList();
        }
    }

    @Override
    public Optional<Event> getEvent(String eventId) {
        try {
            return jdbcTemplate.query(
                    "SELECT " + EVENT_COLUMNS + " FROM events WHERE event_id = ?",
                    this::mapEvent, eventId).stream().findFirst();
        } catch (DataAccessException e) {
            logger.error("Error getting event {}", eventId, e);
            return Optional.empty();
        }
    }

    // ===== Session results =====

    @Override
    public StoreOutcome upsertSessionResult(SessionResult result) {
        String rowsJson;
        String driversJson;
        String columnsJson;
        try {
            rowsJson = objectMapper.writeValueAsString(result.rows());
            driversJson = objectMapper.writeValueAsString(result.drivers());
            columnsJson = objectMapper.writeValueAsString(result.columns());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing session results for {}", result.sessionId(), e);
            return StoreOutcome.failure(ErrorKind.SERIALIZATION, e.getOriginalMessage());
        }

        Instant now = clock.instant();
        long fetchedAt = (result.fetchedAt() != null ? result.fetchedAt() : now).toEpochMilli();
        long updatedAt = (result.updatedAt() != null ? result.updatedAt() : now).toEpochMilli();

        return write("saving session results for " + result.sessionId(), () -> jdbcTemplate.update(
                UPSERT_SESSION_SQL,
                result.sessionId(),
                result.eventId(),
                result.year(),
                result.sessionKey(),
                result.sessionName(),
                result.sessionType(),
                rowsJson,
                driversJson,
                columnsJson,
                fetchedAt,
                updatedAt));
    }

    @Override
    public Optional<SessionResult> getSessionResult(String sessionId) {
        List<StoredSession> rows;
        try {
            rows = jdbcTemplate.query("SELECT * FROM session_results WHERE session_id = ?",
                    (rs, rowNum) -> new StoredSession(
                            rs.getString("session_id"),
                            rs.getString("event_id"),
                            rs.getInt("year"),
                            rs.getString("session_key"),
                            rs.getString("session_name"),
                            rs.getString("session_type"),
                            rs.getString("data_json"),
                            rs.getString("drivers_json"),
                            rs.getString("columns_json"),
                            rs.getLong("fetched_at"),
                            rs.getLong("updated_at")),
                    sessionId);
        } catch (DataAccessException e) {
            logger.error("Error getting session results for {}", sessionId, e);
            return Optional.empty();
        }

        if (rows.isEmpty()) {
            return Optional.empty();
        }

        StoredSession row = rows.get(0);
        try {
            return Optional.of(new SessionResult(
                    row.sessionId(),
                    row.eventId(),
                    row.year(),
                    row.sessionKey(),
                    row.sessionName(),
                    row.sessionType(),
                    objectMapper.readValue(row.dataJson(), ROWS_TYPE),
                    row.driversJson() != null ? objectMapper.readValue(row.driversJson(), DRIVERS_TYPE) : List.of(),
                    row.columnsJson() != null ? objectMapper.readValue(row.columnsJson(), COLUMNS_TYPE) : List.of(),
                    Instant.ofEpochMilli(row.fetchedAt()),
                    Instant.ofEpochMilli(row.updatedAt())));
        } catch (JsonProcessingException e) {
            logger.error("Stored session results for {} are unreadable, treating as missing", sessionId, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean sessionExists(String sessionId) {
        try {
            return !jdbcTemplate.queryForList(
                    "SELECT 1 FROM session_results WHERE session_id = ?", Integer.class, sessionId).isEmpty();
        } catch (DataAccessException e) {
            logger.error("Error checking session existence for {}", sessionId, e);
            return false;
        }
    }

    @Override
    public List<SessionSummary> listSessionsForEvent(String eventId) {
        try {
            return jdbcTemplate.query("""
                            SELECT session_id, session_key, session_name, session_type, updated_at
                            FROM session_results
                            WHERE event_id = ?
                            ORDER BY session_id
                            """,
                    (rs, rowNum) -> new SessionSummary(
                            rs.getString("session_id"),
                            rs.getString("session_key"),
                            rs.getString("session_name"),
                            rs.getString("session_type"),
                            Instant.ofEpochMilli(rs.getLong("updated_at"))),
                    eventId);
        } catch (DataAccessException e) {
            logger.error("Error getting sessions for event {}", eventId, e);
            return Collections.emptyList();
        }
    }

    @Override
    public StoreOutcome deleteSession(String sessionId) {
        return write("deleting session " + sessionId,
                () -> jdbcTemplate.update("DELETE FROM session_results WHERE session_id = ?", sessionId));
    }

    @Override
    public StoreOutcome deleteSessionsForEvent(String eventId) {
        return write("deleting sessions of event " + eventId, () -> {
            int deleted = jdbcTemplate.update("DELETE FROM session_results WHERE event_id = ?", eventId);
            logger.debug("Deleted {} stored sessions of event {}", deleted, eventId);
        });
    }

    @Override
    public int purgeOlderThan(int days) {
        if (days < 0) {
            logger.warn("Ignoring retention sweep with negative age: {} days", days);
            return 0;
        }
        long cutoff = clock.instant().minus(Duration.ofDays(days)).toEpochMilli();

        writeLock.lock();
        try {
            int deleted = jdbcTemplate.update("DELETE FROM session_results WHERE fetched_at < ?", cutoff);
            logger.info("Retention sweep removed {} session results older than {} days", deleted, days);
            return deleted;
        } catch (DataAccessException e) {
            logger.error("Error clearing old sessions", e);
            return 0;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public DurableStoreStats stats() {
        try {
            Map<Integer, Long> sessionsByYear = new TreeMap<>();
            jdbcTemplate.query("SELECT year, COUNT(*) AS sessions FROM session_results GROUP BY year",
                    rs -> {
                        sessionsByYear.put(rs.getInt("year"), rs.getLong("sessions"));
                    });

            return new DurableStoreStats(
                    count("seasons"),
                    count("events"),
                    count("session_results"),
                    sessionsByYear,
                    pragma("page_count") * pragma("page_size"));
        } catch (DataAccessException e) {
            logger.error("Error getting database stats", e);
            return DurableStoreStats.empty();
        }
    }

    // ===== Helpers =====

    private StoreOutcome write(String description, Runnable work) {
        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> work.run());
            return StoreOutcome.ok();
        } catch (DataAccessException | TransactionException e) {
            logger.error("Error {}", description, e);
            return StoreOutcome.failure(errorKindOf(e), e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    private static ErrorKind errorKindOf(RuntimeException e) {
        if (e instanceof DataAccessResourceFailureException
                || e instanceof QueryTimeoutException
                || e instanceof CannotCreateTransactionException) {
            return ErrorKind.CONNECTIVITY;
        }
        return ErrorKind.INTERNAL;
    }

    private long count(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0;
    }

    private long pragma(String name) {
        Long value = jdbcTemplate.queryForObject("PRAGMA " + name, Long.class);
        return value != null ? value : 0;
    }

    private Event mapEvent(ResultSet rs, int rowNum) throws SQLException {
        String date = rs.getString("event_date");
        return new Event(
                rs.getString("event_id"),
                rs.getInt("year"),
                rs.getInt("round_number"),
                rs.getString("event_name"),
                date != null && !date.isBlank() ? LocalDate.parse(date) : null,
                rs.getString("country"),
                rs.getString("location"));
    }

    private record StoredSession(
            String sessionId,
            String eventId,
            int year,
            String sessionKey,
            String sessionName,
            String sessionType,
            String dataJson,
            String driversJson,
            String columnsJson,
            long fetchedAt,
            long updatedAt
    ) {}
}
