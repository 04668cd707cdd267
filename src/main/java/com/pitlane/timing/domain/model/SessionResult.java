package com.pitlane.timing.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result set of a single session as handed over by the remote origin.
 * <p>
 * {@code rows} are ordered rows of typed cells (strings, numbers, booleans or null) aligned
 * with {@code columns}. {@code sessionKey} is the session code used in the session id,
 * {@code sessionType} its loose classification (practice, qualifying, race...).
 */
public record SessionResult(
        String sessionId,
        String eventId,
        int year,
        String sessionKey,
        String sessionName,
        String sessionType,
        List<List<Object>> rows,
        List<DriverEntry> drivers,
        List<String> columns,
        Instant fetchedAt,
        Instant updatedAt
) {
    public SessionResult {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        rows = rows != null ? rows.stream().map(SessionResult::copyRow).toList() : List.of();
        drivers = drivers != null ? List.copyOf(drivers) : List.of();
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public static SessionResult of(SessionId id,
                                   String sessionName,
                                   String sessionType,
                                   List<List<Object>> rows,
                                   List<DriverEntry> drivers,
                                   List<String> columns) {
        return new SessionResult(id.value(), id.eventId(), id.year(), id.sessionKey(),
                sessionName, sessionType, rows, drivers, columns, null, null);
    }

    public SessionId id() {
        return SessionId.parse(sessionId);
    }

    public SessionResult withTimestamps(Instant fetchedAt, Instant updatedAt) {
        return new SessionResult(sessionId, eventId, year, sessionKey, sessionName, sessionType,
                rows, drivers, columns, fetchedAt, updatedAt);
    }

    // Cells may legitimately be null, which List.copyOf rejects
    private static List<Object> copyRow(List<Object> row) {
        return row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row));
    }
}
