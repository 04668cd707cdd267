package com.pitlane.timing.domain.model;

/**
 * Composite identifier of one timed session: season, round and session code (FP1, Q, R...).
 * Renders as "2024_5_R".
 */
public record SessionId(int year, int round, String sessionKey) {

    public SessionId {
        if (year <= 0) {
            throw new IllegalArgumentException("Year must be positive: " + year);
        }
        if (round < 0) {
            throw new IllegalArgumentException("Round must not be negative: " + round);
        }
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("Session key is required");
        }
        if (sessionKey.contains("_") || sessionKey.contains(":")) {
            throw new IllegalArgumentException("Session key must not contain '_' or ':': " + sessionKey);
        }
    }

    public static SessionId of(int year, int round, String sessionKey) {
        return new SessionId(year, round, sessionKey);
    }

    public static SessionId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Session id is required");
        }
        String[] parts = value.split("_");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed session id: " + value);
        }
        try {
            return new SessionId(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), parts[2]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed session id: " + value, e);
        }
    }

    public String value() {
        return year + "_" + round + "_" + sessionKey;
    }

    public String eventId() {
        return Event.idFor(year, round);
    }

    @Override
    public String toString() {
        return value();
    }
}
