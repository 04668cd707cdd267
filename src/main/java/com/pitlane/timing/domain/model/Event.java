package com.pitlane.timing.domain.model;

import java.time.LocalDate;

public record Event(
        String eventId,
        int year,
        int roundNumber,
        String name,
        LocalDate date,
        String country,
        String location
) {
    public Event {
        if (year <= 0) {
            throw new IllegalArgumentException("Event year must be positive: " + year);
        }
        if (roundNumber < 0) {
            throw new IllegalArgumentException("Round number must not be negative: " + roundNumber);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name is required");
        }
        if (eventId == null || eventId.isBlank()) {
            eventId = idFor(year, roundNumber);
        }
    }

    public static Event of(int year, int roundNumber, String name, LocalDate date, String country, String location) {
        return new Event(idFor(year, roundNumber), year, roundNumber, name, date, country, location);
    }

    /**
     * Deterministic identifier used when the origin does not supply one, e.g. "2024_5".
     */
    public static String idFor(int year, int roundNumber) {
        return year + "_" + roundNumber;
    }

    public EventStatus statusOn(LocalDate today) {
        return EventStatus.of(date, today);
    }
}
