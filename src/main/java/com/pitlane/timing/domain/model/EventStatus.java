package com.pitlane.timing.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Race weekend status, always derived from the event date and "today".
 * Never trusted from storage.
 */
public enum EventStatus {
    UPCOMING("upcoming"),
    CURRENT("current"),
    COMPLETED("completed"),
    UNKNOWN("unknown");

    // A weekend stays "current" from the day before the event date until four days after it
    private static final long CURRENT_WINDOW_BEFORE_DAYS = 1;
    private static final long CURRENT_WINDOW_AFTER_DAYS = 4;

    private final String label;

    EventStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EventStatus of(LocalDate eventDate, LocalDate today) {
        if (eventDate == null || today == null) {
            return UNKNOWN;
        }

        long daysSinceEvent = ChronoUnit.DAYS.between(eventDate, today);

        if (daysSinceEvent > CURRENT_WINDOW_AFTER_DAYS) {
            return COMPLETED;
        } else if (daysSinceEvent >= -CURRENT_WINDOW_BEFORE_DAYS) {
            return CURRENT;
        } else {
            return UPCOMING;
        }
    }
}
