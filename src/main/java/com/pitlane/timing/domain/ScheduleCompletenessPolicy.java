package com.pitlane.timing.domain;

/**
 * Decides whether a stored season schedule holds enough races to be served without asking
 * the remote origin again. Seasons from the current-season threshold onward need at least
 * 15 races, older seasons at least 20.
 */
public class ScheduleCompletenessPolicy {

    public static final int MIN_RACES_RECENT_SEASON = 15;
    public static final int MIN_RACES_PAST_SEASON = 20;

    private final int currentSeasonThreshold;

    public ScheduleCompletenessPolicy(int currentSeasonThreshold) {
        this.currentSeasonThreshold = currentSeasonThreshold;
    }

    public int minimumRaces(int year) {
        return year >= currentSeasonThreshold ? MIN_RACES_RECENT_SEASON : MIN_RACES_PAST_SEASON;
    }

    public boolean isComplete(int year, int storedRaces) {
        return storedRaces >= minimumRaces(year);
    }

    public int currentSeasonThreshold() {
        return currentSeasonThreshold;
    }
}
