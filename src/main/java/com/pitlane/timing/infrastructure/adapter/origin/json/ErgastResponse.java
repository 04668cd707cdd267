package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Envelope of every Ergast-compatible response: {@code {"MRData": {"RaceTable": {...}}}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErgastResponse(
        @JsonProperty("MRData")
        MrData data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MrData(
            @JsonProperty("RaceTable")
            RaceTable raceTable
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RaceTable(
            String season,

            @JsonProperty("Races")
            List<RaceJson> races
    ) {}

    public List<RaceJson> races() {
        if (data == null || data.raceTable() == null || data.raceTable().races() == null) {
            return List.of();
        }
        return data.raceTable().races();
    }
}
