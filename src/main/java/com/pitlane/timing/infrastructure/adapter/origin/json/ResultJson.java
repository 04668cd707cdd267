package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One classified driver of a race or sprint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultJson(
        String position,
        String points,
        String laps,
        String status,

        @JsonProperty("Driver")
        DriverJson driver,

        @JsonProperty("Constructor")
        ConstructorJson constructor,

        @JsonProperty("Time")
        TimeJson time
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimeJson(String time) {}
}
