package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RaceJson(
        String season,
        String round,
        String raceName,
        String date,

        @JsonProperty("Circuit")
        CircuitJson circuit,

        @JsonProperty("Results")
        List<ResultJson> results,

        @JsonProperty("SprintResults")
        List<ResultJson> sprintResults,

        @JsonProperty("QualifyingResults")
        List<QualifyingResultJson> qualifyingResults
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CircuitJson(
            String circuitName,

            @JsonProperty("Location")
            LocationJson location
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocationJson(
            String locality,
            String country
    ) {}
}
