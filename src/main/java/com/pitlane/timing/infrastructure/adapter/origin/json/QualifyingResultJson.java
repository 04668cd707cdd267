package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QualifyingResultJson(
        String position,

        @JsonProperty("Driver")
        DriverJson driver,

        @JsonProperty("Constructor")
        ConstructorJson constructor,

        @JsonProperty("Q1")
        String q1,

        @JsonProperty("Q2")
        String q2,

        @JsonProperty("Q3")
        String q3
) {}
