package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriverJson(
        String driverId,
        String code,
        String givenName,
        String familyName
) {}
