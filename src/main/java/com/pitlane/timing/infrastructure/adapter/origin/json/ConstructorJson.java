package com.pitlane.timing.infrastructure.adapter.origin.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConstructorJson(String constructorId, String name) {}
