package com.pitlane.timing.domain.model;

public record DriverEntry(String displayName, String code) {}
