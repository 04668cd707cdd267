package com.pitlane.timing.domain.model;

public enum HealthStatus {
    HEALTHY("healthy"),
    FALLBACK("fallback"),
    ERROR("error");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
