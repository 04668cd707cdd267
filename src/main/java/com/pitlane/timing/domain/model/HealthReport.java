package com.pitlane.timing.domain.model;

public record HealthReport(
        HealthStatus status,
        boolean volatileConnected,
        boolean fallbackActive,
        String detail
) {
    public static HealthReport healthy() {
        return new HealthReport(HealthStatus.HEALTHY, true, false, null);
    }

    public static HealthReport fallback(String detail) {
        return new HealthReport(HealthStatus.FALLBACK, false, true, detail);
    }

    public static HealthReport error(String detail) {
        return new HealthReport(HealthStatus.ERROR, false, true, detail);
    }
}
