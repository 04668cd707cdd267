package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.HealthReport;

public record HealthResponse(
        String status,
        boolean volatile_connected,
        boolean fallback_active,
        String detail
) {
    public static HealthResponse fromReport(HealthReport report) {
        return new HealthResponse(
                report.status().label(),
                report.volatileConnected(),
                report.fallbackActive(),
                report.detail()
        );
    }
}
