package com.pitlane.timing.domain.model;

import java.time.Instant;

public record SessionSummary(
        String sessionId,
        String sessionKey,
        String sessionName,
        String sessionType,
        Instant updatedAt
) {}
