package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.DriverEntry;
import com.pitlane.timing.domain.model.SessionResult;
import java.time.Instant;
import java.util.List;

public record SessionResultResponse(
        String session_id,
        String event_id,
        int year,
        String session_key,
        String session_name,
        String session_type,
        List<String> columns,
        List<List<Object>> rows,
        List<DriverDto> drivers,
        Instant fetched_at,
        Instant updated_at
) {
    public static SessionResultResponse fromResult(SessionResult result) {
        return new SessionResultResponse(
                result.sessionId(),
                result.eventId(),
                result.year(),
                result.sessionKey(),
                result.sessionName(),
                result.sessionType(),
                result.columns(),
                result.rows(),
                result.drivers().stream().map(DriverDto::fromEntry).toList(),
                result.fetchedAt(),
                result.updatedAt()
        );
    }

    public record DriverDto(
            String display_name,
            String code
    ) {
        public static DriverDto fromEntry(DriverEntry entry) {
            return new DriverDto(entry.displayName(), entry.code());
        }
    }
}
