package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.SessionSummary;
import java.time.Instant;
import java.util.List;

public record EventSessionsResponse(
        String event_id,
        List<SessionDto> sessions
) {
    public static EventSessionsResponse fromSummaries(String eventId, List<SessionSummary> summaries) {
        return new EventSessionsResponse(eventId, summaries.stream().map(SessionDto::fromSummary).toList());
    }

    public record SessionDto(
            String session_id,
            String session_key,
            String session_name,
            String session_type,
            Instant updated_at
    ) {
        public static SessionDto fromSummary(SessionSummary summary) {
            return new SessionDto(
                    summary.sessionId(),
                    summary.sessionKey(),
                    summary.sessionName(),
                    summary.sessionType(),
                    summary.updatedAt()
            );
        }
    }
}
