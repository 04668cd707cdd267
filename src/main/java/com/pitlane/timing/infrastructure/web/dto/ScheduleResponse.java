package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.Event;
import java.time.LocalDate;
import java.util.List;

/**
 * Season schedule. Event status is derived against {@code today} when the response is built.
 */
public record ScheduleResponse(
        int year,
        List<EventDto> events
) {
    public static ScheduleResponse fromEvents(int year, List<Event> events, LocalDate today) {
        var eventDtos = events.stream()
                .map(event -> EventDto.fromEvent(event, today))
                .toList();

        return new ScheduleResponse(year, eventDtos);
    }

    public record EventDto(
            String event_id,
            int round,
            String name,
            LocalDate date,
            String country,
            String location,
            String status
    ) {
        public static EventDto fromEvent(Event event, LocalDate today) {
            return new EventDto(
                    event.eventId(),
                    event.roundNumber(),
                    event.name(),
                    event.date(),
                    event.country(),
                    event.location(),
                    event.statusOn(today).label()
            );
        }
    }
}
