package com.devevent.registry.infrastructure.web.dto;

import com.devevent.registry.domain.model.Event;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record EventResponse(
        UUID id,
        String title,
        String slug,
        String description,
        String overview,
        String image,
        String venue,
        String location,
        String date,
        String time,
        String mode,
        String audience,
        List<String> agenda,
        String organizer,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static EventResponse fromEvent(Event event) {
        return new EventResponse(
                event.id(),
                event.title(),
                event.slug(),
                event.description(),
                event.overview(),
                event.image(),
                event.venue(),
                event.location(),
                event.date(),
                event.time(),
                event.mode(),
                event.audience(),
                event.agenda(),
                event.organizer(),
                event.tags(),
                event.createdAt(),
                event.updatedAt()
        );
    }
}
