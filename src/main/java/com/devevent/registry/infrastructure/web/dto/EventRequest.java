package com.devevent.registry.infrastructure.web.dto;

import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.model.EventCandidate;
import java.util.List;

/**
 * Incoming event payload. On create every field is taken as sent; on update a {@code null}
 * field keeps the stored value.
 */
public record EventRequest(
        String title,
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
        List<String> tags
) {

    public EventCandidate toCandidate() {
        return new EventCandidate(null, title, null, description, overview, image, venue, location,
                date, time, mode, audience, agenda, organizer, tags, null);
    }

    public EventCandidate applyTo(Event stored) {
        return new EventCandidate(
                stored.id(),
                orElse(title, stored.title()),
                stored.slug(),
                orElse(description, stored.description()),
                orElse(overview, stored.overview()),
                orElse(image, stored.image()),
                orElse(venue, stored.venue()),
                orElse(location, stored.location()),
                orElse(date, stored.date()),
                orElse(time, stored.time()),
                orElse(mode, stored.mode()),
                orElse(audience, stored.audience()),
                orElse(agenda, stored.agenda()),
                orElse(organizer, stored.organizer()),
                orElse(tags, stored.tags()),
                stored
        );
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
