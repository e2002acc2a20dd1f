package com.devevent.registry.domain.model;

import com.devevent.registry.domain.validation.FieldValidator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Raw, not yet validated input for an event write.
 *
 * @param baseline the currently stored event when this candidate updates it, {@code null} for a new event.
 *                 Fields are compared against it to decide which normalizations have to run again.
 */
public record EventCandidate(
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
        Event baseline
) {

    public boolean isNew() {
        return baseline == null;
    }

    public boolean titleChanged() {
        return isNew() || !Objects.equals(baseline.title(), trim(title));
    }

    public boolean dateChanged() {
        return isNew() || !Objects.equals(baseline.date(), trim(date));
    }

    public boolean timeChanged() {
        return isNew() || !Objects.equals(baseline.time(), trim(time));
    }

    private static String trim(String value) {
        return FieldValidator.trimWhitespace(value);
    }
}
