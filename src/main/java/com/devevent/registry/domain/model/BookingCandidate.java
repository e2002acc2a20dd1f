package com.devevent.registry.domain.model;

import java.util.UUID;

/**
 * Raw input for a booking write. {@code eventId} is kept as submitted so a malformed
 * reference can be reported instead of failing at parse time.
 */
public record BookingCandidate(
        UUID id,
        String eventId,
        String email
) {

    public static BookingCandidate of(String eventId, String email) {
        return new BookingCandidate(null, eventId, email);
    }
}
