package com.devevent.registry.infrastructure.web.dto;

import com.devevent.registry.domain.model.BookingCandidate;

public record BookingRequest(
        String eventId,
        String email
) {
    public BookingCandidate toCandidate() {
        return BookingCandidate.of(eventId, email);
    }
}
