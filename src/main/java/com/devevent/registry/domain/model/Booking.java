package com.devevent.registry.domain.model;

import java.time.Instant;
import java.util.UUID;

public record Booking(
        UUID id,
        UUID eventId,
        String email,
        Instant createdAt,
        Instant updatedAt
) {}
