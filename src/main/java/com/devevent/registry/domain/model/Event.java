package com.devevent.registry.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted event record.
 * Every instance handed out by a repository satisfies the write-path invariants:
 * canonical slug, {@code YYYY-MM-DD} date, {@code HH:MM} time and non-empty text fields.
 */
public record Event(
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
) {}
