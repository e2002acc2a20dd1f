package com.devevent.registry.domain.model;

/**
 * First failure encountered by a write pipeline.
 *
 * @param kind    what went wrong
 * @param field   offending field, {@code null} when the failure is not tied to one
 * @param message human-readable explanation
 */
public record ValidationError(ErrorKind kind, String field, String message) {

    public static ValidationError of(ErrorKind kind, String field, String message) {
        return new ValidationError(kind, field, message);
    }

    public static ValidationError missingField(String field) {
        return new ValidationError(ErrorKind.MISSING_FIELD, field, "Field \"" + field + "\" is required.");
    }
}
