package com.devevent.registry.domain.model;

import java.util.Objects;

/**
 * Outcome of a write pipeline: either the persisted record or the error that stopped it.
 */
public record WriteResult<T>(T value, ValidationError error) {

    public WriteResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> WriteResult<T> success(T value) {
        return new WriteResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> WriteResult<T> failure(ValidationError error) {
        return new WriteResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> WriteResult<T> failure(ErrorKind kind, String field, String message) {
        return failure(ValidationError.of(kind, field, message));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
