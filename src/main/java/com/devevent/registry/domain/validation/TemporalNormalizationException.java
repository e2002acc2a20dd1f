package com.devevent.registry.domain.validation;

import com.devevent.registry.domain.model.ErrorKind;

/**
 * Raised when a date or time string cannot be brought into canonical form.
 */
public class TemporalNormalizationException extends RuntimeException {

    private final ErrorKind kind;

    public TemporalNormalizationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
