package com.devevent.registry.infrastructure.web;

import com.devevent.registry.domain.model.ErrorKind;
import com.devevent.registry.domain.model.ValidationError;
import com.devevent.registry.infrastructure.web.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Translates rejected writes into HTTP responses.
 */
final class ErrorStatusMapper {

    private ErrorStatusMapper() {
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case SLUG_CONFLICT -> HttpStatus.CONFLICT;
            case DANGLING_EVENT_REFERENCE -> HttpStatus.NOT_FOUND;
            case STORAGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    static ResponseEntity<ErrorResponse> toResponse(ValidationError error) {
        return ResponseEntity.status(statusFor(error.kind())).body(ErrorResponse.from(error));
    }
}
