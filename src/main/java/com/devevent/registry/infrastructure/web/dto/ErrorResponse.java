package com.devevent.registry.infrastructure.web.dto;

import com.devevent.registry.domain.model.ValidationError;

public record ErrorResponse(
        String error,
        String field,
        String message
) {
    public static ErrorResponse from(ValidationError error) {
        return new ErrorResponse(error.kind().name(), error.field(), error.message());
    }

    public static ErrorResponse notFound(String message) {
        return new ErrorResponse("NOT_FOUND", null, message);
    }

    public static ErrorResponse internal() {
        return new ErrorResponse("INTERNAL_ERROR", null, "Unexpected error while processing the request.");
    }
}
