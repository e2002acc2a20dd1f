package com.devevent.registry.domain.model;

/**
 * Reasons a write can be rejected.
 */
public enum ErrorKind {
    MISSING_TITLE,
    INVALID_TITLE,
    MISSING_DATE,
    MISSING_TIME,
    MISSING_FIELD,
    INVALID_DATE,
    INVALID_TIME_FORMAT,
    INVALID_TIME_VALUE,
    EMPTY_AGENDA,
    EMPTY_TAGS,
    SLUG_CONFLICT,
    MISSING_EVENT_ID,
    DANGLING_EVENT_REFERENCE,
    INVALID_EMAIL,
    STORAGE_UNAVAILABLE
}
