package com.devevent.registry.infrastructure.persistence;

import com.devevent.registry.domain.port.out.DanglingEventReferenceException;
import com.devevent.registry.domain.port.out.SlugConflictException;
import com.devevent.registry.domain.port.out.StorageUnavailableException;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

/**
 * Maps Spring data access failures onto the storage exceptions of the domain ports.
 * Anything not recognised is handed back unchanged so callers can rethrow it as is.
 */
final class StorageExceptionTranslator {

    static final String SLUG_CONSTRAINT = "uk_events_slug";
    static final String BOOKING_EVENT_CONSTRAINT = "fk_bookings_event";

    private StorageExceptionTranslator() {
    }

    static RuntimeException translateEventWrite(DataAccessException e, String slug) {
        if (e instanceof DuplicateKeyException && mentions(e, SLUG_CONSTRAINT)) {
            return new SlugConflictException(slug, e);
        }
        return translate(e);
    }

    static RuntimeException translateBookingWrite(DataAccessException e, UUID eventId) {
        if (e instanceof DataIntegrityViolationException && mentions(e, BOOKING_EVENT_CONSTRAINT)) {
            return new DanglingEventReferenceException(eventId, e);
        }
        return translate(e);
    }

    static RuntimeException translate(DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessResourceException
                || e instanceof QueryTimeoutException) {
            return new StorageUnavailableException("Event store unavailable: " + e.getMessage(), e);
        }
        return e;
    }

    private static boolean mentions(DataAccessException e, String constraint) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraint);
    }
}
