package com.devevent.registry.domain.port.out;

import java.util.UUID;

/**
 * The store refused a booking because its event no longer exists.
 */
public class DanglingEventReferenceException extends StorageException {

    private final UUID eventId;

    public DanglingEventReferenceException(UUID eventId, Throwable cause) {
        super("Referenced event does not exist: " + eventId, cause);
        this.eventId = eventId;
    }

    public UUID getEventId() {
        return eventId;
    }
}
