package com.devevent.registry.application;

import com.devevent.registry.domain.port.out.EventRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Confirms that a referenced event exists at the moment of the call.
 * Always asks the store; a {@link com.devevent.registry.domain.port.out.StorageUnavailableException}
 * reaches the caller untouched.
 */
@Component
public class EventReferenceChecker {

    private static final Logger logger = LoggerFactory.getLogger(EventReferenceChecker.class);

    private final EventRepository eventRepository;

    public EventReferenceChecker(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public boolean eventExists(UUID eventId) {
        boolean exists = eventRepository.existsById(eventId);
        logger.debug("Event {} exists: {}", eventId, exists);
        return exists;
    }
}
