package com.devevent.registry.domain.port.out;

import com.devevent.registry.domain.model.Event;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for the Event aggregate.
 * This is the contract that infrastructure must implement.
 */
public interface EventRepository {

    /**
     * Atomically create (no id) or update (id present) an event.
     * Timestamps are assigned by the store.
     *
     * @return the event as stored
     * @throws SlugConflictException       when another event already owns the slug
     * @throws StorageUnavailableException when the store cannot be reached
     */
    Event save(Event event);

    /**
     * Single existence query against the store. Implementations must not answer from a cache.
     */
    boolean existsById(UUID id);

    Optional<Event> findById(UUID id);

    Optional<Event> findBySlug(String slug);
}
