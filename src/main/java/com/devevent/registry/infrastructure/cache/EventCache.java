package com.devevent.registry.infrastructure.cache;

import com.devevent.registry.domain.model.Event;
import java.util.Optional;
import java.util.UUID;

/**
 * Cache abstraction for event lookups.
 * Allows different caching implementations without changing the repositories.
 */
public interface EventCache {

    /**
     * @return Optional.empty() on a cache miss
     */
    Optional<Event> getById(UUID id);

    Optional<Event> getBySlug(String slug);

    void put(Event event);

    /**
     * Drop every entry that could describe the given event, including the one stored under a previous slug.
     *
     * @param previousSlug slug currently persisted for the event, {@code null} when unknown or for a new event
     */
    void evict(Event event, String previousSlug);
}
