package com.devevent.registry.infrastructure.persistence;

import com.devevent.registry.domain.model.Event;
import com.devevent.registry.domain.port.out.EventRepository;
import com.devevent.registry.infrastructure.cache.EventCache;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

/**
 * Cached implementation of EventRepository using decorator pattern.
 * Lookups read through the cache; {@link #existsById(UUID)} always goes to the database
 * so reference checks see the current state of the store.
 */
@Repository
@Primary
public class CachedEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(CachedEventRepository.class);

    private final EventRepository databaseRepository;
    private final EventCache cache;

    public CachedEventRepository(
            @Qualifier("jdbcEventRepository") EventRepository databaseRepository,
            EventCache cache) {
        this.databaseRepository = databaseRepository;
        this.cache = cache;
    }

    @Override
    public Event save(Event event) {
        invalidateBeforeWrite(event);

        Event stored = databaseRepository.save(event);

        safeCache(stored);
        return stored;
    }

    @Override
    public boolean existsById(UUID id) {
        return databaseRepository.existsById(id);
    }

    @Override
    public Optional<Event> findById(UUID id) {
        Optional<Event> cached = cache.getById(id);
        if (cached.isPresent()) {
            logger.debug("Cache hit for event {}", id);
            return cached;
        }

        logger.debug("Cache miss for event {} - fetching from database", id);
        Optional<Event> event = databaseRepository.findById(id);
        event.ifPresent(this::safeCache);
        return event;
    }

    @Override
    public Optional<Event> findBySlug(String slug) {
        Optional<Event> cached = cache.getBySlug(slug);
        if (cached.isPresent()) {
            logger.debug("Cache hit for slug {}", slug);
            return cached;
        }

        logger.debug("Cache miss for slug {} - fetching from database", slug);
        Optional<Event> event = databaseRepository.findBySlug(slug);
        event.ifPresent(this::safeCache);
        return event;
    }

    /**
     * Synchronous invalidation before the database write keeps stale entries from outliving it.
     * For an update the persisted slug is read from the database, so the old slug entry is dropped
     * even when the cached id entry has already expired.
     */
    private void invalidateBeforeWrite(Event event) {
        try {
            String previousSlug = event.id() == null
                    ? null
                    : databaseRepository.findById(event.id()).map(Event::slug).orElse(null);
            cache.evict(event, previousSlug);
        } catch (Exception e) {
            logger.warn("Cache invalidation failed, proceeding with database write: {}", e.getMessage());
        }
    }

    private void safeCache(Event event) {
        try {
            cache.put(event);
        } catch (Exception e) {
            logger.warn("Cache population failed for event {}: {}", event.id(), e.getMessage());
        }
    }
}
