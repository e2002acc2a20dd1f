package com.devevent.registry.infrastructure.cache;

import com.devevent.registry.domain.model.Event;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed event cache. Events are stored as JSON under two keys,
 * {@code <prefix>id:<uuid>} and {@code <prefix>slug:<slug>}.
 * Failures are logged and reported as misses; the cache never breaks a lookup.
 */
@Component
public class RedisEventCache implements EventCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisEventCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final EventCacheConfig config;

    public RedisEventCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, EventCacheConfig config) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public Optional<Event> getById(UUID id) {
        return read(idKey(id));
    }

    @Override
    public Optional<Event> getBySlug(String slug) {
        return read(slugKey(slug));
    }

    @Override
    public void put(Event event) {
        if (!config.isEnabled()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(event);
            redisTemplate.opsForValue().set(idKey(event.id()), json, config.getTtlMinutes(), TimeUnit.MINUTES);
            redisTemplate.opsForValue().set(slugKey(event.slug()), json, config.getTtlMinutes(), TimeUnit.MINUTES);
            logger.debug("Cached event {} ({})", event.id(), event.slug());
        } catch (Exception e) {
            logger.warn("Failed to cache event {}: {}", event.id(), e.getMessage());
        }
    }

    @Override
    public void evict(Event event, String previousSlug) {
        if (!config.isEnabled()) {
            return;
        }
        List<String> keys = new ArrayList<>();
        if (event.slug() != null) {
            keys.add(slugKey(event.slug()));
        }
        if (event.id() != null) {
            keys.add(idKey(event.id()));
        }
        if (previousSlug != null) {
            addIfAbsent(keys, slugKey(previousSlug));
        }
        if (event.id() != null) {
            // the cached copy may carry an older slug than the database row
            read(idKey(event.id()))
                    .map(Event::slug)
                    .ifPresent(cachedSlug -> addIfAbsent(keys, slugKey(cachedSlug)));
        }
        if (keys.isEmpty()) {
            return;
        }
        try {
            Long deleted = redisTemplate.delete(keys);
            logger.debug("Evicted {} cache entries for event {}", deleted, event.id());
        } catch (Exception e) {
            logger.warn("Failed to evict cache entries {}: {}", keys, e.getMessage());
        }
    }

    private static void addIfAbsent(List<String> keys, String key) {
        if (!keys.contains(key)) {
            keys.add(key);
        }
    }

    private Optional<Event> read(String key) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null || json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Event.class));
        } catch (Exception e) {
            logger.warn("Failed to read cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private String idKey(UUID id) {
        return config.getKeyPrefix() + "id:" + id;
    }

    private String slugKey(String slug) {
        return config.getKeyPrefix() + "slug:" + slug;
    }
}
