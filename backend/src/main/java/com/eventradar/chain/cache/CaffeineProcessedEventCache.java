package com.eventradar.chain.cache;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Objects;
import java.util.Optional;

/**
 * In-process processed-event cache; events and ranges live in two Caffeine caches with their own TTLs.
 */
public class CaffeineProcessedEventCache implements ProcessedEventCache {

    private final Cache events;
    private final Cache ranges;

    public CaffeineProcessedEventCache(CacheManager cacheManager, String eventCacheName, String rangeCacheName) {
        this.events = Objects.requireNonNull(cacheManager.getCache(eventCacheName), "No cache named " + eventCacheName);
        this.ranges = Objects.requireNonNull(cacheManager.getCache(rangeCacheName), "No cache named " + rangeCacheName);
    }

    @Override
    public Optional<String> processedAt(String eventKey) {
        return Optional.ofNullable(events.get(eventKey, String.class));
    }

    @Override
    public void markProcessed(String eventKey, String processedAt) {
        events.put(eventKey, processedAt);
    }

    @Override
    public boolean isRangeProcessed(String rangeKey) {
        return ranges.get(rangeKey) != null;
    }

    @Override
    public void markRangeProcessed(String rangeKey, int eventsFound) {
        ranges.put(rangeKey, eventsFound);
    }
}
