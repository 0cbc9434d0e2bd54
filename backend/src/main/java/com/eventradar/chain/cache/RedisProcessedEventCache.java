package com.eventradar.chain.cache;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Processed-event cache shared across scheduler instances through Redis string keys with a TTL.
 */
public class RedisProcessedEventCache implements ProcessedEventCache {

    private final StringRedisTemplate redis;
    private final Duration duplicateWindow;
    private final Duration rangeTtl;

    public RedisProcessedEventCache(StringRedisTemplate redis, Duration duplicateWindow, Duration rangeTtl) {
        this.redis = redis;
        this.duplicateWindow = duplicateWindow;
        this.rangeTtl = rangeTtl;
    }

    @Override
    public Optional<String> processedAt(String eventKey) {
        return Optional.ofNullable(redis.opsForValue().get(eventKey));
    }

    @Override
    public void markProcessed(String eventKey, String processedAt) {
        redis.opsForValue().set(eventKey, processedAt, duplicateWindow);
    }

    @Override
    public boolean isRangeProcessed(String rangeKey) {
        return Boolean.TRUE.equals(redis.hasKey(rangeKey));
    }

    @Override
    public void markRangeProcessed(String rangeKey, int eventsFound) {
        redis.opsForValue().set(rangeKey, Integer.toString(eventsFound), rangeTtl);
    }
}
