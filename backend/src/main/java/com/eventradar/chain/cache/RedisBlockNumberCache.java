package com.eventradar.chain.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Block-number cache shared across scheduler instances through Redis string keys with a TTL.
 */
@Slf4j
public class RedisBlockNumberCache implements BlockNumberCache {

    private final StringRedisTemplate redis;
    private final Duration ttl;

    public RedisBlockNumberCache(StringRedisTemplate redis, Duration ttl) {
        this.redis = redis;
        this.ttl = ttl;
    }

    @Override
    public OptionalLong get(String chainId) {
        String value = redis.opsForValue().get(BlockNumberCache.key(chainId));
        if (value == null || value.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed cached block number: chainId={}, value={}", chainId, value);
            return OptionalLong.empty();
        }
    }

    @Override
    public void put(String chainId, long blockNumber) {
        redis.opsForValue().set(BlockNumberCache.key(chainId), Long.toString(blockNumber), ttl);
    }

    @Override
    public boolean isAvailable() {
        try {
            var factory = redis.getConnectionFactory();
            if (factory == null) {
                return false;
            }
            try (var connection = factory.getConnection()) {
                return "PONG".equalsIgnoreCase(connection.ping());
            }
        } catch (RuntimeException e) {
            log.debug("Redis block-number cache unavailable: {}", e.getMessage());
            return false;
        }
    }
}
