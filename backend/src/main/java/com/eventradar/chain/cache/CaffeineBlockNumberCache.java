package com.eventradar.chain.cache;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * In-process block-number cache backed by a Caffeine cache from the Spring {@link CacheManager}.
 */
public class CaffeineBlockNumberCache implements BlockNumberCache {

    private final Cache cache;

    public CaffeineBlockNumberCache(CacheManager cacheManager, String cacheName) {
        this.cache = Objects.requireNonNull(cacheManager.getCache(cacheName), "No cache named " + cacheName);
    }

    @Override
    public OptionalLong get(String chainId) {
        Long value = cache.get(BlockNumberCache.key(chainId), Long.class);
        return value != null ? OptionalLong.of(value) : OptionalLong.empty();
    }

    @Override
    public void put(String chainId, long blockNumber) {
        cache.put(BlockNumberCache.key(chainId), blockNumber);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
