package com.eventradar.config;

import com.eventradar.scheduler.config.SchedulerProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine in-process caches.
 */
@Configuration
public class CaffeineConfig {

    public static final String BLOCK_NUMBER_CACHE = "blockNumberCache";
    public static final String PROCESSED_EVENT_CACHE = "processedEventCache";
    public static final String PROCESSED_RANGE_CACHE = "processedRangeCache";

    @Bean
    public CacheManager caffeineCacheManager(SchedulerProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(BLOCK_NUMBER_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getBlockNumberTtl())
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(PROCESSED_EVENT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getDuplicateEventWindow())
                .maximumSize(100_000)
                .build());
        manager.registerCustomCache(PROCESSED_RANGE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getProcessedRangeTtl())
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
