package com.eventradar.config;

import com.eventradar.chain.BlockHeightResolver;
import com.eventradar.chain.ChainClientFactory;
import com.eventradar.chain.ChainClientPool;
import com.eventradar.chain.EvmRpcClient;
import com.eventradar.chain.JsonRpcChainClientFactory;
import com.eventradar.chain.WebClientEvmRpcClient;
import com.eventradar.chain.cache.BlockNumberCache;
import com.eventradar.chain.cache.CaffeineBlockNumberCache;
import com.eventradar.chain.cache.CaffeineProcessedEventCache;
import com.eventradar.chain.cache.NoOpBlockNumberCache;
import com.eventradar.chain.cache.NoOpProcessedEventCache;
import com.eventradar.chain.cache.ProcessedEventCache;
import com.eventradar.chain.cache.RedisBlockNumberCache;
import com.eventradar.chain.cache.RedisProcessedEventCache;
import com.eventradar.chain.config.EvmRpcProperties;
import com.eventradar.dispatch.ActionDispatcher;
import com.eventradar.dispatch.WebClientActionDispatcher;
import com.eventradar.dispatch.config.DispatchProperties;
import com.eventradar.lock.JobLock;
import com.eventradar.lock.NoOpJobLock;
import com.eventradar.lock.RedisJobLock;
import com.eventradar.metrics.SchedulerMetrics;
import com.eventradar.scheduler.EventSchedulerManager;
import com.eventradar.scheduler.config.SchedulerProperties;
import com.eventradar.stream.EventStreamPublisher;
import com.eventradar.stream.NoOpEventStreamPublisher;
import com.eventradar.stream.RedisEventStreamPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the event scheduler: chain clients, block-number cache, event streams, job lock and dispatcher.
 * Optional collaborators fall back to no-op implementations when disabled.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ SchedulerProperties.class, EvmRpcProperties.class, DispatchProperties.class })
public class SchedulerConfig {

    @Bean
    public SchedulerMetrics schedulerMetrics(MeterRegistry meterRegistry) {
        return new SchedulerMetrics(meterRegistry);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(EvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public ChainClientFactory chainClientFactory(
            EvmRpcClient evmRpcClient,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            ObjectMapper objectMapper,
            SchedulerMetrics schedulerMetrics,
            SchedulerProperties schedulerProperties,
            EvmRpcProperties evmRpcProperties
    ) {
        return new JsonRpcChainClientFactory(evmRpcClient, evmRpcRateLimiter, objectMapper, schedulerMetrics,
                schedulerProperties.getRpcTimeout(), evmRpcProperties.getLocalLimiterLogThresholdMs());
    }

    @Bean
    public ChainClientPool chainClientPool(ChainClientFactory chainClientFactory, SchedulerMetrics schedulerMetrics) {
        return new ChainClientPool(chainClientFactory, schedulerMetrics);
    }

    @Bean
    public BlockNumberCache blockNumberCache(
            SchedulerProperties properties,
            CacheManager cacheManager,
            ObjectProvider<StringRedisTemplate> redisTemplate
    ) {
        SchedulerProperties.Cache cache = properties.getCache();
        log.info("Block-number cache: type={}, ttl={}", cache.getType(), cache.getBlockNumberTtl());
        return switch (cache.getType()) {
            case CAFFEINE -> new CaffeineBlockNumberCache(cacheManager, CaffeineConfig.BLOCK_NUMBER_CACHE);
            case REDIS -> new RedisBlockNumberCache(redisTemplate.getObject(), cache.getBlockNumberTtl());
            case NONE -> new NoOpBlockNumberCache();
        };
    }

    @Bean
    public ProcessedEventCache processedEventCache(
            SchedulerProperties properties,
            CacheManager cacheManager,
            ObjectProvider<StringRedisTemplate> redisTemplate
    ) {
        SchedulerProperties.Cache cache = properties.getCache();
        log.info("Processed-event cache: type={}, duplicateWindow={}, rangeTtl={}",
                cache.getType(), cache.getDuplicateEventWindow(), cache.getProcessedRangeTtl());
        return switch (cache.getType()) {
            case CAFFEINE -> new CaffeineProcessedEventCache(cacheManager,
                    CaffeineConfig.PROCESSED_EVENT_CACHE, CaffeineConfig.PROCESSED_RANGE_CACHE);
            case REDIS -> new RedisProcessedEventCache(redisTemplate.getObject(),
                    cache.getDuplicateEventWindow(), cache.getProcessedRangeTtl());
            case NONE -> new NoOpProcessedEventCache();
        };
    }

    @Bean
    public BlockHeightResolver blockHeightResolver(BlockNumberCache blockNumberCache) {
        return new BlockHeightResolver(blockNumberCache);
    }

    @Bean
    public EventStreamPublisher eventStreamPublisher(
            SchedulerProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            ObjectMapper objectMapper
    ) {
        SchedulerProperties.Streams streams = properties.getStreams();
        if (!streams.isEnabled()) {
            return new NoOpEventStreamPublisher();
        }
        return new RedisEventStreamPublisher(redisTemplate.getObject(), objectMapper,
                streams.getReadyStream(), streams.getRetryStream(), streams.getMaxLength());
    }

    @Bean
    public JobLock jobLock(SchedulerProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
        if (!properties.getLock().isEnabled()) {
            return new NoOpJobLock();
        }
        return new RedisJobLock(redisTemplate.getObject());
    }

    @Bean
    public ActionDispatcher actionDispatcher(WebClient.Builder webClientBuilder, DispatchProperties dispatchProperties) {
        return new WebClientActionDispatcher(webClientBuilder, dispatchProperties.getUrl(), dispatchProperties.getTimeout());
    }

    @Bean(destroyMethod = "stop")
    public EventSchedulerManager eventSchedulerManager(
            SchedulerProperties properties,
            ChainClientPool chainClientPool,
            BlockHeightResolver blockHeightResolver,
            ProcessedEventCache processedEventCache,
            EventStreamPublisher eventStreamPublisher,
            ActionDispatcher actionDispatcher,
            JobLock jobLock,
            SchedulerMetrics schedulerMetrics,
            @Qualifier(AsyncConfig.EVENT_WORKER_EXECUTOR) Executor eventWorkerExecutor
    ) {
        return new EventSchedulerManager(properties, chainClientPool, blockHeightResolver, processedEventCache,
                eventStreamPublisher, actionDispatcher, jobLock, schedulerMetrics, eventWorkerExecutor);
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(
            EventSchedulerManager eventSchedulerManager,
            @Qualifier(AsyncConfig.SCHEDULER_COORDINATOR_EXECUTOR) Executor coordinatorExecutor
    ) {
        return new SchedulerLifecycle(eventSchedulerManager, coordinatorExecutor);
    }
}
