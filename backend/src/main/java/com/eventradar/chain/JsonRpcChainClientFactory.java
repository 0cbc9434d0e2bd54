package com.eventradar.chain;

import com.eventradar.metrics.SchedulerMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Builds {@link JsonRpcChainClient}s sharing one transport and one rate limiter.
 */
@RequiredArgsConstructor
public class JsonRpcChainClientFactory implements ChainClientFactory {

    private final EvmRpcClient rpcClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final SchedulerMetrics metrics;
    private final Duration rpcTimeout;
    private final long limiterLogThresholdMs;

    @Override
    public ChainClient connect(String chainId, List<String> rpcUrls) {
        return new JsonRpcChainClient(
                chainId,
                rpcClient,
                new RpcEndpointRotator(rpcUrls),
                rateLimiter,
                objectMapper,
                metrics,
                rpcTimeout,
                limiterLogThresholdMs
        );
    }
}
