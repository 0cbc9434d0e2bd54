package com.eventradar.chain.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * EVM RPC throttling settings shared by all chain clients.
 */
@ConfigurationProperties(prefix = "eventradar.scheduler.evm-rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class EvmRpcProperties {

    /** Global EVM RPC budget (requests per second) for this scheduler instance. */
    @Min(1)
    private int maxRequestsPerSecond = 200;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** How long local limiter may wait for a permit before failing the call. */
    @Min(0)
    private long localLimiterTimeoutMs = 2_000;
}
