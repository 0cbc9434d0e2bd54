package com.eventradar.scheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event scheduler settings. Chains map chain ID to one or more RPC URLs.
 */
@ConfigurationProperties(prefix = "eventradar.scheduler")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SchedulerProperties {

    @NotBlank
    private String managerId = "event-scheduler-1";

    @Min(1)
    private int maxWorkers = 100;

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(10);

    @Min(0)
    private int blockConfirmations = 3;

    /** Widest block range sent in one eth_getLogs call; longer backlogs are scanned in consecutive chunks. */
    @Min(1)
    @Max(10_000)
    private int maxBlockRange = 2000;

    /** Upper bound on a single RPC round trip. */
    @NotNull
    private Duration rpcTimeout = Duration.ofSeconds(15);

    /** How long stop/unschedule wait for a worker's current tick to finish. */
    @NotNull
    private Duration stopGracePeriod = Duration.ofSeconds(5);

    @Valid
    private Map<String, Chain> chains = new LinkedHashMap<>();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Streams streams = new Streams();

    @Valid
    private Lock lock = new Lock();

    /** Chain ID to RPC URLs, in configuration order. */
    public Map<String, List<String>> rpcUrlsByChain() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        chains.forEach((chainId, chain) -> out.put(chainId, List.copyOf(chain.getUrls())));
        return out;
    }

    @AssertTrue(message = "pollInterval must be positive")
    public boolean isPollIntervalPositive() {
        return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Chain {
        private List<String> urls = new ArrayList<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Cache {
        /** caffeine, redis or none. */
        @NotNull
        private CacheType type = CacheType.CAFFEINE;
        @NotNull
        private Duration blockNumberTtl = Duration.ofMinutes(2);
        /**
         * When false workers always read the head from the chain (and still refresh the cache). Off by default:
         * a cached head can trail the chain by up to blockNumberTtl, which delays detection by as much.
         */
        private boolean workerReads = false;
        /** How long a dispatched event is remembered for duplicate suppression. */
        @NotNull
        private Duration duplicateEventWindow = Duration.ofMinutes(10);
        /** How long a scanned block range is remembered per job. */
        @NotNull
        private Duration processedRangeTtl = Duration.ofMinutes(10);
    }

    public enum CacheType {
        CAFFEINE,
        REDIS,
        NONE
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Streams {
        private boolean enabled = true;
        @NotBlank
        private String readyStream = "jobs:ready";
        @NotBlank
        private String retryStream = "jobs:retry";
        private long maxLength = 10_000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Lock {
        private boolean enabled = false;
        @NotNull
        private Duration ttl = Duration.ofMinutes(15);
        @NotBlank
        private String keyPrefix = "event_job_";
    }
}
