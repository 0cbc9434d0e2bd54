package com.eventradar.scheduler;

import com.eventradar.chain.BlockHeightResolver;
import com.eventradar.chain.cache.ProcessedEventCache;
import com.eventradar.dispatch.ActionDispatcher;
import com.eventradar.lock.JobLock;
import com.eventradar.metrics.SchedulerMetrics;
import com.eventradar.stream.EventStreamPublisher;

import java.time.Duration;

/**
 * Settings and collaborators shared by every worker of one manager.
 */
record WorkerContext(
        String managerId,
        Duration pollInterval,
        int confirmations,
        int maxBlockRange,
        boolean workerCacheReads,
        Duration lockTtl,
        String lockKeyPrefix,
        BlockHeightResolver blockHeights,
        ProcessedEventCache processedEvents,
        EventStreamPublisher publisher,
        ActionDispatcher dispatcher,
        JobLock jobLock,
        SchedulerMetrics metrics
) {
}
