package com.eventradar.domain;

import java.util.List;

/**
 * Point-in-time snapshot of the scheduler manager.
 */
public record SchedulerStats(
        String managerId,
        int totalWorkers,
        int runningWorkers,
        int maxWorkers,
        int connectedChains,
        List<String> supportedChains,
        boolean cacheAvailable,
        boolean streamAvailable
) {
}
