package com.eventradar.domain;

/**
 * Point-in-time snapshot of one job's worker.
 */
public record JobWorkerStats(
        long jobId,
        boolean running,
        WorkerState state,
        String triggerChainId,
        String contractAddress,
        String triggerEvent,
        long startBlock,
        long lastBlock,
        String managerId
) {
}
