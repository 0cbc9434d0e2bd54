package com.eventradar.domain;

import java.util.List;

/**
 * One contract log entry as returned by eth_getLogs.
 */
public record ChainLog(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        String blockHash,
        String transactionHash,
        long logIndex,
        boolean removed
) {

    public ChainLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }
}
