package com.eventradar.chain;

/**
 * eth_getLogs query for one contract and one event topic over an inclusive block range.
 */
public record LogFilter(long fromBlock, long toBlock, String address, String topic) {

    public LogFilter {
        if (fromBlock > toBlock) {
            throw new IllegalArgumentException("fromBlock " + fromBlock + " is after toBlock " + toBlock);
        }
    }
}
