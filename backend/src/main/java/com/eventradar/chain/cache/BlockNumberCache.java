package com.eventradar.chain.cache;

import java.util.OptionalLong;

/**
 * Short-lived cache of the latest head block per chain. Values may be stale by up to the configured TTL.
 * Implementations must not throw for a missing entry; backend failures surface as runtime exceptions.
 */
public interface BlockNumberCache {

    String KEY_PREFIX = "block_number_";

    OptionalLong get(String chainId);

    void put(String chainId, long blockNumber);

    /** False when the cache is disabled or its backend is unreachable. */
    boolean isAvailable();

    static String key(String chainId) {
        return KEY_PREFIX + chainId;
    }
}
