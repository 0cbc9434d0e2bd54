package com.eventradar.chain.cache;

import java.util.OptionalLong;

/** Used when block-number caching is disabled. */
public class NoOpBlockNumberCache implements BlockNumberCache {

    @Override
    public OptionalLong get(String chainId) {
        return OptionalLong.empty();
    }

    @Override
    public void put(String chainId, long blockNumber) {
        // disabled
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
