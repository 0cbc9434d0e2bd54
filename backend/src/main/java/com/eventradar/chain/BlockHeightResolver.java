package com.eventradar.chain;

import com.eventradar.chain.cache.BlockNumberCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalLong;

/**
 * Resolves the current head block of a chain, optionally reading through the block-number cache.
 * Cache failures never fail the lookup: the value is fetched from the chain and written back best-effort.
 */
@Slf4j
@RequiredArgsConstructor
public class BlockHeightResolver {

    private final BlockNumberCache cache;

    /**
     * @param readThroughCache when true a cached value (at most one TTL old) is returned without an RPC call
     * @throws RpcException when the chain cannot be queried
     */
    public long currentBlock(String chainId, ChainClient client, boolean readThroughCache) {
        if (readThroughCache) {
            try {
                OptionalLong cached = cache.get(chainId);
                if (cached.isPresent()) {
                    return cached.getAsLong();
                }
            } catch (RuntimeException e) {
                log.warn("Block-number cache read failed, falling back to RPC: chainId={}, error={}", chainId, e.getMessage());
            }
        }
        long head = client.blockNumber();
        try {
            cache.put(chainId, head);
        } catch (RuntimeException e) {
            log.warn("Block-number cache write failed: chainId={}, error={}", chainId, e.getMessage());
        }
        return head;
    }

    public boolean isCacheAvailable() {
        try {
            return cache.isAvailable();
        } catch (RuntimeException e) {
            return false;
        }
    }
}
