package com.eventradar.chain;

import java.util.List;

/**
 * Opens a chain client for a configured chain. Does not perform the liveness check.
 */
public interface ChainClientFactory {

    ChainClient connect(String chainId, List<String> rpcUrls);
}
