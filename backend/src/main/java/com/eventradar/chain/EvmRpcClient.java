package com.eventradar.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Endpoint choice, throttling and timeouts are applied by {@link JsonRpcChainClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
