package com.eventradar.chain;

import com.eventradar.domain.ChainLog;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only connection to one chain, shared by every worker watching that chain.
 * Implementations are thread-safe. Only the owner of the client pool may close it.
 */
public interface ChainClient extends AutoCloseable {

    /** Chain ID this client was configured for. */
    String chainId();

    /**
     * Current head block number.
     *
     * @throws RpcException on transport or RPC failure
     */
    long blockNumber();

    /**
     * Logs matching the filter, in node order.
     *
     * @throws RpcException on transport or RPC failure
     */
    List<ChainLog> filterLogs(LogFilter filter);

    /**
     * Network chain ID as reported by the node. Used as a liveness check.
     *
     * @throws RpcException on transport or RPC failure
     */
    BigInteger networkChainId();

    @Override
    void close();
}
