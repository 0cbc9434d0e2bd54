package com.eventradar.chain;

import com.eventradar.domain.ChainLog;
import com.eventradar.metrics.SchedulerMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ChainClient} over EVM JSON-RPC. Each call goes through the shared rate limiter, is bounded by the
 * RPC timeout and fails over across the chain's endpoints in round-robin order.
 */
@Slf4j
public class JsonRpcChainClient implements ChainClient {

    private final String chainId;
    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final SchedulerMetrics metrics;
    private final Duration rpcTimeout;
    private final long limiterLogThresholdMs;
    private volatile boolean closed;

    public JsonRpcChainClient(
            String chainId,
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            SchedulerMetrics metrics,
            Duration rpcTimeout,
            long limiterLogThresholdMs
    ) {
        this.chainId = chainId;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.rpcTimeout = rpcTimeout;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
    }

    @Override
    public String chainId() {
        return chainId;
    }

    @Override
    public long blockNumber() {
        JsonNode result = call("eth_blockNumber", Collections.emptyList());
        return Numeric.decodeQuantity(result.asText()).longValueExact();
    }

    @Override
    public BigInteger networkChainId() {
        JsonNode result = call("eth_chainId", Collections.emptyList());
        return Numeric.decodeQuantity(result.asText());
    }

    @Override
    public List<ChainLog> filterLogs(LogFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fromBlock", Numeric.encodeQuantity(BigInteger.valueOf(filter.fromBlock())));
        params.put("toBlock", Numeric.encodeQuantity(BigInteger.valueOf(filter.toBlock())));
        params.put("address", filter.address());
        params.put("topics", List.of(List.of(filter.topic())));
        JsonNode result = call("eth_getLogs", Collections.singletonList(params));
        if (!result.isArray()) {
            return List.of();
        }
        List<ChainLog> logs = new ArrayList<>(result.size());
        result.forEach(node -> logs.add(toChainLog(node)));
        return logs;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Chain client closed: chainId={}", chainId);
        }
    }

    boolean isClosed() {
        return closed;
    }

    private JsonNode call(String method, Object params) {
        if (closed) {
            throw new RpcException("Chain client for " + chainId + " is closed");
        }
        RuntimeException lastException = null;
        int attempts = rotator.getEndpoints().size();
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = rotator.getNextEndpoint();
            try {
                JsonNode result = parseResult(method, callRpc(endpoint, method, params));
                metrics.rpcRequest(chainId, method, true);
                return result;
            } catch (RuntimeException e) {
                metrics.rpcRequest(chainId, method, false);
                log.debug("RPC {} failed on {} (chainId={}): {}", method, endpoint, chainId, e.getMessage());
                lastException = e;
            }
        }
        throw new RpcException(method + " failed on chain " + chainId + " after " + attempts + " endpoint(s)", lastException);
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).timeout(rpcTimeout).block();
        if (json == null) {
            throw new RpcException("Empty " + method + " response from " + endpoint);
        }
        return json;
    }

    private JsonNode parseResult(String method, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return result;
    }

    private static ChainLog toChainLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText()));
        return new ChainLog(
                node.path("address").asText(),
                topics,
                node.path("data").asText("0x"),
                quantity(node.path("blockNumber")),
                node.path("blockHash").asText(null),
                node.path("transactionHash").asText(null),
                quantity(node.path("logIndex")),
                node.path("removed").asBoolean(false)
        );
    }

    private static long quantity(JsonNode node) {
        String hex = node.asText(null);
        if (hex == null || hex.isEmpty()) {
            return 0L;
        }
        return Numeric.decodeQuantity(hex).longValueExact();
    }
}
