package com.eventradar.chain;

import com.eventradar.domain.ChainLog;
import com.eventradar.metrics.SchedulerMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRpcChainClientTest {

    private static final String TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    private StubEvmRpcClient rpc;
    private SimpleMeterRegistry registry;
    private SchedulerMetrics metrics;

    @BeforeEach
    void setUp() {
        rpc = new StubEvmRpcClient();
        registry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(registry);
    }

    @Test
    void blockNumber_parsesHexQuantity() {
        rpc.respond((endpoint, method) -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10d4f\"}"));

        assertThat(client(List.of("https://a.rpc")).blockNumber()).isEqualTo(0x10d4fL);
        assertThat(rpc.calls).containsExactly("https://a.rpc eth_blockNumber");
        assertThat(registry.get("eventradar.scheduler.rpc.requests")
                .tag("chain_id", "11155111").tag("method", "eth_blockNumber").tag("status", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void networkChainId_parsesHexQuantity() {
        rpc.respond((endpoint, method) -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xaa36a7\"}"));

        assertThat(client(List.of("https://a.rpc")).networkChainId()).isEqualTo(BigInteger.valueOf(11155111L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void filterLogs_sendsRangeAddressAndTopic_andParsesLogs() {
        rpc.respond((endpoint, method) -> Mono.just("""
                {"jsonrpc":"2.0","id":1,"result":[
                  {"address":"0x0000000000000000000000000000000000000001","topics":["%s"],"data":"0x01",
                   "blockNumber":"0x65","blockHash":"0xbh","transactionHash":"0xabc","logIndex":"0x2","removed":false}
                ]}
                """.formatted(TOPIC)));

        List<ChainLog> logs = client(List.of("https://a.rpc"))
                .filterLogs(new LogFilter(100, 101, "0x0000000000000000000000000000000000000001", TOPIC));

        assertThat(logs).hasSize(1);
        ChainLog log = logs.get(0);
        assertThat(log.blockNumber()).isEqualTo(101L);
        assertThat(log.logIndex()).isEqualTo(2L);
        assertThat(log.transactionHash()).isEqualTo("0xabc");
        assertThat(log.topics()).containsExactly(TOPIC);
        assertThat(log.removed()).isFalse();

        Map<String, Object> filter = (Map<String, Object>) ((List<Object>) rpc.lastParams).get(0);
        assertThat(filter).containsEntry("fromBlock", "0x64")
                .containsEntry("toBlock", "0x65")
                .containsEntry("address", "0x0000000000000000000000000000000000000001")
                .containsEntry("topics", List.of(List.of(TOPIC)));
    }

    @Test
    void call_failsOverToNextEndpoint() {
        rpc.respond((endpoint, method) -> endpoint.contains("bad")
                ? Mono.error(new RpcException("503 Service Unavailable"))
                : Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x5\"}"));

        assertThat(client(List.of("https://bad.rpc", "https://good.rpc")).blockNumber()).isEqualTo(5L);
        assertThat(rpc.calls).containsExactly("https://bad.rpc eth_blockNumber", "https://good.rpc eth_blockNumber");
    }

    @Test
    void call_jsonRpcErrorOnEveryEndpoint_throwsRpcException() {
        rpc.respond((endpoint, method) -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"rate limit\"}}"));

        assertThatThrownBy(() -> client(List.of("https://a.rpc", "https://b.rpc")).blockNumber())
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("after 2 endpoint(s)")
                .hasRootCauseMessage("eth_blockNumber error: {\"code\":-32005,\"message\":\"rate limit\"}");
    }

    @Test
    void call_hangingEndpoint_timesOut() {
        rpc.respond((endpoint, method) -> Mono.never());
        JsonRpcChainClient client = new JsonRpcChainClient("11155111", rpc, new RpcEndpointRotator(List.of("https://slow.rpc")),
                fastLimiter(), new ObjectMapper(), metrics, Duration.ofMillis(50), 100);

        assertThatThrownBy(client::blockNumber).isInstanceOf(RpcException.class);
    }

    @Test
    void close_rejectsFurtherCalls() {
        rpc.respond((endpoint, method) -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x1\"}"));
        JsonRpcChainClient client = client(List.of("https://a.rpc"));

        client.close();
        client.close();

        assertThat(client.isClosed()).isTrue();
        assertThatThrownBy(client::blockNumber).isInstanceOf(RpcException.class).hasMessageContaining("closed");
        assertThat(rpc.calls).isEmpty();
    }

    private JsonRpcChainClient client(List<String> urls) {
        return new JsonRpcChainClient("11155111", rpc, new RpcEndpointRotator(urls), fastLimiter(),
                new ObjectMapper(), metrics, Duration.ofSeconds(5), 100);
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-evm-fast-limiter", config);
    }

    private static class StubEvmRpcClient implements EvmRpcClient {
        private final List<String> calls = new ArrayList<>();
        private BiFunction<String, String, Mono<String>> responder;
        private Object lastParams;

        void respond(BiFunction<String, String, Mono<String>> responder) {
            this.responder = responder;
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.add(endpointUrl + " " + method);
            lastParams = params;
            return responder.apply(endpointUrl, method);
        }
    }
}
