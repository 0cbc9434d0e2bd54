package com.eventradar.scheduler;

import com.eventradar.chain.BlockHeightResolver;
import com.eventradar.chain.LogFilter;
import com.eventradar.chain.RpcException;
import com.eventradar.chain.cache.CaffeineProcessedEventCache;
import com.eventradar.chain.cache.NoOpBlockNumberCache;
import com.eventradar.chain.cache.NoOpProcessedEventCache;
import com.eventradar.chain.cache.ProcessedEventCache;
import com.eventradar.common.CancellationToken;
import com.eventradar.dispatch.ActionDispatcher;
import com.eventradar.dispatch.DispatchResult;
import com.eventradar.domain.ChainLog;
import com.eventradar.domain.JobDefinition;
import com.eventradar.domain.WorkerState;
import com.eventradar.lock.JobLock;
import com.eventradar.lock.NoOpJobLock;
import com.eventradar.metrics.SchedulerMetrics;
import com.eventradar.stream.EventStream;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cache.caffeine.CaffeineCacheManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventWorkerTest {

    private static final String CHAIN = "11155111";
    private static final JobDefinition JOB = JobDefinition.of(7L, CHAIN, "0x0000000000000000000000000000000000000001",
            "Transfer(address,address,uint256)", CHAIN, "0x0000000000000000000000000000000000000002", "execute", true);

    private FakeChainClient chain;
    private RecordingEventStreamPublisher publisher;
    private SimpleMeterRegistry registry;
    private SchedulerMetrics metrics;
    private ActionDispatcher dispatcher;
    private JobLock jobLock;
    private CancellationToken root;
    private ProcessedEventCache processedEvents;
    private int maxBlockRange;

    @BeforeEach
    void setUp() {
        chain = new FakeChainClient(CHAIN, 100);
        publisher = new RecordingEventStreamPublisher();
        registry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(registry);
        dispatcher = request -> DispatchResult.ok();
        jobLock = new NoOpJobLock();
        root = CancellationToken.root();
        processedEvents = new NoOpProcessedEventCache();
        maxBlockRange = 2000;
    }

    private EventWorker worker(long startBlock, int confirmations) {
        WorkerContext ctx = new WorkerContext("m-1", Duration.ofMillis(10), confirmations, maxBlockRange, false,
                Duration.ofMinutes(15), "event_job_", new BlockHeightResolver(new NoOpBlockNumberCache()),
                processedEvents, publisher, dispatcher, jobLock, metrics);
        return new EventWorker(JOB, EventFilter.of(JOB), chain, startBlock, root.child(), ctx);
    }

    private static ChainLog log(long block, long index) {
        return new ChainLog("0x0000000000000000000000000000000000000001",
                List.of("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef"),
                "0x", block, "0xbh" + block, "0xtx" + block + "_" + index, index, false);
    }

    private Thread startInBackground(EventWorker worker) {
        Thread thread = new Thread(worker::start, "test-worker");
        thread.start();
        return thread;
    }

    @Test
    @DisplayName("scans from lastBlock+1 to head minus confirmations, then advances lastBlock")
    void checkForEvents_scansConfirmedRange() {
        EventWorker worker = worker(100, 3);
        chain.setHead(110);

        worker.checkForEvents();

        assertThat(chain.queries).containsExactly(new LogFilter(101, 107,
                "0x0000000000000000000000000000000000000001",
                "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef"));
        assertThat(worker.lastBlock()).isEqualTo(107);
    }

    @Test
    @DisplayName("successive scans are contiguous, never overlap and never reach unconfirmed blocks")
    void checkForEvents_rangesAreContiguous() {
        EventWorker worker = worker(100, 3);
        long[] heads = {104, 104, 106, 115, 113, 120};
        List<Long> observed = new ArrayList<>();

        for (long head : heads) {
            int before = chain.queries.size();
            chain.setHead(head);
            worker.checkForEvents();
            observed.add(worker.lastBlock());
            if (chain.queries.size() > before) {
                assertThat(chain.queries.get(chain.queries.size() - 1).toBlock()).isLessThanOrEqualTo(head - 3);
            }
        }

        assertThat(observed).isSorted();
        long expectedFrom = 101;
        for (LogFilter query : chain.queries) {
            assertThat(query.fromBlock()).isEqualTo(expectedFrom);
            expectedFrom = query.toBlock() + 1;
        }
        assertThat(expectedFrom - 1).isEqualTo(worker.lastBlock()).isEqualTo(117);
    }

    @Test
    void checkForEvents_noNewConfirmedBlocks_doesNotQuery() {
        EventWorker worker = worker(100, 3);
        chain.setHead(103);

        worker.checkForEvents();

        assertThat(chain.queries).isEmpty();
        assertThat(worker.lastBlock()).isEqualTo(100);
    }

    @Test
    @DisplayName("a head at or below the confirmation depth is used as-is")
    void checkForEvents_shallowChain_usesHead() {
        EventWorker worker = worker(0, 3);
        chain.setHead(2);

        worker.checkForEvents();

        assertThat(chain.queries).extracting(LogFilter::fromBlock, LogFilter::toBlock)
                .containsExactly(tuple(1L, 2L));
        assertThat(worker.lastBlock()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failed log query leaves lastBlock untouched")
    void checkForEvents_filterFailure_keepsLastBlock() {
        EventWorker worker = worker(100, 3);
        chain.setHead(110);
        chain.onLogs(f -> {
            throw new RpcException("eth_getLogs error");
        });

        assertThatThrownBy(worker::checkForEvents).isInstanceOf(RpcException.class);
        assertThat(worker.lastBlock()).isEqualTo(100);
    }

    @Test
    @DisplayName("a failed action does not abort the batch and the block range still counts as seen")
    void checkForEvents_dispatchFailure_continuesBatch() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher = request -> calls.incrementAndGet() == 1 ? DispatchResult.failed("executor 500") : DispatchResult.ok();
        EventWorker worker = worker(100, 3);
        chain.setHead(110);
        chain.onLogs(f -> List.of(log(105, 0), log(106, 1)));

        worker.checkForEvents();

        assertThat(calls.get()).isEqualTo(2);
        assertThat(worker.lastBlock()).isEqualTo(107);
        assertThat(publisher.ofType("event_detected")).hasSize(2)
                .allSatisfy(p -> assertThat(p.get("status")).isEqualTo("processing"));
        RecordingEventStreamPublisher.Published failed = publisher.last("event_failed");
        assertThat(failed.stream()).isEqualTo(EventStream.RETRY);
        assertThat(failed.get("status")).isEqualTo("failed");
        assertThat(failed.get("error")).isEqualTo("executor 500");
        assertThat(failed.get("tx_hash")).isEqualTo("0xtx105_0");
        RecordingEventStreamPublisher.Published completed = publisher.last("event_completed");
        assertThat(completed.stream()).isEqualTo(EventStream.READY);
        assertThat(completed.record()).containsKeys("duration_ms", "completed_at", "detected_at", "trigger_event", "target_function");
        assertThat(registry.get("eventradar.scheduler.events.detected").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("eventradar.scheduler.events.processed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("eventradar.scheduler.jobs.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a backlog wider than maxBlockRange is scanned in consecutive chunks")
    void checkForEvents_longBacklog_isChunked() {
        maxBlockRange = 10;
        EventWorker worker = worker(100, 3);
        chain.setHead(138);

        worker.checkForEvents();

        assertThat(chain.queries).extracting(LogFilter::fromBlock, LogFilter::toBlock)
                .containsExactly(tuple(101L, 110L), tuple(111L, 120L), tuple(121L, 130L), tuple(131L, 135L));
        assertThat(worker.lastBlock()).isEqualTo(135);
    }

    @Test
    @DisplayName("a failing chunk keeps the chunks before it and the next tick resumes after them")
    void checkForEvents_chunkFailure_resumesAfterLastGoodChunk() {
        maxBlockRange = 10;
        EventWorker worker = worker(100, 3);
        chain.setHead(128);
        chain.onLogs(f -> {
            if (f.fromBlock() == 111) {
                throw new RpcException("query returned more than 10000 results");
            }
            return List.of();
        });

        assertThatThrownBy(worker::checkForEvents).isInstanceOf(RpcException.class);
        assertThat(worker.lastBlock()).isEqualTo(110);

        chain.onLogs(f -> List.of());
        chain.queries.clear();
        worker.checkForEvents();

        assertThat(chain.queries).extracting(LogFilter::fromBlock, LogFilter::toBlock)
                .containsExactly(tuple(111L, 120L), tuple(121L, 125L));
        assertThat(worker.lastBlock()).isEqualTo(125);
    }

    @Test
    @DisplayName("a log seen again within the duplicate window is reported, not dispatched")
    void processEvent_duplicate_isSkipped() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher = request -> {
            calls.incrementAndGet();
            return DispatchResult.ok();
        };
        processedEvents = caffeineProcessedEvents();
        EventWorker worker = worker(100, 3);

        assertThat(worker.processEvent(log(105, 2))).isTrue();
        assertThat(worker.processEvent(log(105, 2))).isTrue();

        assertThat(calls.get()).isEqualTo(1);
        RecordingEventStreamPublisher.Published duplicate = publisher.last("event_duplicate_detected");
        assertThat(duplicate.stream()).isEqualTo(EventStream.READY);
        assertThat(duplicate.get("tx_hash")).isEqualTo("0xtx105_2");
        assertThat(duplicate.get("log_index")).isEqualTo(2L);
        assertThat(duplicate.record()).containsKeys("cached_at", "detected_at", "job_id", "manager_id");
        assertThat(publisher.ofType("event_completed")).hasSize(1);
        assertThat(registry.get("eventradar.scheduler.events.duplicate").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a rescheduled worker over the same blocks neither re-queries a processed range nor re-dispatches")
    void checkForEvents_reschedule_skipsProcessedRangeAndEvents() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher = request -> {
            calls.incrementAndGet();
            return DispatchResult.ok();
        };
        processedEvents = caffeineProcessedEvents();
        chain.setHead(110);
        chain.onLogs(f -> f.fromBlock() <= 105 && f.toBlock() >= 105 ? List.of(log(105, 0)) : List.of());

        worker(100, 3).checkForEvents();
        EventWorker sameRange = worker(100, 3);
        sameRange.checkForEvents();
        EventWorker overlapping = worker(102, 3);
        overlapping.checkForEvents();

        assertThat(chain.queries).extracting(LogFilter::fromBlock, LogFilter::toBlock)
                .containsExactly(tuple(101L, 107L), tuple(103L, 107L));
        assertThat(sameRange.lastBlock()).isEqualTo(107);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(publisher.ofType("event_duplicate_detected")).hasSize(1);
    }

    @Test
    @DisplayName("processed-event cache failures never block dispatch")
    void processEvent_cacheFailure_stillDispatches() {
        ProcessedEventCache broken = mock(ProcessedEventCache.class);
        when(broken.processedAt(anyString())).thenThrow(new IllegalStateException("redis down"));
        when(broken.isRangeProcessed(anyString())).thenThrow(new IllegalStateException("redis down"));
        processedEvents = broken;
        EventWorker worker = worker(100, 3);
        chain.setHead(110);
        chain.onLogs(f -> List.of(log(105, 0)));

        worker.checkForEvents();

        assertThat(publisher.ofType("event_completed")).hasSize(1);
        assertThat(worker.lastBlock()).isEqualTo(107);
    }

    private static ProcessedEventCache caffeineProcessedEvents() {
        return new CaffeineProcessedEventCache(new CaffeineCacheManager("processedEventCache", "processedRangeCache"),
                "processedEventCache", "processedRangeCache");
    }

    @Test
    void processEvent_dispatcherThrows_isReportedAsFailure() {
        dispatcher = request -> {
            throw new IllegalStateException("boom");
        };
        EventWorker worker = worker(100, 3);

        assertThat(worker.processEvent(log(101, 0))).isFalse();
        assertThat(publisher.last("event_failed").get("error")).isEqualTo("boom");
    }

    @Test
    void removedLogs_areSkipped() {
        EventWorker worker = worker(100, 0);
        chain.setHead(101);
        ChainLog removed = new ChainLog("0x01", List.of(), "0x", 101, "0xbh", "0xtx", 0, true);
        chain.onLogs(f -> List.of(removed));

        worker.checkForEvents();

        assertThat(publisher.ofType("event_detected")).isEmpty();
        assertThat(worker.lastBlock()).isEqualTo(101);
    }

    @Test
    @DisplayName("poll loop keeps running across RPC failures and reports each one")
    void start_pollFailure_keepsPolling() throws InterruptedException {
        chain.failHead(true);
        EventWorker worker = worker(100, 3);
        Thread thread = startInBackground(worker);

        Conditions.waitUntil(() -> publisher.ofType("worker_error").size() >= 2, Duration.ofSeconds(5));
        assertThat(worker.isRunning()).isTrue();
        RecordingEventStreamPublisher.Published error = publisher.last("worker_error");
        assertThat(error.stream()).isEqualTo(EventStream.RETRY);
        assertThat(error.get("current_block")).isEqualTo(100L);

        chain.failHead(false);
        chain.setHead(120);
        Conditions.waitUntil(() -> worker.lastBlock() == 117, Duration.ofSeconds(5));

        worker.stop();
        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        thread.join(5_000);
        assertThat(registry.get("eventradar.scheduler.worker.errors").counter().count()).isGreaterThanOrEqualTo(2.0);
        assertThat(publisher.last("worker_stopped").get("last_block")).isEqualTo(117L);
    }

    @Test
    @DisplayName("stop twice has the effect of stopping once")
    void stop_isIdempotent() throws InterruptedException {
        EventWorker worker = worker(100, 3);
        startInBackground(worker);
        Conditions.waitUntil(worker::isRunning, Duration.ofSeconds(5));

        worker.stop();
        worker.stop();

        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(registry.get("eventradar.scheduler.worker.stopped").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("eventradar.scheduler.workers.active").gauge().value()).isZero();
        assertThat(publisher.ofType("worker_stopped")).hasSize(1);
    }

    @Test
    @DisplayName("cancelling the parent token ends the loop")
    void start_rootCancelled_exits() throws InterruptedException {
        EventWorker worker = worker(100, 3);
        startInBackground(worker);
        Conditions.waitUntil(worker::isRunning, Duration.ofSeconds(5));

        root.cancel();

        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.isRunning()).isFalse();
    }

    @Test
    @DisplayName("a worker stopped before it starts never runs")
    void stop_beforeStart_neverRuns() throws InterruptedException {
        EventWorker worker = worker(100, 3);

        worker.stop();
        worker.start();

        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(worker.awaitTermination(Duration.ZERO)).isTrue();
        assertThat(publisher.ofType("worker_started")).isEmpty();
        assertThat(registry.get("eventradar.scheduler.workers.active").gauge().value()).isZero();
    }

    @Test
    @DisplayName("a job already locked by another manager stops the worker")
    void start_lockConflict_stopsWorker() {
        jobLock = mock(JobLock.class);
        when(jobLock.isEnabled()).thenReturn(true);
        when(jobLock.tryAcquire(eq("event_job_7_11155111"), eq("m-1"), any())).thenReturn(false);
        EventWorker worker = worker(100, 3);

        worker.start();

        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(publisher.last("worker_lock_conflict").stream()).isEqualTo(EventStream.RETRY);
        assertThat(publisher.ofType("worker_started")).isEmpty();
        assertThat(chain.queries).isEmpty();
    }

    @Test
    @DisplayName("a lock store failure is reported and the worker runs without the lock")
    void start_lockStoreFailure_continues() throws InterruptedException {
        jobLock = mock(JobLock.class);
        when(jobLock.isEnabled()).thenReturn(true);
        when(jobLock.tryAcquire(anyString(), anyString(), any())).thenThrow(new IllegalStateException("redis down"));
        EventWorker worker = worker(100, 3);
        startInBackground(worker);

        Conditions.waitUntil(() -> !publisher.ofType("worker_started").isEmpty(), Duration.ofSeconds(5));
        assertThat(publisher.last("worker_lock_failed").get("error")).isEqualTo("redis down");
        assertThat(publisher.last("worker_started").get("lock_held")).isEqualTo(false);

        worker.stop();
        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void start_lockHeld_isReleasedOnExit() throws InterruptedException {
        jobLock = mock(JobLock.class);
        when(jobLock.isEnabled()).thenReturn(true);
        when(jobLock.tryAcquire(anyString(), anyString(), any())).thenReturn(true);
        when(jobLock.refresh(anyString(), anyString(), any())).thenReturn(true);
        EventWorker worker = worker(100, 3);
        startInBackground(worker);
        Conditions.waitUntil(() -> !publisher.ofType("worker_started").isEmpty(), Duration.ofSeconds(5));

        worker.stop();

        assertThat(worker.awaitTermination(Duration.ofSeconds(5))).isTrue();
        verify(jobLock).release("event_job_7_11155111", "m-1");
    }

    @Test
    void stats_reflectsProgress() {
        EventWorker worker = worker(100, 3);
        chain.setHead(110);
        worker.checkForEvents();

        assertThat(worker.stats().startBlock()).isEqualTo(100);
        assertThat(worker.stats().lastBlock()).isEqualTo(107);
        assertThat(worker.stats().contractAddress()).isEqualTo("0x0000000000000000000000000000000000000001");
        assertThat(worker.stats().running()).isFalse();
    }
}
