package com.eventradar.scheduler;

import com.eventradar.chain.ChainClient;
import com.eventradar.chain.LogFilter;
import com.eventradar.chain.cache.ProcessedEventCache;
import com.eventradar.common.CancellationToken;
import com.eventradar.dispatch.DispatchRequest;
import com.eventradar.dispatch.DispatchResult;
import com.eventradar.domain.ChainLog;
import com.eventradar.domain.JobDefinition;
import com.eventradar.domain.JobEventType;
import com.eventradar.domain.JobWorkerStats;
import com.eventradar.domain.WorkerState;
import com.eventradar.stream.EventStream;
import com.eventradar.stream.JobEventRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Watches one job's contract event on its trigger chain. Polls on a fixed interval, scans each confirmed block
 * range exactly once in increasing order and dispatches every matched log. Logs already dispatched within the
 * duplicate window are reported and skipped.
 * <p>
 * Lifecycle is CREATED, RUNNING, STOPPED. {@link #start()} runs the poll loop on the calling thread;
 * {@link #stop()} is idempotent and may be called from any thread. The chain client is borrowed and never closed here.
 */
@Slf4j
public class EventWorker {

    private final JobDefinition job;
    private final EventFilter filter;
    private final ChainClient client;
    private final long startBlock;
    private final CancellationToken token;
    private final WorkerContext ctx;
    private final String lockKey;

    private final Object stateLock = new Object();
    private WorkerState state = WorkerState.CREATED;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile long lastBlock;
    private volatile Instant startedAt;
    private boolean lockHeld;

    EventWorker(JobDefinition job, EventFilter filter, ChainClient client, long startBlock,
                CancellationToken token, WorkerContext ctx) {
        this.job = job;
        this.filter = filter;
        this.client = client;
        this.startBlock = startBlock;
        this.lastBlock = startBlock;
        this.token = token;
        this.ctx = ctx;
        this.lockKey = ctx.lockKeyPrefix() + job.jobId() + "_" + job.triggerChainId();
    }

    /**
     * Runs the poll loop until the worker is stopped or its token is cancelled. Does nothing unless the worker
     * is still CREATED.
     */
    public void start() {
        synchronized (stateLock) {
            if (state != WorkerState.CREATED) {
                log.debug("Worker not started, state={}: jobId={}", state, job.jobId());
                return;
            }
            state = WorkerState.RUNNING;
            startedAt = Instant.now();
            ctx.metrics().workerStarted();
        }
        try {
            if (!acquireLock()) {
                return;
            }
            publish(EventStream.READY, record(JobEventType.WORKER_STARTED)
                    .put("start_block", startBlock)
                    .put("event_topic", filter.topic())
                    .put("lock_held", lockHeld)
                    .put("poll_interval_ms", ctx.pollInterval().toMillis()));
            log.info("Worker started: jobId={}, chainId={}, contract={}, event={}, startBlock={}",
                    job.jobId(), job.triggerChainId(), filter.contractAddress(), job.triggerEvent(), startBlock);
            while (!token.await(ctx.pollInterval())) {
                pollOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            releaseLock();
            long runtimeMs = Duration.between(startedAt, Instant.now()).toMillis();
            publish(EventStream.READY, record(JobEventType.WORKER_STOPPED)
                    .put("last_block", lastBlock)
                    .put("runtime_ms", runtimeMs));
            log.info("Worker stopped: jobId={}, runtimeMs={}, lastBlock={}", job.jobId(), runtimeMs, lastBlock);
            stop();
            done.countDown();
        }
    }

    /**
     * Moves the worker to STOPPED and cancels its token. Later calls are no-ops.
     */
    public void stop() {
        boolean wasRunning;
        synchronized (stateLock) {
            if (state == WorkerState.STOPPED) {
                return;
            }
            wasRunning = state == WorkerState.RUNNING;
            state = WorkerState.STOPPED;
        }
        token.cancel();
        ctx.metrics().workerStopped(wasRunning);
        if (!wasRunning) {
            done.countDown();
        }
    }

    /**
     * Waits for the poll loop to exit.
     *
     * @return true if the loop exited (or never ran) within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void pollOnce() {
        try {
            refreshLock();
            checkForEvents();
        } catch (RuntimeException e) {
            log.error("Poll failed: jobId={}, chainId={}, lastBlock={}, error={}",
                    job.jobId(), job.triggerChainId(), lastBlock, e.getMessage());
            ctx.metrics().workerError();
            publish(EventStream.RETRY, record(JobEventType.WORKER_ERROR)
                    .put(JobEventRecord.ERROR, String.valueOf(e.getMessage()))
                    .put("current_block", lastBlock));
        }
    }

    /**
     * Scans every confirmed block past the last processed one in consecutive ranges of at most
     * {@code maxBlockRange} blocks. The last processed block advances after each range.
     */
    void checkForEvents() {
        long head = ctx.blockHeights().currentBlock(job.triggerChainId(), client, ctx.workerCacheReads());
        long confirmations = ctx.confirmations();
        long safeBlock = head > confirmations ? head - confirmations : head;
        if (safeBlock <= lastBlock) {
            log.debug("No new confirmed blocks: jobId={}, head={}, lastBlock={}", job.jobId(), head, lastBlock);
            return;
        }
        while (lastBlock < safeBlock && !token.isCancelled()) {
            long fromBlock = lastBlock + 1;
            long toBlock = Math.min(safeBlock, fromBlock + ctx.maxBlockRange() - 1);
            scanRange(fromBlock, toBlock);
            lastBlock = toBlock;
        }
    }

    private void scanRange(long fromBlock, long toBlock) {
        String rangeKey = ProcessedEventCache.rangeKey(job.jobId(), fromBlock, toBlock);
        if (isRangeProcessed(rangeKey)) {
            log.debug("Block range already processed: jobId={}, fromBlock={}, toBlock={}", job.jobId(), fromBlock, toBlock);
            return;
        }
        List<ChainLog> logs = client.filterLogs(new LogFilter(fromBlock, toBlock, filter.contractAddress(), filter.topic()));
        log.debug("Scanned blocks: jobId={}, fromBlock={}, toBlock={}, logs={}", job.jobId(), fromBlock, toBlock, logs.size());
        for (ChainLog event : logs) {
            if (!event.removed()) {
                processEvent(event);
            }
        }
        markRangeProcessed(rangeKey, logs.size());
    }

    /**
     * Dispatches one matched log and records the outcome. Never throws.
     *
     * @return false only when the downstream action failed; a skipped duplicate counts as success
     */
    boolean processEvent(ChainLog event) {
        Instant detectedAt = Instant.now();
        ctx.metrics().eventDetected();
        String eventKey = ProcessedEventCache.eventKey(job.jobId(), event.transactionHash(), event.logIndex());
        Optional<String> processedAt = processedAt(eventKey);
        if (processedAt.isPresent()) {
            ctx.metrics().eventDuplicate();
            publish(EventStream.READY, record(JobEventType.EVENT_DUPLICATE_DETECTED)
                    .log(event)
                    .put("cached_at", processedAt.get())
                    .put("detected_at", detectedAt.getEpochSecond()));
            log.debug("Event already processed, skipping: jobId={}, txHash={}, logIndex={}, processedAt={}",
                    job.jobId(), event.transactionHash(), event.logIndex(), processedAt.get());
            return true;
        }
        markProcessed(eventKey, detectedAt);

        JobEventRecord record = record(JobEventType.EVENT_DETECTED)
                .log(event)
                .put("detected_at", detectedAt.getEpochSecond())
                .put(JobEventRecord.STATUS, "processing");
        publish(EventStream.READY, record);

        DispatchResult result;
        try {
            result = ctx.dispatcher().dispatch(new DispatchRequest(job, event, ctx.managerId()));
        } catch (RuntimeException e) {
            result = DispatchResult.failed(String.valueOf(e.getMessage()));
        }
        long durationMs = Duration.between(detectedAt, Instant.now()).toMillis();
        ctx.metrics().actionExecution(result.success());
        record.put("duration_ms", durationMs).put("completed_at", Instant.now().getEpochSecond());
        if (result.success()) {
            ctx.metrics().eventProcessed();
            publish(EventStream.READY, record.eventType(JobEventType.EVENT_COMPLETED).put(JobEventRecord.STATUS, "completed"));
            log.info("Event processed: jobId={}, txHash={}, block={}, durationMs={}",
                    job.jobId(), event.transactionHash(), event.blockNumber(), durationMs);
        } else {
            ctx.metrics().jobFailed();
            publish(EventStream.RETRY, record.eventType(JobEventType.EVENT_FAILED)
                    .put(JobEventRecord.STATUS, "failed")
                    .put(JobEventRecord.ERROR, result.error()));
            log.error("Event action failed: jobId={}, txHash={}, block={}, error={}",
                    job.jobId(), event.transactionHash(), event.blockNumber(), result.error());
        }
        return result.success();
    }

    private Optional<String> processedAt(String eventKey) {
        try {
            return ctx.processedEvents().processedAt(eventKey);
        } catch (RuntimeException e) {
            log.warn("Processed-event lookup failed, dispatching anyway: key={}, error={}", eventKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void markProcessed(String eventKey, Instant at) {
        try {
            ctx.processedEvents().markProcessed(eventKey, Long.toString(at.getEpochSecond()));
        } catch (RuntimeException e) {
            log.warn("Failed to record processed event: key={}, error={}", eventKey, e.getMessage());
        }
    }

    private boolean isRangeProcessed(String rangeKey) {
        try {
            return ctx.processedEvents().isRangeProcessed(rangeKey);
        } catch (RuntimeException e) {
            log.warn("Processed-range lookup failed, scanning anyway: key={}, error={}", rangeKey, e.getMessage());
            return false;
        }
    }

    private void markRangeProcessed(String rangeKey, int eventsFound) {
        try {
            ctx.processedEvents().markRangeProcessed(rangeKey, eventsFound);
        } catch (RuntimeException e) {
            log.warn("Failed to record processed range: key={}, error={}", rangeKey, e.getMessage());
        }
    }

    private boolean acquireLock() {
        if (!ctx.jobLock().isEnabled()) {
            return true;
        }
        try {
            if (ctx.jobLock().tryAcquire(lockKey, ctx.managerId(), ctx.lockTtl())) {
                lockHeld = true;
                return true;
            }
            log.warn("Job already watched by another manager, stopping worker: jobId={}, lockKey={}", job.jobId(), lockKey);
            publish(EventStream.RETRY, record(JobEventType.WORKER_LOCK_CONFLICT).put("lock_key", lockKey));
            return false;
        } catch (RuntimeException e) {
            log.warn("Job lock unavailable, continuing without it: jobId={}, error={}", job.jobId(), e.getMessage());
            publish(EventStream.RETRY, record(JobEventType.WORKER_LOCK_FAILED)
                    .put("lock_key", lockKey)
                    .put(JobEventRecord.ERROR, String.valueOf(e.getMessage())));
            return true;
        }
    }

    private void refreshLock() {
        if (!lockHeld) {
            return;
        }
        try {
            if (!ctx.jobLock().refresh(lockKey, ctx.managerId(), ctx.lockTtl())) {
                log.warn("Job lock no longer held: jobId={}, lockKey={}", job.jobId(), lockKey);
            }
        } catch (RuntimeException e) {
            log.warn("Job lock refresh failed: jobId={}, error={}", job.jobId(), e.getMessage());
        }
    }

    private void releaseLock() {
        if (!lockHeld) {
            return;
        }
        try {
            ctx.jobLock().release(lockKey, ctx.managerId());
        } catch (RuntimeException e) {
            log.warn("Job lock release failed: jobId={}, error={}", job.jobId(), e.getMessage());
        } finally {
            lockHeld = false;
        }
    }

    private JobEventRecord record(JobEventType type) {
        return JobEventRecord.of(type, ctx.managerId()).job(job);
    }

    private void publish(EventStream stream, JobEventRecord record) {
        ctx.publisher().publish(stream, record.toMap());
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return state == WorkerState.RUNNING;
        }
    }

    public WorkerState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public long lastBlock() {
        return lastBlock;
    }

    public JobDefinition job() {
        return job;
    }

    JobWorkerStats stats() {
        WorkerState current = state();
        return new JobWorkerStats(job.jobId(), current == WorkerState.RUNNING, current, job.triggerChainId(),
                filter.contractAddress(), job.triggerEvent(), startBlock, lastBlock, ctx.managerId());
    }
}
