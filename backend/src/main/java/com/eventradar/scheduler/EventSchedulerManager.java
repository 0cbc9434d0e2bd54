package com.eventradar.scheduler;

import com.eventradar.chain.BlockHeightResolver;
import com.eventradar.chain.ChainClient;
import com.eventradar.chain.ChainClientPool;
import com.eventradar.chain.cache.ProcessedEventCache;
import com.eventradar.common.CancellationToken;
import com.eventradar.dispatch.ActionDispatcher;
import com.eventradar.domain.JobDefinition;
import com.eventradar.domain.JobEventType;
import com.eventradar.domain.JobWorkerStats;
import com.eventradar.domain.SchedulerStats;
import com.eventradar.lock.JobLock;
import com.eventradar.metrics.SchedulerMetrics;
import com.eventradar.scheduler.config.SchedulerProperties;
import com.eventradar.stream.EventStream;
import com.eventradar.stream.EventStreamPublisher;
import com.eventradar.stream.JobEventRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the worker registry and the shared chain clients. One {@link EventWorker} runs per scheduled job.
 * <p>
 * The registry lock is held only for map access, never across RPC, cache or stream I/O.
 * A single root cancellation token is the shutdown signal for every worker.
 */
@Slf4j
public class EventSchedulerManager {

    private final String managerId;
    private final int maxWorkers;
    private final Duration stopGracePeriod;
    private final ChainClientPool chainClients;
    private final BlockHeightResolver blockHeights;
    private final EventStreamPublisher publisher;
    private final SchedulerMetrics metrics;
    private final WorkerContext workerContext;
    private final Executor workerExecutor;

    private final CancellationToken rootToken = CancellationToken.root();
    private final Map<Long, EventWorker> workers = new HashMap<>();
    private final ReadWriteLock workersLock = new ReentrantReadWriteLock();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final Instant startedAt = Instant.now();

    /**
     * Connects every configured chain. Chains that fail are skipped.
     *
     * @throws SchedulerException with reason NO_CHAINS_CONNECTED when no chain could be reached
     */
    public EventSchedulerManager(
            SchedulerProperties properties,
            ChainClientPool chainClients,
            BlockHeightResolver blockHeights,
            ProcessedEventCache processedEvents,
            EventStreamPublisher publisher,
            ActionDispatcher dispatcher,
            JobLock jobLock,
            SchedulerMetrics metrics,
            Executor workerExecutor
    ) {
        this.managerId = properties.getManagerId();
        this.maxWorkers = properties.getMaxWorkers();
        this.stopGracePeriod = properties.getStopGracePeriod();
        this.chainClients = chainClients;
        this.blockHeights = blockHeights;
        this.publisher = publisher;
        this.metrics = metrics;
        this.workerExecutor = workerExecutor;
        this.workerContext = new WorkerContext(
                managerId,
                properties.getPollInterval(),
                properties.getBlockConfirmations(),
                properties.getMaxBlockRange(),
                properties.getCache().isWorkerReads(),
                properties.getLock().getTtl(),
                properties.getLock().getKeyPrefix(),
                blockHeights,
                processedEvents,
                publisher,
                dispatcher,
                jobLock,
                metrics
        );

        int connected = chainClients.connectAll(properties.rpcUrlsByChain());
        if (connected == 0) {
            throw new SchedulerException(SchedulerException.Reason.NO_CHAINS_CONNECTED,
                    "no chains connected out of " + properties.getChains().size() + " configured");
        }
        boolean cacheAvailable = blockHeights.isCacheAvailable();
        boolean streamAvailable = publisher.isAvailable();
        publisher.publish(EventStream.READY, JobEventRecord.of(JobEventType.SCHEDULER_STARTUP, managerId)
                .put("max_workers", maxWorkers)
                .put("connected_chains", connected)
                .put("supported_chains", chainClients.chainIds())
                .put("cache_available", cacheAvailable)
                .put("stream_available", streamAvailable)
                .toMap());
        log.info("Event scheduler initialized: managerId={}, maxWorkers={}, chains={}, cacheAvailable={}, streamAvailable={}",
                managerId, maxWorkers, chainClients.chainIds(), cacheAvailable, streamAvailable);
    }

    /**
     * Creates and starts a worker for the job.
     *
     * @throws SchedulerException if the job is already scheduled, the registry is full, the trigger chain is not
     *                            connected, the contract address is invalid, or the chain head cannot be read
     */
    public void scheduleJob(JobDefinition job) {
        long begin = System.nanoTime();
        try {
            if (stopped.get()) {
                throw SchedulerException.stopped(managerId, job.jobId());
            }
            ChainClient client;
            workersLock.readLock().lock();
            try {
                checkCapacity(job);
                client = chainClients.get(job.triggerChainId())
                        .orElseThrow(() -> SchedulerException.unsupportedChain(job.triggerChainId()));
            } finally {
                workersLock.readLock().unlock();
            }
            EventFilter filter = EventFilter.of(job);

            long startBlock;
            try {
                startBlock = blockHeights.currentBlock(job.triggerChainId(), client, true);
            } catch (RuntimeException e) {
                throw new SchedulerException(SchedulerException.Reason.CHAIN_UNAVAILABLE,
                        "failed to get current block for chain " + job.triggerChainId() + ": " + e.getMessage(), e);
            }

            EventWorker worker;
            int activeWorkers;
            workersLock.writeLock().lock();
            try {
                // stop() may have emptied the registry while the start block was being read
                if (stopped.get()) {
                    throw SchedulerException.stopped(managerId, job.jobId());
                }
                checkCapacity(job);
                worker = new EventWorker(job, filter, client, startBlock, rootToken.child(), workerContext);
                workers.put(job.jobId(), worker);
                activeWorkers = workers.size();
            } finally {
                workersLock.writeLock().unlock();
            }

            try {
                workerExecutor.execute(worker::start);
            } catch (RejectedExecutionException e) {
                removeWorker(job.jobId(), worker);
                worker.stop();
                throw new SchedulerException(SchedulerException.Reason.WORKER_START_FAILED,
                        "failed to start worker for job " + job.jobId() + ": " + e.getMessage(), e);
            }

            metrics.jobScheduled();
            long durationMs = (System.nanoTime() - begin) / 1_000_000L;
            publisher.publish(EventStream.READY, JobEventRecord.of(JobEventType.JOB_SCHEDULED, managerId)
                    .job(job)
                    .put("start_block", startBlock)
                    .put("active_workers", activeWorkers)
                    .put("max_workers", maxWorkers)
                    .put("schedule_duration_ms", durationMs)
                    .toMap());
            log.info("Job scheduled: jobId={}, chainId={}, contract={}, startBlock={}, activeWorkers={}/{}",
                    job.jobId(), job.triggerChainId(), filter.contractAddress(), startBlock, activeWorkers, maxWorkers);
        } catch (SchedulerException e) {
            log.warn("Job schedule failed: jobId={}, reason={}, error={}", job.jobId(), e.getReason(), e.getMessage());
            publisher.publish(EventStream.RETRY, JobEventRecord.of(JobEventType.JOB_SCHEDULE_FAILED, managerId)
                    .job(job)
                    .put(JobEventRecord.ERROR, e.getMessage())
                    .put("reason", e.getReason().name())
                    .put("error_kind", e.getKind().name())
                    .toMap());
            throw e;
        }
    }

    /** Caller holds the registry lock. */
    private void checkCapacity(JobDefinition job) {
        if (workers.containsKey(job.jobId())) {
            throw SchedulerException.alreadyScheduled(job.jobId());
        }
        if (workers.size() >= maxWorkers) {
            throw SchedulerException.maxWorkersReached(maxWorkers, job.jobId());
        }
    }

    private void removeWorker(long jobId, EventWorker worker) {
        workersLock.writeLock().lock();
        try {
            workers.remove(jobId, worker);
        } finally {
            workersLock.writeLock().unlock();
        }
    }

    /**
     * Stops and removes the job's worker, waiting up to the grace period for its current tick.
     *
     * @throws SchedulerException with reason JOB_NOT_FOUND if the job is not scheduled
     */
    public void unscheduleJob(long jobId) {
        EventWorker worker;
        long lastBlock;
        boolean wasRunning;
        int remaining;
        workersLock.writeLock().lock();
        try {
            worker = workers.remove(jobId);
            remaining = workers.size();
            lastBlock = worker != null ? worker.lastBlock() : 0L;
            wasRunning = worker != null && worker.isRunning();
        } finally {
            workersLock.writeLock().unlock();
        }
        if (worker == null) {
            SchedulerException e = SchedulerException.notScheduled(jobId);
            log.warn("Job unschedule failed: jobId={}, error={}", jobId, e.getMessage());
            publisher.publish(EventStream.RETRY, JobEventRecord.of(JobEventType.JOB_UNSCHEDULE_FAILED, managerId)
                    .put(JobEventRecord.JOB_ID, jobId)
                    .put(JobEventRecord.ERROR, e.getMessage())
                    .put("reason", e.getReason().name())
                    .toMap());
            throw e;
        }

        worker.stop();
        awaitWorker(worker, stopGracePeriod);
        metrics.jobsUnscheduled(1);
        publisher.publish(EventStream.READY, JobEventRecord.of(JobEventType.JOB_UNSCHEDULED, managerId)
                .job(worker.job())
                .put("last_block", lastBlock)
                .put("was_running", wasRunning)
                .put("remaining_workers", remaining)
                .toMap());
        log.info("Job unscheduled: jobId={}, lastBlock={}, wasRunning={}, remainingWorkers={}",
                jobId, lastBlock, wasRunning, remaining);
    }

    /**
     * Blocks until the token is cancelled, then stops the scheduler.
     */
    public void start(CancellationToken token) {
        log.info("Event scheduler running: managerId={}", managerId);
        try {
            token.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stop();
        }
    }

    /**
     * Stops every worker, empties the registry and closes all chain clients. Later calls are no-ops.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        long begin = System.nanoTime();
        log.info("Stopping event scheduler: managerId={}", managerId);
        rootToken.cancel();

        List<EventWorker> toStop;
        workersLock.writeLock().lock();
        try {
            toStop = new ArrayList<>(workers.values());
            workers.clear();
        } finally {
            workersLock.writeLock().unlock();
        }

        int running = 0;
        List<Map<String, Object>> details = new ArrayList<>();
        for (EventWorker worker : toStop) {
            boolean wasRunning = worker.isRunning();
            if (wasRunning) {
                running++;
            }
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("job_id", worker.job().jobId());
            detail.put("last_block", worker.lastBlock());
            detail.put("was_running", wasRunning);
            details.add(detail);
            worker.stop();
        }
        long deadline = System.nanoTime() + stopGracePeriod.toNanos();
        for (EventWorker worker : toStop) {
            awaitWorker(worker, Duration.ofNanos(Math.max(0L, deadline - System.nanoTime())));
        }
        metrics.jobsUnscheduled(toStop.size());
        int chains = chainClients.closeAll();

        long durationMs = (System.nanoTime() - begin) / 1_000_000L;
        publisher.publish(EventStream.READY, JobEventRecord.of(JobEventType.SCHEDULER_SHUTDOWN, managerId)
                .put("total_workers", toStop.size())
                .put("running_workers", running)
                .put("chains_disconnected", chains)
                .put("workers", details)
                .put("shutdown_duration_ms", durationMs)
                .put("uptime_ms", Duration.between(startedAt, Instant.now()).toMillis())
                .toMap());
        log.info("Event scheduler stopped: managerId={}, workersStopped={}, running={}, chainsDisconnected={}, durationMs={}",
                managerId, toStop.size(), running, chains, durationMs);
    }

    private void awaitWorker(EventWorker worker, Duration timeout) {
        try {
            if (!worker.awaitTermination(timeout)) {
                log.warn("Worker did not finish within grace period: jobId={}, graceMs={}",
                        worker.job().jobId(), timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public SchedulerStats getStats() {
        int total;
        int running = 0;
        workersLock.readLock().lock();
        try {
            total = workers.size();
            for (EventWorker worker : workers.values()) {
                if (worker.isRunning()) {
                    running++;
                }
            }
        } finally {
            workersLock.readLock().unlock();
        }
        return new SchedulerStats(managerId, total, running, maxWorkers, chainClients.size(), chainClients.chainIds(),
                blockHeights.isCacheAvailable(), publisher.isAvailable());
    }

    /**
     * @throws SchedulerException with reason JOB_NOT_FOUND if the job is not scheduled
     */
    public JobWorkerStats getJobWorkerStats(long jobId) {
        EventWorker worker;
        workersLock.readLock().lock();
        try {
            worker = workers.get(jobId);
        } finally {
            workersLock.readLock().unlock();
        }
        if (worker == null) {
            throw SchedulerException.notFound(jobId);
        }
        return worker.stats();
    }

    public int workerCount() {
        workersLock.readLock().lock();
        try {
            return workers.size();
        } finally {
            workersLock.readLock().unlock();
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public String getManagerId() {
        return managerId;
    }
}
