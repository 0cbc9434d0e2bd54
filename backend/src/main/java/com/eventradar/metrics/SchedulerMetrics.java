package com.eventradar.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the event scheduler. Scraped through the Prometheus actuator endpoint.
 */
public class SchedulerMetrics {

    static final String PREFIX = "eventradar.scheduler.";

    private final MeterRegistry registry;
    private final Counter eventsDetected;
    private final Counter eventsProcessed;
    private final Counter eventsDuplicate;
    private final Counter jobsScheduled;
    private final Counter jobsFailed;
    private final Counter workerStarted;
    private final Counter workerStopped;
    private final Counter workerErrors;
    private final AtomicInteger jobsRunning = new AtomicInteger();
    private final AtomicInteger workersActive = new AtomicInteger();

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventsDetected = counter("events.detected", "Contract events matched by workers");
        this.eventsProcessed = counter("events.processed", "Detected events whose action was dispatched successfully");
        this.eventsDuplicate = counter("events.duplicate", "Detected events skipped as already processed");
        this.jobsScheduled = counter("jobs.scheduled", "Jobs accepted by ScheduleJob");
        this.jobsFailed = counter("jobs.failed", "Detected events whose action dispatch failed");
        this.workerStarted = counter("worker.started", "Worker loops started");
        this.workerStopped = counter("worker.stopped", "Workers transitioned to stopped");
        this.workerErrors = counter("worker.errors", "Failed worker poll ticks");
        Gauge.builder(PREFIX + "jobs.running", jobsRunning, AtomicInteger::doubleValue)
                .description("Jobs currently present in the worker registry")
                .register(registry);
        Gauge.builder(PREFIX + "workers.active", workersActive, AtomicInteger::doubleValue)
                .description("Worker loops currently polling")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(PREFIX + name).description(description).register(registry);
    }

    public void eventDetected() {
        eventsDetected.increment();
    }

    public void eventProcessed() {
        eventsProcessed.increment();
    }

    public void eventDuplicate() {
        eventsDuplicate.increment();
    }

    public void jobScheduled() {
        jobsScheduled.increment();
        jobsRunning.incrementAndGet();
    }

    public void jobsUnscheduled(int count) {
        if (count > 0) {
            jobsRunning.addAndGet(-count);
        }
    }

    public void jobFailed() {
        jobsFailed.increment();
    }

    public void workerStarted() {
        workerStarted.increment();
        workersActive.incrementAndGet();
    }

    /**
     * @param wasPolling whether the worker's loop had started; only those count toward the active gauge
     */
    public void workerStopped(boolean wasPolling) {
        workerStopped.increment();
        if (wasPolling) {
            workersActive.decrementAndGet();
        }
    }

    public void workerError() {
        workerErrors.increment();
    }

    public void actionExecution(boolean success) {
        Counter.builder(PREFIX + "action.executions")
                .description("Downstream action dispatches by outcome")
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void rpcRequest(String chainId, String method, boolean success) {
        Counter.builder(PREFIX + "rpc.requests")
                .description("JSON-RPC requests to chain nodes")
                .tag("chain_id", chainId)
                .tag("method", method)
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void chainConnection(String chainId, boolean success) {
        Counter.builder(PREFIX + "chain.connections")
                .description("Chain connection attempts at startup")
                .tag("chain_id", chainId)
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public int jobsRunning() {
        return jobsRunning.get();
    }

    public int workersActive() {
        return workersActive.get();
    }
}
