package com.eventradar.config;

import com.eventradar.scheduler.config.SchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: one coordinator thread that keeps the scheduler alive, and one thread per event worker.
 */
@Configuration
public class AsyncConfig {

    public static final String SCHEDULER_COORDINATOR_EXECUTOR = "scheduler-coordinator-executor";
    public static final String EVENT_WORKER_EXECUTOR = "event-worker-executor";

    /** Threads above max-workers absorb workers still finishing their last tick after unschedule. */
    static final int WORKER_POOL_HEADROOM = 16;

    /** Single thread running the manager's blocking start loop. */
    @Bean(name = SCHEDULER_COORDINATOR_EXECUTOR)
    public ThreadPoolTaskExecutor schedulerCoordinatorExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("scheduler-coord-");
        e.initialize();
        return e;
    }

    /** Direct hand-off: each worker gets its own thread, idle threads are reclaimed. */
    @Bean(name = EVENT_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor eventWorkerExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(0);
        e.setMaxPoolSize(properties.getMaxWorkers() + WORKER_POOL_HEADROOM);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setThreadNamePrefix("event-worker-");
        e.initialize();
        return e;
    }
}
