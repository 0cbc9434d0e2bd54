package com.eventradar.config;

import com.eventradar.common.CancellationToken;
import com.eventradar.scheduler.EventSchedulerManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.Executor;

/**
 * Runs {@link EventSchedulerManager#start} on the coordinator thread once the context is up and cancels it on shutdown.
 */
@Slf4j
public class SchedulerLifecycle implements SmartLifecycle {

    private final EventSchedulerManager manager;
    private final Executor coordinatorExecutor;
    private volatile CancellationToken token;

    public SchedulerLifecycle(EventSchedulerManager manager, Executor coordinatorExecutor) {
        this.manager = manager;
        this.coordinatorExecutor = coordinatorExecutor;
    }

    @Override
    public void start() {
        if (token != null) {
            return;
        }
        CancellationToken runToken = CancellationToken.root();
        token = runToken;
        coordinatorExecutor.execute(() -> manager.start(runToken));
    }

    @Override
    public void stop() {
        CancellationToken runToken = token;
        if (runToken == null) {
            return;
        }
        log.info("Shutdown requested for event scheduler: managerId={}", manager.getManagerId());
        runToken.cancel();
        manager.stop();
        token = null;
    }

    @Override
    public boolean isRunning() {
        return token != null;
    }
}
