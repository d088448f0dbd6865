/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.tag.RunsOnThread;

/**
 * Republishes the sync status, with {@code syncing=true}, every status update period while an apply runs, so the
 * RSync shows progress and the remediator's errors during a long apply. Each tick checks the stop flag before
 * writing; {@link #stop()} waits for an in-flight tick to finish.
 */
public class PeriodicSyncStatusUpdater implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeriodicSyncStatusUpdater.class);
    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final SyncPipeline pipeline;
    private final ReconcilerState state;
    private final Duration period;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "sync-status-updater");
        thread.setDaemon(true);
        return thread;
    });

    private PeriodicSyncStatusUpdater(SyncPipeline pipeline, ReconcilerState state, Duration period) {
        this.pipeline = Objects.requireNonNull(pipeline);
        this.state = Objects.requireNonNull(state);
        this.period = Objects.requireNonNull(period);
    }

    /**
     * @param pipeline the pipeline whose sync errors are published
     * @param state the reconciler state
     * @return a started updater
     */
    public static PeriodicSyncStatusUpdater start(SyncPipeline pipeline, ReconcilerState state) {
        var updater = new PeriodicSyncStatusUpdater(pipeline, state, pipeline.options().statusUpdatePeriod());
        long millis = updater.period.toMillis();
        updater.executor.scheduleWithFixedDelay(updater::tick, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.debug("Periodic sync status updates starting");
        return updater;
    }

    @RunsOnThread("sync-status-updater")
    void tick() {
        if (stopped.get()) {
            return;
        }
        LOGGER.debug("Updating sync status (periodic while syncing)");
        try {
            pipeline.setSyncStatus(state, true, pipeline.syncErrors());
        }
        catch (ReconcilerException e) {
            LOGGER.warn("Failed to update sync status: {}", e.getMessage());
        }
        catch (RuntimeException e) {
            LOGGER.error("Unexpected failure updating sync status", e);
        }
    }

    /**
     * Stops the updates and waits for an in-flight update to finish.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Periodic sync status update did not finish within {}s", STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        LOGGER.debug("Periodic sync status updates stopped");
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void close() {
        stop();
    }
}
