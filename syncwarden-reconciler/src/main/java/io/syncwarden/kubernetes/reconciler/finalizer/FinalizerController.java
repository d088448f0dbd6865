/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.finalizer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClientException;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.backoff.BackoffStrategy;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.status.RSyncStore;
import io.syncwarden.tag.RunsOnThread;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Watches the served RSync and keeps the {@value RSyncFinalizer#FINALIZER} finalizer on it only while it asks
 * for foreground deletion, through the {@value Annotations#DELETION_PROPAGATION_POLICY_ANNOTATION_KEY}
 * annotation.</p>
 *
 * <p>Once the RSync is being deleted and still carries the finalizer, the {@link RSyncFinalizer} runs on a
 * dedicated thread, so the watch is never blocked. Failed attempts are retried with a backoff until they
 * succeed.</p>
 */
public class FinalizerController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FinalizerController.class);
    static final String THREAD_NAME = "syncwarden-finalizer";

    private final RSyncStore store;
    private final RSyncFinalizer finalizer;
    private final BackoffStrategy backoff;
    private final AtomicBoolean finalizing = new AtomicBoolean(false);
    private final CompletableFuture<Void> finalized = new CompletableFuture<>();
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, THREAD_NAME);
        thread.setDaemon(true);
        return thread;
    });
    private @Nullable AutoCloseable watch;

    public FinalizerController(RSyncStore store, RSyncFinalizer finalizer, BackoffStrategy backoff) {
        this.store = Objects.requireNonNull(store);
        this.finalizer = Objects.requireNonNull(finalizer);
        this.backoff = Objects.requireNonNull(backoff);
    }

    public synchronized void start() {
        if (watch == null) {
            watch = store.watch(this::onChange);
        }
    }

    @VisibleForTesting
    void onChange(RSync rsync) {
        if (rsync.getMetadata().getDeletionTimestamp() == null) {
            try {
                if (wantsForegroundDeletion(rsync)) {
                    store.addFinalizer(RSyncFinalizer.FINALIZER);
                }
                else {
                    store.removeFinalizer(RSyncFinalizer.FINALIZER);
                }
            }
            catch (KubernetesClientException e) {
                LOGGER.warn("Failed to update the finalizer of {}: {}", ResourcesUtil.describe(rsync), e.getMessage());
            }
        }
        else if (rsync.getFinalizers().contains(RSyncFinalizer.FINALIZER) && finalizing.compareAndSet(false, true)) {
            executor.execute(() -> attempt(rsync, 0));
        }
    }

    static boolean wantsForegroundDeletion(RSync rsync) {
        return Annotations.readAnnotation(rsync, Annotations.DELETION_PROPAGATION_POLICY_ANNOTATION_KEY)
                .filter(Annotations.DELETION_PROPAGATION_FOREGROUND::equals)
                .isPresent();
    }

    @RunsOnThread(THREAD_NAME)
    private void attempt(RSync rsync, int failures) {
        List<ReconcilerError> errors = finalizer.runFinalizer(rsync);
        if (errors.isEmpty()) {
            finalized.complete(null);
            return;
        }
        Duration delay = backoff.getDelay(Math.min(failures, backoff.stepLimit()) + 1);
        LOGGER.info("Retrying the finalizer of {} in {}", ResourcesUtil.describe(rsync), delay);
        executor.schedule(() -> attempt(rsync, failures + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return a future completing once the managed objects are deleted and the finalizer removed
     */
    public CompletableFuture<Void> finalized() {
        return finalized;
    }

    public boolean isFinalizing() {
        return finalizing.get();
    }

    @Override
    public synchronized void close() {
        if (watch != null) {
            try {
                watch.close();
            }
            catch (Exception e) {
                LOGGER.warn("Failed to stop watching the served RSync", e);
            }
            watch = null;
        }
        executor.shutdownNow();
    }
}
