/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.status.ReconcilerStatus;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>State carried from one run to the next: the status last written and the {@link ReconcilerCache}.</p>
 *
 * <p>The run lock is held for the whole of a run, so runs never overlap. The status lock is held around each
 * compare-and-write of the status, by the run and by the periodic sync status updater alike, and around every
 * reset of the cache, so a status write never sees a half reset cache.</p>
 */
public class ReconcilerState {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconcilerState.class);

    private final ReentrantLock runLock = new ReentrantLock();
    private final ReentrantLock statusLock = new ReentrantLock();
    private final ReconcilerCache cache = new ReconcilerCache();
    private @Nullable ReconcilerStatus status;
    private @Nullable SourceState lastApplied;

    public ReconcilerCache cache() {
        return cache;
    }

    /**
     * @return the status last written, or null before the first run has read it from the cluster
     */
    public @Nullable ReconcilerStatus status() {
        return status;
    }

    void status(ReconcilerStatus status) {
        this.status = status;
    }

    /**
     * @return the source of the last fully successful run, or null if there has been none
     */
    public @Nullable SourceState lastApplied() {
        return lastApplied;
    }

    public <T> T withRunLock(Supplier<T> run) {
        runLock.lock();
        try {
            return run.get();
        }
        finally {
            runLock.unlock();
        }
    }

    public <T> T withStatusLock(Supplier<T> action) {
        statusLock.lock();
        try {
            return action.get();
        }
        finally {
            statusLock.unlock();
        }
    }

    public void withStatusLock(Runnable action) {
        statusLock.lock();
        try {
            action.run();
        }
        finally {
            statusLock.unlock();
        }
    }

    /**
     * Marks the run failed, so the next retry runs every step again.
     *
     * @param errors the errors of the failed run
     */
    public void invalidate(List<ReconcilerError> errors) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Invalidating the cache after {} errors: {}", errors.size(), ReconcilerError.summarize(errors));
        }
        cache.needToRetry(true);
    }

    /**
     * Records a fully successful run. Only called once every step, including the final status write, succeeded.
     */
    public void checkpoint() {
        withStatusLock(() -> {
            lastApplied = cache.source();
            cache.needToRetry(false);
        });
    }

    public void resetCache() {
        withStatusLock(cache::reset);
    }

    /**
     * Resets the cache for a new source.
     *
     * @param source the new source, or null if it could not be read cleanly
     */
    public void resetCache(@Nullable SourceState source) {
        withStatusLock(() -> {
            cache.reset();
            cache.source(source);
        });
    }

    public void resetPartialCache() {
        withStatusLock(cache::resetPartial);
    }

    @VisibleForTesting
    boolean hasStatusLockWaiters() {
        return statusLock.hasQueuedThreads();
    }

    public boolean needToRetry() {
        return cache.needToRetry();
    }
}
