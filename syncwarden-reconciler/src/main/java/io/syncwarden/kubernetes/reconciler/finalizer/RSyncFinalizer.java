/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.finalizer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClientException;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.parse.Applier;
import io.syncwarden.kubernetes.reconciler.status.RSyncStore;

/**
 * <p>Deletes the objects an RSync manages before the RSync itself goes.</p>
 *
 * <p>The order is fixed: the control loop and the remediator are stopped first, then the continue gate is
 * awaited, which completes once both have drained, and only then are the managed objects deleted. Deleting
 * earlier would race with an apply or a drift correction recreating them.</p>
 */
public class RSyncFinalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RSyncFinalizer.class);

    public static final String FINALIZER = "syncwarden.io/reconciler";

    private final RSyncStore store;
    private final Applier applier;
    private final Runnable stopControllers;
    private final CompletableFuture<Void> continueGate;

    /**
     * @param store the store of the served RSync
     * @param applier the applier holding the inventory of managed objects
     * @param stopControllers stops the control loop and the remediator, returning without waiting for them
     * @param continueGate completes once the control loop and the remediator have exited
     */
    public RSyncFinalizer(RSyncStore store, Applier applier, Runnable stopControllers, CompletableFuture<Void> continueGate) {
        this.store = Objects.requireNonNull(store);
        this.applier = Objects.requireNonNull(applier);
        this.stopControllers = Objects.requireNonNull(stopControllers);
        this.continueGate = Objects.requireNonNull(continueGate);
    }

    /**
     * Stops the controllers, deletes the managed objects and, if that succeeded, removes the finalizer.
     *
     * @param rsync the RSync being deleted
     * @return the errors met, empty once the finalizer has been removed
     */
    public List<ReconcilerError> runFinalizer(RSync rsync) {
        String id = ResourcesUtil.describe(rsync);
        LOGGER.info("Finalizing {}: stopping the control loop and the remediator", id);
        stopControllers.run();
        try {
            continueGate.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of(ReconcilerError.of(ErrorKind.INTERNAL, "interrupted waiting for the controllers to stop", e));
        }
        catch (ExecutionException e) {
            LOGGER.warn("Controllers of {} exited with an error, deleting managed objects anyway", id, e.getCause());
        }

        LOGGER.info("Finalizing {}: deleting managed objects", id);
        List<ReconcilerError> errors = applier.destroy();
        if (!errors.isEmpty()) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn("Failed to delete {} managed objects of {}: {}", errors.size(), id, ReconcilerError.summarize(errors));
            }
            return errors;
        }
        try {
            store.removeFinalizer(FINALIZER);
        }
        catch (KubernetesClientException e) {
            return List.of(ReconcilerError.forObject(ErrorKind.API_SERVER, rsync, e));
        }
        LOGGER.info("Finalized {}", id);
        return List.of();
    }
}
