/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.util.Optional;
import java.util.function.Consumer;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.api.v1beta1.RootSync;

/**
 * Reads and writes RSync objects. Implementations throw
 * {@link io.fabric8.kubernetes.client.KubernetesClientException} when the API server rejects a call.
 */
public interface RSyncStore {

    /**
     * @return the RSync served by this reconciler, if it exists
     */
    Optional<RSync> get();

    /**
     * Replaces the status of the served RSync, using its resource version for optimistic locking.
     *
     * @param rsync the RSync with the desired status
     */
    void updateStatus(RSync rsync);

    /**
     * Sets an annotation on the served RSync, if it is not already set to that value.
     *
     * @param key the annotation key
     * @param value the annotation value
     */
    void annotate(String key, String value);

    /**
     * @param name a RootSync name
     * @return the RootSync, if it exists
     */
    Optional<RootSync> getRootSync(String name);

    /**
     * Replaces the status of another pipeline's RootSync.
     *
     * @param rootSync the RootSync with the desired status
     */
    void updateRootSyncStatus(RootSync rootSync);

    /**
     * Adds a finalizer to the served RSync, if it is not already present.
     *
     * @param finalizer the finalizer
     */
    void addFinalizer(String finalizer);

    /**
     * Removes a finalizer from the served RSync. Does nothing if the RSync or the finalizer is gone.
     *
     * @param finalizer the finalizer
     */
    void removeFinalizer(String finalizer);

    /**
     * Watches the served RSync.
     *
     * @param onChange called with the RSync each time it is added or updated
     * @return stops the watch when closed
     */
    AutoCloseable watch(Consumer<RSync> onChange);
}
