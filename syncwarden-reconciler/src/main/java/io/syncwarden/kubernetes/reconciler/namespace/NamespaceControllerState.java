/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.namespace;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared between the namespace controller, which records namespace label changes, and the control loop, which
 * polls {@link #scheduleSync()} on each namespace resync event.
 */
public class NamespaceControllerState {

    private final Map<String, Map<String, String>> labelsByNamespace = new HashMap<>();
    private boolean syncPending;

    /**
     * Records the labels of a namespace, asking for a sync if the namespace is new or its labels changed.
     *
     * @param namespace the namespace name
     * @param labels its current labels
     * @return true if a sync was asked for
     */
    public synchronized boolean observe(String namespace, Map<String, String> labels) {
        Map<String, String> previous = labelsByNamespace.put(namespace, Map.copyOf(labels));
        if (labels.equals(previous)) {
            return false;
        }
        syncPending = true;
        return true;
    }

    /**
     * Forgets a deleted namespace, asking for a sync if it was known.
     *
     * @param namespace the namespace name
     * @return true if a sync was asked for
     */
    public synchronized boolean forget(String namespace) {
        if (labelsByNamespace.remove(namespace) == null) {
            return false;
        }
        syncPending = true;
        return true;
    }

    /**
     * @return true if a sync was asked for since the last call; the request is cleared
     */
    public synchronized boolean scheduleSync() {
        boolean pending = syncPending;
        syncPending = false;
        return pending;
    }

    public synchronized boolean isSyncPending() {
        return syncPending;
    }
}
