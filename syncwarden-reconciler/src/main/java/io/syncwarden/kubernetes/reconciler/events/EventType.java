/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

/**
 * The kinds of event a {@link Publisher} emits.
 */
public enum EventType {
    /** Resets the cache and syncs from scratch. */
    SYNC_WITH_REIMPORT,
    /** Syncs from the cache, reading the source first if the cache is empty. */
    SYNC,
    /** Republishes the sync status with the remediator's errors. */
    STATUS_UPDATE,
    /** Syncs from the cache if the namespace controller asked for it. */
    NAMESPACE_RESYNC,
    /** Syncs from the cache if a conflict, a failed run or a stale watch needs it. */
    RETRY_SYNC
}
