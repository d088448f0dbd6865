/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

/**
 * Where a cached stage status stands relative to the live RSync.
 */
public enum StageState {
    /** Nothing cached yet. */
    ABSENT,
    /** Cached, but uninitialised or older than a stage it depends on. The next write must go through. */
    STALE,
    /** Cached and at least as recent as every stage it depends on. */
    CURRENT
}
