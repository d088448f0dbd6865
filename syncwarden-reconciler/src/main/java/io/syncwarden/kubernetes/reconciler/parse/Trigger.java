/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

/**
 * Why a run was started. The labels appear in logs and metric tags and must not change.
 */
public enum Trigger {
    /** Scheduled re-apply, even without a new commit. */
    RESYNC("resync"),
    /** Poll for a new commit; a no-op when the source has not changed. */
    REIMPORT("reimport"),
    /** Retry after a failed run. */
    RETRY("retry"),
    /** Another manager wrote to an object this pipeline declares. */
    MANAGEMENT_CONFLICT("managementConflict"),
    /** The remediator needs its watches refreshed. */
    WATCH_UPDATE("watchUpdate"),
    /** Namespace labels changed, so namespace selectors may select differently. */
    NAMESPACE_EVENT("namespaceEvent");

    private final String label;

    Trigger(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
