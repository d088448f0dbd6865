/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Status of applying the parsed objects and remediating drift on them.
 *
 * @param spec the source configuration, null if unknown
 * @param syncing true while the apply is still running
 * @param commit the commit being applied
 * @param errors apply, remediator, conflict and fight errors
 * @param lastUpdate when this status was computed
 */
public record SyncStatus(@Nullable SourceSpec spec, boolean syncing, String commit, List<ReconcilerError> errors, Instant lastUpdate) {

    public SyncStatus {
        Objects.requireNonNull(commit);
        errors = List.copyOf(errors);
        Objects.requireNonNull(lastUpdate);
    }

    /**
     * @param other another status, may be null
     * @return true if both statuses would be written identically, ignoring {@link #lastUpdate()}
     */
    public boolean isEquivalentTo(@Nullable SyncStatus other) {
        return other != null
                && syncing == other.syncing
                && commit.equals(other.commit)
                && StatusErrors.sameErrors(errors, other.errors)
                && Objects.equals(spec, other.spec);
    }
}
