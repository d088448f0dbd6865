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
 * Status of the rendering stage, which turns dry configuration (Kustomize, Helm) into plain manifests.
 *
 * @param spec the source configuration, null if unknown
 * @param commit the commit rendered
 * @param message the outcome, one of the {@code RENDERING_*} messages
 * @param errors rendering errors
 * @param lastUpdate when this status was computed
 * @param requiresRendering whether the source holds dry configuration; kept in memory only
 */
public record RenderingStatus(@Nullable SourceSpec spec,
                              String commit,
                              String message,
                              List<ReconcilerError> errors,
                              Instant lastUpdate,
                              boolean requiresRendering) {

    public static final String RENDERING_IN_PROGRESS = "Rendering is still in progress";
    public static final String RENDERING_SUCCEEDED = "Rendering succeeded";
    public static final String RENDERING_FAILED = "Rendering failed";
    public static final String RENDERING_SKIPPED = "Rendering skipped";
    public static final String RENDERING_REQUIRED = "Rendering required but is currently disabled";
    public static final String RENDERING_NOT_REQUIRED = "Rendering not required but is currently enabled";

    public RenderingStatus {
        Objects.requireNonNull(commit);
        Objects.requireNonNull(message);
        errors = List.copyOf(errors);
        Objects.requireNonNull(lastUpdate);
    }

    /**
     * @param other another status, may be null
     * @return true if both statuses would be written identically, ignoring {@link #lastUpdate()} and
     *         {@link #requiresRendering()}, which is not written to the status
     */
    public boolean isEquivalentTo(@Nullable RenderingStatus other) {
        return other != null
                && commit.equals(other.commit)
                && message.equals(other.message)
                && StatusErrors.sameErrors(errors, other.errors)
                && Objects.equals(spec, other.spec);
    }
}
