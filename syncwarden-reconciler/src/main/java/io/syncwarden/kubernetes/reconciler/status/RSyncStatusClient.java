/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClientException;

import io.syncwarden.kubernetes.api.v1beta1.ErrorSummary;
import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.api.v1beta1.RSyncCondition;
import io.syncwarden.kubernetes.api.v1beta1.RSyncRenderingStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.declared.Documents;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Writes the stage statuses and the {@code Syncing} condition of the RSync served by this reconciler.</p>
 *
 * <p>Every write re-reads the live object and is skipped when nothing but timestamps would change. When the API
 * server rejects a write because the object is too large, the error list is truncated to
 * {@code errors / denominator} entries and the write retried with the denominator doubled.</p>
 *
 * <p>Failures are thrown as {@link ReconcilerException} carrying a {@link ErrorKind#STATUS_UPDATE} or
 * {@link ErrorKind#API_SERVER} error.</p>
 */
public class RSyncStatusClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RSyncStatusClient.class);

    static final String COMPONENT_SOURCE = "source";
    static final String COMPONENT_RENDERING = "rendering";
    static final String COMPONENT_SYNC = "sync";

    static final String REASON_SOURCE = "Source";
    static final String REASON_RENDERING = "Rendering";
    static final String REASON_SYNC = "Sync";
    static final String MESSAGE_SYNCING = "Syncing";
    static final String MESSAGE_SYNC_COMPLETED = "Sync Completed";

    @VisibleForTesting
    static final int MAX_DENOMINATOR = 1 << 20;

    private final RSyncStore store;
    private final ReconcilerMetrics metrics;
    private final String reconcilerName;

    public RSyncStatusClient(RSyncStore store, ReconcilerMetrics metrics, String reconcilerName) {
        this.store = Objects.requireNonNull(store);
        this.metrics = Objects.requireNonNull(metrics);
        this.reconcilerName = Objects.requireNonNull(reconcilerName);
    }

    /**
     * @return the status currently recorded on the live RSync
     * @throws ReconcilerException if the RSync cannot be read
     */
    public ReconcilerStatus readReconcilerStatus() {
        return ReconcilerStatus.fromRSync(getServed());
    }

    /**
     * Writes {@code status.source} and updates the {@code Syncing} condition.
     *
     * @param newStatus the source status
     */
    public void setSourceStatus(SourceStatus newStatus) {
        boolean written = update(COMPONENT_SOURCE, (status, denominator) -> {
            var source = new RSyncStageStatus();
            writeStage(source, newStatus.spec(), newStatus.commit(), newStatus.errors(), newStatus.lastUpdate(), denominator);
            status.setSource(source);
            ErrorSummary summary = SyncingConditions.summarizeErrorsForCommit(status, newStatus.commit());
            SyncingConditions.setSyncing(status, newStatus.errors().isEmpty(), REASON_SOURCE, REASON_SOURCE, newStatus.commit(), summary,
                    newStatus.lastUpdate());
        });
        if (written) {
            recordErrors(COMPONENT_SOURCE, newStatus.errors());
        }
    }

    /**
     * Writes {@code status.rendering} and updates the {@code Syncing} condition, unless the new status is
     * equivalent to the old one.
     *
     * @param oldStatus the rendering status last written, if any
     * @param newStatus the rendering status
     */
    public void setRenderingStatus(@Nullable RenderingStatus oldStatus, RenderingStatus newStatus) {
        if (oldStatus != null && oldStatus.isEquivalentTo(newStatus)) {
            return;
        }
        boolean written = update(COMPONENT_RENDERING, (status, denominator) -> {
            var rendering = new RSyncRenderingStatus();
            writeStage(rendering, newStatus.spec(), newStatus.commit(), newStatus.errors(), newStatus.lastUpdate(), denominator);
            rendering.setMessage(newStatus.message());
            status.setRendering(rendering);
            ErrorSummary summary = SyncingConditions.summarizeErrorsForCommit(status, newStatus.commit());
            SyncingConditions.setSyncing(status, newStatus.errors().isEmpty(), REASON_RENDERING, newStatus.message(), newStatus.commit(), summary,
                    newStatus.lastUpdate());
        });
        if (written) {
            recordErrors(COMPONENT_RENDERING, newStatus.errors());
        }
    }

    /**
     * Writes {@code status.sync}. The {@code Syncing} condition is only updated once the source and rendering
     * stages report the same commit; a finished sync without errors also records {@code status.lastSyncedCommit}.
     *
     * @param newStatus the sync status
     */
    public void setSyncStatus(SyncStatus newStatus) {
        boolean written = update(COMPONENT_SYNC, (status, denominator) -> {
            var sync = new RSyncStageStatus();
            writeStage(sync, newStatus.spec(), newStatus.commit(), newStatus.errors(), newStatus.lastUpdate(), denominator);
            status.setSync(sync);
            if (!commitsAgree(status, newStatus.commit())) {
                return;
            }
            ErrorSummary summary = SyncingConditions.summarizeErrorsForCommit(status, newStatus.commit());
            if (newStatus.syncing()) {
                SyncingConditions.setSyncing(status, true, REASON_SYNC, MESSAGE_SYNCING, newStatus.commit(), summary, newStatus.lastUpdate());
            }
            else {
                if (SyncingConditions.totalCount(summary) == 0) {
                    status.setLastSyncedCommit(newStatus.commit());
                }
                SyncingConditions.setSyncing(status, false, REASON_SYNC, MESSAGE_SYNC_COMPLETED, newStatus.commit(), summary, newStatus.lastUpdate());
            }
        });
        if (written) {
            recordErrors(COMPONENT_SYNC, newStatus.errors());
        }
        if (!newStatus.syncing()) {
            metrics.recordLastSync(ReconcilerMetrics.statusTag(newStatus.errors()), newStatus.lastUpdate());
        }
    }

    /**
     * Records on the RSync whether its source holds configuration that needs rendering.
     *
     * @param requiresRendering true if it does
     */
    public void setRequiresRendering(boolean requiresRendering) {
        try {
            store.annotate(Annotations.REQUIRES_RENDERING_ANNOTATION_KEY, String.valueOf(requiresRendering));
        }
        catch (KubernetesClientException e) {
            throw new ReconcilerException(ReconcilerError.of(ErrorKind.API_SERVER,
                    "failed to set the " + Annotations.REQUIRES_RENDERING_ANNOTATION_KEY + " annotation: " + e.getMessage(), e));
        }
    }

    private static boolean commitsAgree(RSyncStatus status, String commit) {
        RSyncStageStatus source = status.getSource();
        RSyncRenderingStatus rendering = status.getRendering();
        return source != null && commit.equals(source.getCommit())
                && (rendering == null || commit.equals(rendering.getCommit()));
    }

    private static void writeStage(RSyncStageStatus stage,
                                   @Nullable SourceSpec spec,
                                   String commit,
                                   List<ReconcilerError> errors,
                                   Instant lastUpdate,
                                   int denominator) {
        if (spec != null) {
            spec.writeTo(stage);
        }
        stage.setCommit(commit);
        StatusErrors.Truncated truncated = StatusErrors.truncate(errors, denominator);
        stage.setErrors(truncated.errors().isEmpty() ? null : truncated.errors());
        stage.setErrorSummary(truncated.summary());
        stage.setLastUpdate(lastUpdate);
    }

    private void recordErrors(String component, List<ReconcilerError> errors) {
        metrics.recordReconcilerErrors(component, errors);
        metrics.recordPipelineErrors(component, errors.size());
    }

    private RSync getServed() {
        try {
            return store.get().orElseThrow(() -> new ReconcilerException(ReconcilerError.of(ErrorKind.API_SERVER, "the RSync served by "
                    + reconcilerName + " does not exist")));
        }
        catch (KubernetesClientException e) {
            throw new ReconcilerException(ReconcilerError.of(ErrorKind.API_SERVER, "failed to get the RSync: " + e.getMessage(), e));
        }
    }

    /**
     * Applies {@code mutator} to a copy of the live status and writes it.
     *
     * @return false if the write was skipped because nothing but timestamps would change
     */
    private boolean update(String component, BiConsumer<RSyncStatus, Integer> mutator) {
        for (int denominator = StatusErrors.DEFAULT_DENOMINATOR;; denominator *= 2) {
            RSync rsync = getServed();
            RSyncStatus current = rsync.getStatus() == null ? new RSyncStatus() : rsync.getStatus();
            RSyncStatus updated = copy(current);
            mutator.accept(updated, denominator);
            updated.setReconciler(reconcilerName);
            if (rsync.getMetadata() != null) {
                updated.setObservedGeneration(rsync.getMetadata().getGeneration());
            }
            if (stageInitialised(current, component) && withoutTimestamps(current).equals(withoutTimestamps(updated))) {
                LOGGER.atDebug()
                        .setMessage("Skipping {} status update for {}: unchanged")
                        .addArgument(component)
                        .addArgument(() -> ResourcesUtil.describe(rsync))
                        .log();
                return false;
            }
            rsync.setStatus(updated);
            try {
                store.updateStatus(rsync);
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Updated {} status of {} (denominator {})", component, ResourcesUtil.describe(rsync), denominator);
                }
                return true;
            }
            catch (KubernetesClientException e) {
                if (ResourcesUtil.isRequestTooLarge(e) && denominator < MAX_DENOMINATOR) {
                    LOGGER.warn("The {} status of {} is too large, retrying with {} of the errors", component, ResourcesUtil.describe(rsync),
                            "1/" + denominator * 2);
                    continue;
                }
                throw new ReconcilerException(ReconcilerError.of(ErrorKind.STATUS_UPDATE,
                        "failed to update the " + component + " status: " + e.getMessage(), e));
            }
        }
    }

    private static boolean stageInitialised(RSyncStatus status, String component) {
        RSyncStageStatus stage = switch (component) {
            case COMPONENT_SOURCE -> status.getSource();
            case COMPONENT_RENDERING -> status.getRendering();
            default -> status.getSync();
        };
        return stage != null && stage.getLastUpdate() != null;
    }

    static RSyncStatus copy(RSyncStatus status) {
        return Documents.serialization().convertValue(status, RSyncStatus.class);
    }

    static RSyncStatus withoutTimestamps(RSyncStatus status) {
        RSyncStatus copy = copy(status);
        for (RSyncStageStatus stage : new RSyncStageStatus[]{ copy.getSource(), copy.getRendering(), copy.getSync() }) {
            if (stage != null) {
                stage.setLastUpdate(null);
            }
        }
        if (copy.getConditions() != null) {
            for (RSyncCondition condition : copy.getConditions()) {
                condition.setLastUpdateTime(null);
                condition.setLastTransitionTime(null);
            }
        }
        return copy;
    }
}
