/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.api.v1beta1.RSyncCondition;
import io.syncwarden.kubernetes.api.v1beta1.RSyncRenderingStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.pubsub.MessageStatus;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessage;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>In-memory copy of what this reconciler last wrote to its RSync status.</p>
 *
 * <p>The three stages are written independently but must never regress relative to one another: rendering depends
 * on nothing, source depends on rendering, sync depends on rendering and source. A stage whose timestamp is older
 * than one of its dependencies is stale and is rewritten even when its value has not changed. Otherwise a write is
 * only needed when the value differs, ignoring timestamps.</p>
 *
 * <p>Not thread safe. Callers hold the status lock of the owning {@code ReconcilerState}.</p>
 */
public class ReconcilerStatus {

    public static final String SYNCING_CONDITION_TYPE = "Syncing";

    private @Nullable SourceStatus sourceStatus;
    private @Nullable RenderingStatus renderingStatus;
    private @Nullable SyncStatus syncStatus;
    private Instant syncingConditionLastUpdate = Instant.EPOCH;
    private final Map<MessageStatus, StatusMessage> lastPublishedMessages = new EnumMap<>(MessageStatus.class);

    public ReconcilerStatus() {
    }

    /**
     * Primes a status from the live RSync, so the first run after a restart does not rewrite unchanged stages.
     * Stage timestamps missing from the live object are read as {@link Instant#EPOCH}, which marks them
     * uninitialised.
     *
     * @param rsync the live object
     * @return the status
     */
    public static ReconcilerStatus fromRSync(RSync rsync) {
        var status = new ReconcilerStatus();
        RSyncStatus live = rsync.getStatus();
        if (live == null) {
            return status;
        }
        boolean syncing = false;
        for (RSyncCondition condition : Optional.ofNullable(live.getConditions()).orElse(List.of())) {
            if (SYNCING_CONDITION_TYPE.equals(condition.getType())) {
                syncing = "True".equals(condition.getStatus());
                status.syncingConditionLastUpdate = orEpoch(condition.getLastUpdateTime());
                break;
            }
        }
        RSyncStageStatus source = live.getSource();
        if (source != null) {
            status.sourceStatus = new SourceStatus(SourceSpec.readFrom(source), nullToEmpty(source.getCommit()),
                    StatusErrors.fromRSyncErrors(source.getErrors()), orEpoch(source.getLastUpdate()));
        }
        RSyncRenderingStatus rendering = live.getRendering();
        if (rendering != null) {
            boolean requiresRendering = Annotations.readAnnotation(rsync, Annotations.REQUIRES_RENDERING_ANNOTATION_KEY)
                    .map(Boolean::parseBoolean)
                    .orElse(false);
            status.renderingStatus = new RenderingStatus(SourceSpec.readFrom(rendering), nullToEmpty(rendering.getCommit()),
                    nullToEmpty(rendering.getMessage()), StatusErrors.fromRSyncErrors(rendering.getErrors()), orEpoch(rendering.getLastUpdate()),
                    requiresRendering);
        }
        RSyncStageStatus sync = live.getSync();
        if (sync != null) {
            status.syncStatus = new SyncStatus(SourceSpec.readFrom(sync), syncing, nullToEmpty(sync.getCommit()),
                    StatusErrors.fromRSyncErrors(sync.getErrors()), orEpoch(sync.getLastUpdate()));
        }
        return status;
    }

    private static Instant orEpoch(@Nullable Instant instant) {
        return instant == null ? Instant.EPOCH : instant;
    }

    private static String nullToEmpty(@Nullable String s) {
        return s == null ? "" : s;
    }

    /**
     * @param newStatus the status about to be written
     * @return true if writing it would change the live object, or the cached source status is stale
     */
    public boolean needToSetSourceStatus(@Nullable SourceStatus newStatus) {
        if (sourceStatus == null) {
            return newStatus != null;
        }
        if (isUninitialised(sourceStatus.lastUpdate())) {
            return true;
        }
        if (renderingStatus != null && sourceStatus.lastUpdate().isBefore(renderingStatus.lastUpdate())) {
            return true;
        }
        return !sourceStatus.isEquivalentTo(newStatus);
    }

    /**
     * Rendering depends on no other stage, so only a value change needs a write.
     *
     * @param newStatus the status about to be written
     * @return true if writing it would change the live object
     */
    public boolean needToSetRenderingStatus(@Nullable RenderingStatus newStatus) {
        if (renderingStatus == null) {
            return newStatus != null;
        }
        return !renderingStatus.isEquivalentTo(newStatus);
    }

    /**
     * @param newStatus the status about to be written
     * @return true if writing it would change the live object, or the cached sync status is stale
     */
    public boolean needToSetSyncStatus(@Nullable SyncStatus newStatus) {
        if (syncStatus == null) {
            return newStatus != null;
        }
        if (isUninitialised(syncStatus.lastUpdate())) {
            return true;
        }
        if (renderingStatus != null && syncStatus.lastUpdate().isBefore(renderingStatus.lastUpdate())) {
            return true;
        }
        if (sourceStatus != null && syncStatus.lastUpdate().isBefore(sourceStatus.lastUpdate())) {
            return true;
        }
        return !syncStatus.isEquivalentTo(newStatus);
    }

    /**
     * @param stage the stage
     * @return where the cached status of that stage stands
     */
    public StageState stateOf(ErrorKind.Stage stage) {
        return switch (stage) {
            case RENDERING -> stateOf(renderingStatus == null ? null : renderingStatus.lastUpdate());
            case SOURCE -> stateOf(sourceStatus == null ? null : sourceStatus.lastUpdate(),
                    renderingStatus == null ? null : renderingStatus.lastUpdate());
            case SYNC -> stateOf(syncStatus == null ? null : syncStatus.lastUpdate(),
                    renderingStatus == null ? null : renderingStatus.lastUpdate(),
                    sourceStatus == null ? null : sourceStatus.lastUpdate());
        };
    }

    private static StageState stateOf(@Nullable Instant lastUpdate, @Nullable Instant... dependencies) {
        if (lastUpdate == null) {
            return StageState.ABSENT;
        }
        if (isUninitialised(lastUpdate)) {
            return StageState.STALE;
        }
        for (Instant dependency : dependencies) {
            if (dependency != null && lastUpdate.isBefore(dependency)) {
                return StageState.STALE;
            }
        }
        return StageState.CURRENT;
    }

    private static boolean isUninitialised(Instant lastUpdate) {
        return Instant.EPOCH.equals(lastUpdate);
    }

    /**
     * Records a published message and forgets the message of the opposite outcome.
     *
     * @param message the message published
     */
    public void setPublishedMessage(StatusMessage message) {
        lastPublishedMessages.put(message.status(), message);
        lastPublishedMessages.remove(message.status().opposite());
    }

    /**
     * @param message a message about to be published
     * @return true if an identical message was the last one published for its outcome
     */
    public boolean hasPublishedMessage(StatusMessage message) {
        return message.equals(lastPublishedMessages.get(message.status()));
    }

    public Map<MessageStatus, StatusMessage> lastPublishedMessages() {
        return Map.copyOf(lastPublishedMessages);
    }

    public @Nullable SourceStatus sourceStatus() {
        return sourceStatus;
    }

    public void sourceStatus(SourceStatus sourceStatus) {
        this.sourceStatus = Objects.requireNonNull(sourceStatus);
        this.syncingConditionLastUpdate = sourceStatus.lastUpdate();
    }

    public @Nullable RenderingStatus renderingStatus() {
        return renderingStatus;
    }

    public void renderingStatus(RenderingStatus renderingStatus) {
        this.renderingStatus = Objects.requireNonNull(renderingStatus);
        this.syncingConditionLastUpdate = renderingStatus.lastUpdate();
    }

    public @Nullable SyncStatus syncStatus() {
        return syncStatus;
    }

    public void syncStatus(SyncStatus syncStatus) {
        this.syncStatus = Objects.requireNonNull(syncStatus);
        this.syncingConditionLastUpdate = syncStatus.lastUpdate();
    }

    public Instant syncingConditionLastUpdate() {
        return syncingConditionLastUpdate;
    }

    @Override
    public String toString() {
        return "ReconcilerStatus[source=" + sourceStatus + ", rendering=" + renderingStatus + ", sync=" + syncStatus + "]";
    }
}
