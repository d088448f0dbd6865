/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.kubernetes.reconciler.events.Event;
import io.syncwarden.kubernetes.reconciler.events.EventResult;
import io.syncwarden.kubernetes.reconciler.events.Subscriber;
import io.syncwarden.kubernetes.reconciler.namespace.NamespaceControllerState;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Turns events into runs:</p>
 * <ul>
 *     <li>{@code SYNC_WITH_REIMPORT} resets the cache and syncs from scratch,</li>
 *     <li>{@code SYNC} syncs from the cache, reading the source if the cache is empty,</li>
 *     <li>{@code STATUS_UPDATE} refreshes the sync status with the remediator's errors, without a run,</li>
 *     <li>{@code NAMESPACE_RESYNC} syncs if the namespace controller asked for it,</li>
 *     <li>{@code RETRY_SYNC} syncs if there is a management conflict, a failed run or a stale watch.</li>
 * </ul>
 */
public class EventHandler implements Subscriber {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventHandler.class);

    private final SyncPipeline pipeline;
    private final ReconcilerState state;
    private final @Nullable NamespaceControllerState namespaceState;
    private final RunFunction runFunction;

    public EventHandler(SyncPipeline pipeline, ReconcilerState state, @Nullable NamespaceControllerState namespaceState, RunFunction runFunction) {
        this.pipeline = Objects.requireNonNull(pipeline);
        this.state = Objects.requireNonNull(state);
        this.namespaceState = namespaceState;
        this.runFunction = Objects.requireNonNull(runFunction);
    }

    @Override
    public EventResult handle(Event event) {
        return switch (event.type()) {
            case SYNC_WITH_REIMPORT -> {
                state.resetPartialCache();
                yield run(Trigger.RESYNC, false);
            }
            case SYNC -> run(Trigger.REIMPORT, false);
            case STATUS_UPDATE -> {
                refreshSyncStatus();
                yield EventResult.NONE;
            }
            case NAMESPACE_RESYNC -> {
                if (namespaceState != null && namespaceState.scheduleSync()) {
                    state.resetPartialCache();
                    yield run(Trigger.NAMESPACE_EVENT, false);
                }
                yield EventResult.NONE;
            }
            case RETRY_SYNC -> retry();
        };
    }

    private EventResult retry() {
        Trigger trigger;
        if (!pipeline.remediator().managementConflicts().isEmpty()) {
            // the conflicting objects need revalidating, so the parse is repeated
            state.resetPartialCache();
            trigger = Trigger.MANAGEMENT_CONFLICT;
        }
        else if (state.needToRetry()) {
            trigger = Trigger.RETRY;
        }
        else if (pipeline.remediator().needsWatchUpdate()) {
            trigger = Trigger.WATCH_UPDATE;
        }
        else {
            return EventResult.NONE;
        }
        return run(trigger, true);
    }

    private EventResult run(Trigger trigger, boolean triggerRetryBackoff) {
        RunResult result = runFunction.run(pipeline, trigger, state);
        if (!result.errors().isEmpty() && LOGGER.isInfoEnabled()) {
            LOGGER.info("{} run of {} failed: {}", trigger, pipeline.options().managerName(), ReconcilerError.summarize(result.errors()));
        }
        if (result.success() || result.sourceChanged()) {
            return new EventResult(true, true, false);
        }
        return new EventResult(true, false, triggerRetryBackoff);
    }

    private void refreshSyncStatus() {
        // nothing to report until the remediator watches something
        if (!pipeline.remediator().remediating()) {
            return;
        }
        LOGGER.debug("Updating sync status (periodic while not syncing)");
        try {
            pipeline.refreshSyncStatus(state);
        }
        catch (ReconcilerException e) {
            LOGGER.warn("Failed to update the sync status: {}", e.getMessage());
        }
    }
}
