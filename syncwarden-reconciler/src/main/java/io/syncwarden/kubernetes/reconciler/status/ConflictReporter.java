/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClientException;

import io.syncwarden.kubernetes.api.v1beta1.RSyncError;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.api.v1beta1.RootSync;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.declared.ManagerName;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ManagementConflict;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;

/**
 * <p>Tells other pipelines about objects this pipeline is contesting with them.</p>
 *
 * <p>A RootSync adopts any object it declares, so two RootSyncs declaring the same object fight over it. To make
 * that visible, the conflict is prepended to the other RootSync's {@code status.sync.errors}. A RepoSync never adopts
 * an object another pipeline manages, so conflicts with RepoSyncs are only logged.</p>
 */
public class ConflictReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictReporter.class);

    private final RSyncStore store;
    private final ReconcilerMetrics metrics;
    private final Clock clock;
    private final Set<ManagementConflict> seen = new HashSet<>();

    public ConflictReporter(RSyncStore store, ReconcilerMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @param conflicts the conflicts currently reported by the remediator
     * @throws ReconcilerException if another RootSync's status cannot be updated
     */
    public synchronized void report(List<ManagementConflict> conflicts) {
        seen.retainAll(conflicts);
        if (conflicts.isEmpty()) {
            return;
        }
        Map<ManagerName, List<ManagementConflict>> byManager = new LinkedHashMap<>();
        for (ManagementConflict conflict : conflicts) {
            byManager.computeIfAbsent(conflict.currentManager(), m -> new ArrayList<>()).add(conflict);
            if (seen.add(conflict)) {
                metrics.recordResourceConflict(conflict.currentManager().isRootScoped());
            }
        }
        for (Map.Entry<ManagerName, List<ManagementConflict>> entry : byManager.entrySet()) {
            ManagerName manager = entry.getKey();
            if (manager.isRootScoped()) {
                LOGGER.info("Detected conflict with RootSync manager {}", manager.value());
                prependRootSyncErrors(manager.name(), entry.getValue());
            }
            else {
                LOGGER.info("Detected conflict with RepoSync manager {}", manager.value());
            }
        }
    }

    private void prependRootSyncErrors(String rootSyncName, List<ManagementConflict> conflicts) {
        for (int denominator = StatusErrors.DEFAULT_DENOMINATOR;; denominator *= 2) {
            Optional<RootSync> maybeRootSync;
            try {
                maybeRootSync = store.getRootSync(rootSyncName);
            }
            catch (KubernetesClientException e) {
                throw new ReconcilerException(ReconcilerError.of(ErrorKind.API_SERVER,
                        "failed to get RootSync " + rootSyncName + " to report conflicts: " + e.getMessage(), e));
            }
            if (maybeRootSync.isEmpty()) {
                LOGGER.warn("RootSync {} holding conflicting objects no longer exists", rootSyncName);
                return;
            }
            RootSync rootSync = maybeRootSync.get();
            RSyncStatus status = rootSync.getStatus() == null ? new RSyncStatus() : rootSync.getStatus();
            RSyncStageStatus sync = status.getSync() == null ? new RSyncStageStatus() : status.getSync();
            List<RSyncError> existing = sync.getErrors() == null ? List.of() : sync.getErrors();

            List<ReconcilerError> added = new ArrayList<>();
            for (ManagementConflict conflict : conflicts) {
                ReconcilerError error = conflict.invert().toError();
                String reverseMessage = conflict.toError().message();
                boolean alreadyReported = existing.stream()
                        .anyMatch(e -> error.message().equals(e.getErrorMessage()) || reverseMessage.equals(e.getErrorMessage()))
                        || added.contains(error);
                if (!alreadyReported) {
                    added.add(error);
                }
            }
            if (added.isEmpty()) {
                return;
            }
            List<ReconcilerError> all = new ArrayList<>(added);
            all.addAll(StatusErrors.fromRSyncErrors(existing));
            StatusErrors.Truncated truncated = StatusErrors.truncate(all, denominator);
            sync.setErrors(truncated.errors());
            sync.setErrorSummary(truncated.summary());
            sync.setLastUpdate(clock.instant());
            status.setSync(sync);
            rootSync.setStatus(status);
            try {
                store.updateRootSyncStatus(rootSync);
                return;
            }
            catch (KubernetesClientException e) {
                if (ResourcesUtil.isRequestTooLarge(e) && denominator < RSyncStatusClient.MAX_DENOMINATOR) {
                    LOGGER.warn("Status of RootSync {} is too large, retrying with 1/{} of the errors", rootSyncName, denominator * 2);
                    continue;
                }
                throw new ReconcilerException(ReconcilerError.of(ErrorKind.STATUS_UPDATE,
                        "failed to update RootSync " + rootSyncName + " to prepend conflicts: " + e.getMessage(), e));
            }
        }
    }
}
