/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.syncwarden.kubernetes.api.v1beta1.RSyncError;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.api.v1beta1.RootSync;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.declared.ManagerName;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ManagementConflict;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConflictReporterTest {

    private static final Clock TEST_CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));

    private static final ManagerName ME = ManagerName.root("mine");
    private static final ManagerName OTHER_ROOT = ManagerName.root("other");
    private static final ManagementConflict ROOT_CONFLICT = new ManagementConflict("ConfigMap ns/cm", OTHER_ROOT, ME);

    @Mock
    RSyncStore store;

    private SimpleMeterRegistry registry;
    private ConflictReporter reporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        reporter = new ConflictReporter(store, new ReconcilerMetrics(registry), TEST_CLOCK);
    }

    private static RootSync otherRootSync(RSyncError... existing) {
        var rootSync = new RootSync();
        rootSync.setMetadata(new ObjectMetaBuilder().withName("other").withNamespace("syncwarden-system").build());
        if (existing.length > 0) {
            var sync = new RSyncStageStatus();
            sync.setErrors(List.of(existing));
            var status = new RSyncStatus();
            status.setSync(sync);
            rootSync.setStatus(status);
        }
        return rootSync;
    }

    @Test
    void prependsConflictToOtherRootSync() {
        // Given
        var existing = new RSyncError();
        existing.setCode("2009");
        existing.setErrorMessage("older error");
        when(store.getRootSync("other")).thenReturn(Optional.of(otherRootSync(existing)));
        var captor = ArgumentCaptor.forClass(RootSync.class);

        // When
        reporter.report(List.of(ROOT_CONFLICT));

        // Then
        verify(store).updateRootSyncStatus(captor.capture());
        RSyncStageStatus sync = captor.getValue().getStatus().getSync();
        assertThat(sync.getErrors()).extracting(RSyncError::getErrorMessage).containsExactly(
                "detected a management conflict for ConfigMap ns/cm: declared by :root_other but currently managed by :root_mine",
                "older error");
        assertThat(sync.getErrors().get(0).getCode()).isEqualTo(ErrorKind.MANAGEMENT_CONFLICT.code());
        assertThat(sync.getLastUpdate()).isEqualTo(Instant.EPOCH);
        assertThat(registry.get("syncwarden_resource_conflicts").counter().count()).isEqualTo(1.0);
    }

    @Test
    void alreadyReportedConflictIsNotRepeated() {
        // Given
        when(store.getRootSync("other")).thenReturn(Optional.of(otherRootSync(
                StatusErrors.toRSyncError(ROOT_CONFLICT.toError()))));

        // When
        reporter.report(List.of(ROOT_CONFLICT));

        // Then
        verify(store, never()).updateRootSyncStatus(any());
    }

    @Test
    void conflictIsCountedOncePerOccurrence() {
        // Given
        when(store.getRootSync("other")).thenReturn(Optional.of(otherRootSync(
                StatusErrors.toRSyncError(ROOT_CONFLICT.invert().toError()))));

        // When
        reporter.report(List.of(ROOT_CONFLICT));
        reporter.report(List.of(ROOT_CONFLICT));
        reporter.report(List.of());
        reporter.report(List.of(ROOT_CONFLICT));

        // Then
        assertThat(registry.get("syncwarden_resource_conflicts").counter().count()).isEqualTo(2.0);
    }

    @Test
    void repoSyncConflictIsOnlyLogged() {
        // When
        reporter.report(List.of(new ManagementConflict("ConfigMap ns/cm", ManagerName.namespaced("ns", "repo"), ME)));

        // Then
        verifyNoInteractions(store);
        assertThat(registry.get("syncwarden_resource_conflicts").tag("manager_scope", "namespace").counter().count()).isEqualTo(1.0);
    }

    @Test
    void deletedRootSyncIsIgnored() {
        // Given
        when(store.getRootSync("other")).thenReturn(Optional.empty());

        // When
        reporter.report(List.of(ROOT_CONFLICT));

        // Then
        verify(store, never()).updateRootSyncStatus(any());
    }

    @Test
    void tooLargeStatusIsRetried() {
        // Given
        when(store.getRootSync("other")).thenAnswer(invocation -> Optional.of(otherRootSync()));
        doThrow(new KubernetesClientException("etcdserver: request is too large", 500, null))
                .doNothing()
                .when(store).updateRootSyncStatus(any());

        // When
        reporter.report(List.of(ROOT_CONFLICT));

        // Then
        verify(store, times(2)).updateRootSyncStatus(any());
    }

    @Test
    void updateFailureIsStatusUpdateError() {
        // Given
        when(store.getRootSync("other")).thenReturn(Optional.of(otherRootSync()));
        doThrow(new KubernetesClientException("forbidden", 403, null)).when(store).updateRootSyncStatus(any());

        // Then
        assertThatThrownBy(() -> reporter.report(List.of(ROOT_CONFLICT)))
                .isInstanceOfSatisfying(ReconcilerException.class, e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.STATUS_UPDATE));
    }
}
