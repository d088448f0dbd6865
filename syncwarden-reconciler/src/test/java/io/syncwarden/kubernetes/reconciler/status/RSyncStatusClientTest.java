/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.api.v1beta1.RSyncCondition;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.api.v1beta1.RootSync;
import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RSyncStatusClientTest {

    private static final SourceSpec SPEC = new SourceSpec.Git("https://example.com/repo.git", "HEAD", "main", "config");
    private static final Instant T1 = Instant.parse("2026-01-01T00:00:01Z");
    private static final Instant T2 = Instant.parse("2026-01-01T00:00:02Z");

    @Mock
    RSyncStore store;

    private final AtomicReference<RSyncStatus> liveStatus = new AtomicReference<>();
    private RSyncStatusClient client;

    @BeforeEach
    void setUp() {
        client = new RSyncStatusClient(store, new ReconcilerMetrics(new SimpleMeterRegistry()), "root-reconciler");
    }

    private void givenLiveRootSync() {
        when(store.get()).thenAnswer(invocation -> {
            var rootSync = new RootSync();
            rootSync.setMetadata(new ObjectMetaBuilder().withName("root-sync").withNamespace("syncwarden-system").withGeneration(3L).build());
            RSyncStatus status = liveStatus.get();
            if (status != null) {
                rootSync.setStatus(RSyncStatusClient.copy(status));
            }
            return Optional.of(rootSync);
        });
    }

    private void givenWritesSucceed() {
        doAnswer(invocation -> {
            RSync written = invocation.getArgument(0);
            liveStatus.set(RSyncStatusClient.copy(written.getStatus()));
            return null;
        }).when(store).updateStatus(any());
    }

    private static List<ReconcilerError> errors(int count) {
        return IntStream.range(0, count).mapToObj(i -> ReconcilerError.of(ErrorKind.OBJECT_OPERATION, "error " + i)).toList();
    }

    private static RSyncCondition syncingCondition(RSyncStatus status) {
        return status.getConditions().stream()
                .filter(c -> ReconcilerStatus.SYNCING_CONDITION_TYPE.equals(c.getType()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void setSourceStatusWritesStageAndCondition() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();

        // When
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1));

        // Then
        RSyncStatus written = liveStatus.get();
        assertThat(written.getReconciler()).isEqualTo("root-reconciler");
        assertThat(written.getObservedGeneration()).isEqualTo(3L);
        assertThat(written.getSource().getCommit()).isEqualTo("abc");
        assertThat(written.getSource().getGit().getRepo()).isEqualTo("https://example.com/repo.git");
        assertThat(written.getSource().getErrors()).isNull();
        assertThat(written.getSource().getErrorSummary().getTotalCount()).isZero();
        assertThat(written.getSource().getLastUpdate()).isEqualTo(T1);
        RSyncCondition condition = syncingCondition(written);
        assertThat(condition.getStatus()).isEqualTo("True");
        assertThat(condition.getReason()).isEqualTo(RSyncStatusClient.REASON_SOURCE);
        assertThat(condition.getCommit()).isEqualTo("abc");
        assertThat(condition.getLastTransitionTime()).isEqualTo(T1);
    }

    @Test
    void unchangedStatusIsNotRewritten() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1));

        // When
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T2));

        // Then
        verify(store, times(1)).updateStatus(any());
        assertThat(liveStatus.get().getSource().getLastUpdate()).isEqualTo(T1);
    }

    @Test
    void changedStatusIsRewrittenKeepingTransitionTime() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1));

        // When
        client.setSourceStatus(new SourceStatus(SPEC, "def", List.of(), T2));

        // Then
        verify(store, times(2)).updateStatus(any());
        RSyncCondition condition = syncingCondition(liveStatus.get());
        assertThat(condition.getLastUpdateTime()).isEqualTo(T2);
        assertThat(condition.getLastTransitionTime()).isEqualTo(T1);
    }

    @Test
    void tooLargeStatusIsRetriedWithFewerErrors() {
        // Given
        givenLiveRootSync();
        var tooLarge = new KubernetesClientException("request entity too large", 413, null);
        var captor = ArgumentCaptor.forClass(RSync.class);
        doThrow(tooLarge).doThrow(tooLarge).doThrow(tooLarge).doNothing().when(store).updateStatus(captor.capture());

        // When
        client.setSyncStatus(new SyncStatus(SPEC, false, "abc", errors(8), T1));

        // Then
        assertThat(captor.getAllValues())
                .extracting(rsync -> rsync.getStatus().getSync().getErrors().size())
                .containsExactly(8, 4, 2, 1);
        RSyncStageStatus lastAttempt = captor.getValue().getStatus().getSync();
        assertThat(lastAttempt.getErrorSummary().getTotalCount()).isEqualTo(8);
        assertThat(lastAttempt.getErrorSummary().getTruncated()).isTrue();
        assertThat(lastAttempt.getErrorSummary().getErrorCountAfterTruncation()).isEqualTo(1);
    }

    @Test
    void otherWriteFailureIsStatusUpdateError() {
        // Given
        givenLiveRootSync();
        doThrow(new KubernetesClientException("conflict", 409, null)).when(store).updateStatus(any());

        // Then
        assertThatThrownBy(() -> client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1)))
                .isInstanceOfSatisfying(ReconcilerException.class, e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.STATUS_UPDATE));
    }

    @Test
    void missingRSyncIsApiServerError() {
        // Given
        when(store.get()).thenReturn(Optional.empty());

        // Then
        assertThatThrownBy(() -> client.readReconcilerStatus())
                .isInstanceOfSatisfying(ReconcilerException.class, e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.API_SERVER));
    }

    @Test
    void finishedSyncRecordsLastSyncedCommitWhenSourceAgrees() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1));

        // When
        client.setSyncStatus(new SyncStatus(SPEC, false, "abc", List.of(), T2));

        // Then
        RSyncStatus written = liveStatus.get();
        assertThat(written.getLastSyncedCommit()).isEqualTo("abc");
        RSyncCondition condition = syncingCondition(written);
        assertThat(condition.getStatus()).isEqualTo("False");
        assertThat(condition.getMessage()).isEqualTo(RSyncStatusClient.MESSAGE_SYNC_COMPLETED);
    }

    @Test
    void syncOfOtherCommitLeavesConditionAlone() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();
        client.setSourceStatus(new SourceStatus(SPEC, "def", List.of(), T1));

        // When
        client.setSyncStatus(new SyncStatus(SPEC, false, "abc", List.of(), T2));

        // Then
        RSyncStatus written = liveStatus.get();
        assertThat(written.getSync().getCommit()).isEqualTo("abc");
        assertThat(written.getLastSyncedCommit()).isNull();
        assertThat(syncingCondition(written).getReason()).isEqualTo(RSyncStatusClient.REASON_SOURCE);
    }

    @Test
    void syncWithErrorsDoesNotRecordLastSyncedCommit() {
        // Given
        givenLiveRootSync();
        givenWritesSucceed();
        client.setSourceStatus(new SourceStatus(SPEC, "abc", List.of(), T1));

        // When
        client.setSyncStatus(new SyncStatus(SPEC, false, "abc", errors(1), T2));

        // Then
        RSyncStatus written = liveStatus.get();
        assertThat(written.getLastSyncedCommit()).isNull();
        assertThat(syncingCondition(written).getErrorSummary().getTotalCount()).isEqualTo(1);
    }

    @Test
    void equivalentRenderingStatusIsSkipped() {
        // Given
        var old = new RenderingStatus(SPEC, "abc", RenderingStatus.RENDERING_SKIPPED, List.of(), T1, false);
        var updated = new RenderingStatus(SPEC, "abc", RenderingStatus.RENDERING_SKIPPED, List.of(), T2, true);

        // When
        client.setRenderingStatus(old, updated);

        // Then
        verifyNoInteractions(store);
    }

    @Test
    void requiresRenderingAnnotation() {
        // When
        client.setRequiresRendering(true);

        // Then
        verify(store).annotate(Annotations.REQUIRES_RENDERING_ANNOTATION_KEY, "true");
    }

    @Test
    void requiresRenderingFailureIsApiServerError() {
        // Given
        doThrow(new KubernetesClientException("boom")).when(store).annotate(any(), any());

        // Then
        assertThatThrownBy(() -> client.setRequiresRendering(false))
                .isInstanceOfSatisfying(ReconcilerException.class, e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.API_SERVER));
    }
}
