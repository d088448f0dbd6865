/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.kubernetes.reconciler.hydrate.DeclaredFieldHydrator;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessagePublisher;
import io.syncwarden.kubernetes.reconciler.status.ConflictReporter;
import io.syncwarden.kubernetes.reconciler.status.RSyncStatusClient;
import io.syncwarden.kubernetes.reconciler.status.ReconcilerStatus;
import io.syncwarden.kubernetes.reconciler.status.SyncStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PeriodicSyncStatusUpdaterTest {

    @Mock
    RSyncStatusClient statusClient;

    @Mock
    ConflictReporter conflictReporter;

    private final StubRemediator remediator = new StubRemediator();
    private final ReconcilerState state = new ReconcilerState();

    @BeforeEach
    void setUp() {
        state.status(new ReconcilerStatus());
        state.cache().source(new SourceState(null, "abc", FakeSourceReader.syncDir("abc"), List.of()));
        remediator.errors = List.of(ReconcilerError.of(ErrorKind.FIGHT, "fight detected on ConfigMap settings"));
    }

    private SyncPipeline pipeline(Duration statusUpdatePeriod) {
        return new SyncPipeline(PipelineFixtures.options(PipelineFixtures.ROOT_MANAGER, false, true, null, statusUpdatePeriod),
                new FakeSourceReader(),
                source -> new ParseResult(List.of(), List.of()),
                new DeclaredFieldHydrator(),
                new RecordingApplier(),
                remediator,
                statusClient,
                conflictReporter,
                StatusMessagePublisher.noop(),
                new ReconcilerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void republishesSyncingStatusWhileRunning() {
        // Given
        SyncPipeline pipeline = pipeline(Duration.ofMillis(20));

        // When
        PeriodicSyncStatusUpdater updater = PeriodicSyncStatusUpdater.start(pipeline, state);
        try {
            // Then
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(statusClient, atLeastOnce()).setSyncStatus(any()));
        }
        finally {
            updater.stop();
        }
        ArgumentCaptor<SyncStatus> written = ArgumentCaptor.forClass(SyncStatus.class);
        verify(statusClient, atLeastOnce()).setSyncStatus(written.capture());
        assertThat(written.getValue().syncing()).isTrue();
        assertThat(written.getValue().errors()).extracting(ReconcilerError::kind).containsExactly(ErrorKind.FIGHT);
    }

    @Test
    void noWritesAfterStop() {
        // Given
        PeriodicSyncStatusUpdater updater = PeriodicSyncStatusUpdater.start(pipeline(Duration.ofMinutes(1)), state);

        // When
        updater.stop();
        updater.tick();

        // Then
        assertThat(updater.isStopped()).isTrue();
        verify(statusClient, never()).setSyncStatus(any());
    }

    @Test
    void failedWriteDoesNotStopTheUpdates() {
        // Given
        doThrow(new ReconcilerException(ReconcilerError.of(ErrorKind.STATUS_UPDATE, "failed to update the sync status")))
                .when(statusClient).setSyncStatus(any());
        PeriodicSyncStatusUpdater updater = PeriodicSyncStatusUpdater.start(pipeline(Duration.ofMillis(20)), state);
        try {
            // When
            await().atMost(Duration.ofSeconds(5)).until(() -> mockingDetails(statusClient).getInvocations().size() >= 2);

            // Then
            assertThat(updater.isStopped()).isFalse();
        }
        finally {
            updater.close();
        }
    }
}
