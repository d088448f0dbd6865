/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.kubernetes.reconciler.hydrate.DeclaredFieldHydrator;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessagePublisher;
import io.syncwarden.kubernetes.reconciler.status.ConflictReporter;
import io.syncwarden.kubernetes.reconciler.status.RSyncStatusClient;
import io.syncwarden.kubernetes.reconciler.status.ReconcilerStatus;
import io.syncwarden.kubernetes.reconciler.status.RenderingStatus;
import io.syncwarden.kubernetes.reconciler.status.SourceStatus;
import io.syncwarden.kubernetes.reconciler.status.SyncStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultRunFunctionTest {

    @Mock
    RSyncStatusClient statusClient;

    @Mock
    ConflictReporter conflictReporter;

    private final FakeSourceReader sourceReader = new FakeSourceReader();
    private final RecordingApplier applier = new RecordingApplier();
    private final AtomicInteger parseCalls = new AtomicInteger();
    private final ReconcilerState state = new ReconcilerState();
    private final DefaultRunFunction runFunction = new DefaultRunFunction();
    private List<ReconcilerError> parseErrors = List.of();

    @BeforeEach
    void setUp() {
        when(statusClient.readReconcilerStatus()).thenReturn(new ReconcilerStatus());
    }

    private SyncPipeline pipeline(PipelineOptions options) {
        ManifestParser parser = source -> {
            parseCalls.incrementAndGet();
            return new ParseResult(List.of(new ParsedManifest(Path.of("configmap.yaml"), PipelineFixtures.configMap(null, "settings"))),
                    parseErrors);
        };
        return new SyncPipeline(options,
                sourceReader,
                parser,
                new DeclaredFieldHydrator(),
                applier,
                Remediator.disabled(),
                statusClient,
                conflictReporter,
                StatusMessagePublisher.noop(),
                new ReconcilerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void firstRunParsesAppliesAndCheckpoints() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.sourceChanged()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(applier.applied).singleElement().satisfies(objects -> {
            HasMetadata applied = objects.get(0);
            assertThat(Annotations.readAnnotation(applied, Annotations.MANAGER_ANNOTATION_KEY)).contains(":root_root-sync");
            assertThat(Annotations.readAnnotation(applied, Annotations.SYNC_TOKEN_ANNOTATION_KEY)).contains("abc");
            assertThat(Annotations.readDeclaredFieldsFrom(applied)).isPresent();
        });
        assertThat(state.lastApplied()).isNotNull();
        assertThat(state.lastApplied().commit()).isEqualTo("abc");
        assertThat(state.needToRetry()).isFalse();
        ArgumentCaptor<SyncStatus> syncStatus = ArgumentCaptor.forClass(SyncStatus.class);
        verify(statusClient).setSyncStatus(syncStatus.capture());
        assertThat(syncStatus.getValue().commit()).isEqualTo("abc");
        assertThat(syncStatus.getValue().syncing()).isFalse();
    }

    @Test
    void reimportWithoutSourceChangeDoesNoWork() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());
        runFunction.run(pipeline, Trigger.REIMPORT, state);

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.sourceChanged()).isFalse();
        assertThat(result.errors()).isEmpty();
        assertThat(parseCalls).hasValue(1);
        assertThat(sourceReader.listCalls).isEqualTo(1);
        assertThat(applier.applied).hasSize(1);
    }

    @Test
    void resyncReparsesAndReappliesWithoutRereadingFiles() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());
        runFunction.run(pipeline, Trigger.REIMPORT, state);
        state.resetPartialCache();

        // When
        RunResult result = runFunction.run(pipeline, Trigger.RESYNC, state);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(sourceReader.listCalls).isEqualTo(1);
        assertThat(parseCalls).hasValue(2);
        assertThat(applier.applied).hasSize(2);
    }

    @Test
    void retryReappliesCachedObjectsWithoutReparsing() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());
        runFunction.run(pipeline, Trigger.REIMPORT, state);

        // When
        RunResult result = runFunction.run(pipeline, Trigger.RETRY, state);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(parseCalls).hasValue(1);
        assertThat(applier.applied).hasSize(2);
    }

    @Test
    void newCommitIsReadAndApplied() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());
        runFunction.run(pipeline, Trigger.REIMPORT, state);
        sourceReader.checkedOutAt("def");

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.sourceChanged()).isTrue();
        assertThat(parseCalls).hasValue(2);
        assertThat(state.lastApplied().syncDir()).isEqualTo(FakeSourceReader.syncDir("def"));
    }

    @Test
    void syncStatusNeverRunsAheadOfSourceStatus() {
        // Given
        sourceReader.checkedOutAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());
        runFunction.run(pipeline, Trigger.REIMPORT, state);
        sourceReader.checkedOutAt("def");

        // When
        runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        InOrder inOrder = inOrder(statusClient);
        ArgumentCaptor<SourceStatus> sourceStatus = ArgumentCaptor.forClass(SourceStatus.class);
        ArgumentCaptor<SyncStatus> syncStatus = ArgumentCaptor.forClass(SyncStatus.class);
        inOrder.verify(statusClient).setSourceStatus(sourceStatus.capture());
        inOrder.verify(statusClient).setSyncStatus(syncStatus.capture());
        inOrder.verify(statusClient).setSourceStatus(sourceStatus.capture());
        inOrder.verify(statusClient).setSyncStatus(syncStatus.capture());
        assertThat(sourceStatus.getAllValues()).extracting(SourceStatus::commit).containsExactly("abc", "def");
        assertThat(syncStatus.getAllValues()).extracting(SyncStatus::commit).containsExactly("abc", "def");
        assertThat(state.status().syncStatus().commit()).isEqualTo(state.status().sourceStatus().commit());
    }

    @Test
    void fetchFailureIsReportedAsSourceErrorAndRetried() {
        // Given
        sourceReader.failingWith("repository unreachable");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.kind()).isEqualTo(ErrorKind.FETCH);
            assertThat(e.message()).isEqualTo("source: repository unreachable");
        });
        ArgumentCaptor<SourceStatus> sourceStatus = ArgumentCaptor.forClass(SourceStatus.class);
        verify(statusClient).setSourceStatus(sourceStatus.capture());
        assertThat(sourceStatus.getValue().errors()).extracting(ReconcilerError::kind).containsExactly(ErrorKind.FETCH);
        assertThat(parseCalls).hasValue(0);
        assertThat(state.needToRetry()).isTrue();
    }

    @Test
    void parseErrorsBlockApplyAndDoNotCheckpoint() {
        // Given
        sourceReader.checkedOutAt("abc");
        parseErrors = List.of(ReconcilerError.of(ErrorKind.PARSE, "configmap.yaml: invalid YAML"));
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.sourceChanged()).isTrue();
        assertThat(result.errors()).extracting(ReconcilerError::message).containsExactly("source: configmap.yaml: invalid YAML");
        assertThat(applier.applied).isEmpty();
        assertThat(state.lastApplied()).isNull();
        assertThat(state.needToRetry()).isTrue();
        verify(statusClient, never()).setSyncStatus(any());
    }

    @Test
    void failedFinalStatusWriteDoesNotCheckpoint() {
        // Given
        sourceReader.checkedOutAt("abc");
        doThrow(new ReconcilerException(ReconcilerError.of(ErrorKind.STATUS_UPDATE, "failed to update the sync status: conflict")))
                .when(statusClient).setSyncStatus(any());
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(applier.applied).hasSize(1);
        assertThat(result.errors()).extracting(ReconcilerError::kind).containsExactly(ErrorKind.STATUS_UPDATE);
        assertThat(state.lastApplied()).isNull();
        assertThat(state.needToRetry()).isTrue();
    }

    @Test
    void applyErrorsAreReportedInSyncStatus() {
        // Given
        sourceReader.checkedOutAt("abc");
        applier.failingWith(ReconcilerError.of(ErrorKind.OBJECT_OPERATION, "failed to apply ConfigMap settings"));
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).extracting(ReconcilerError::message).containsExactly("sync: failed to apply ConfigMap settings");
        ArgumentCaptor<SyncStatus> syncStatus = ArgumentCaptor.forClass(SyncStatus.class);
        verify(statusClient).setSyncStatus(syncStatus.capture());
        assertThat(syncStatus.getValue().errors()).extracting(ReconcilerError::message).containsExactly("failed to apply ConfigMap settings");
    }

    @Test
    void unfinishedRenderingIsReportedWithoutParsing() {
        // Given
        sourceReader.checkedOutAt("abc").renderedAt(null);
        SyncPipeline pipeline = pipeline(PipelineFixtures.options(PipelineFixtures.ROOT_MANAGER, true, true, null));

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).isEmpty();
        ArgumentCaptor<RenderingStatus> renderingStatus = ArgumentCaptor.forClass(RenderingStatus.class);
        verify(statusClient).setRenderingStatus(any(), renderingStatus.capture());
        assertThat(renderingStatus.getValue().message()).isEqualTo(RenderingStatus.RENDERING_IN_PROGRESS);
        assertThat(parseCalls).hasValue(0);
    }

    @Test
    void renderedOutputIsApplied() {
        // Given
        sourceReader.checkedOutAt("abc").renderedAt("abc");
        SyncPipeline pipeline = pipeline(PipelineFixtures.options(PipelineFixtures.ROOT_MANAGER, true, true, null));

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(state.lastApplied().syncDir()).isEqualTo(Path.of("/repo/hydrated/abc/configs"));
        ArgumentCaptor<RenderingStatus> renderingStatus = ArgumentCaptor.forClass(RenderingStatus.class);
        verify(statusClient).setRenderingStatus(any(), renderingStatus.capture());
        assertThat(renderingStatus.getValue().message()).isEqualTo(RenderingStatus.RENDERING_SUCCEEDED);
    }

    @Test
    void drySourceWithoutRenderingAsksForRendering() {
        // Given
        sourceReader.checkedOutAt("abc").withFiles("kustomization.yaml");
        SyncPipeline pipeline = pipeline(PipelineFixtures.rootOptions());

        // When
        RunResult result = runFunction.run(pipeline, Trigger.REIMPORT, state);

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).extracting(ReconcilerError::kind).containsExactly(ErrorKind.RENDERING);
        verify(statusClient).setRequiresRendering(true);
        assertThat(parseCalls).hasValue(0);
    }
}
