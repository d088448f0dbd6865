/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerCacheTest {

    private final ReconcilerState state = new ReconcilerState();
    private final SourceState source = new SourceState(null, "abc", FakeSourceReader.syncDir("abc"), List.of());

    @BeforeEach
    void setUp() {
        state.cache().source(source);
        state.cache().setParserResult(List.of(PipelineFixtures.configMap(null, "settings")), List.of());
        state.invalidate(List.of(ReconcilerError.of(ErrorKind.OBJECT_OPERATION, "boom")));
    }

    @Test
    void partialResetKeepsSourceAndRetryFlag() {
        // When
        state.resetPartialCache();

        // Then
        assertThat(state.cache().source()).isEqualTo(source);
        assertThat(state.needToRetry()).isTrue();
        assertThat(state.cache().parserResultUpToDate()).isFalse();
        assertThat(state.cache().objects()).isEmpty();
    }

    @Test
    void fullResetForgetsEverything() {
        // When
        state.resetCache();

        // Then
        assertThat(state.cache().source()).isNull();
        assertThat(state.needToRetry()).isFalse();
        assertThat(state.cache().parserResultUpToDate()).isFalse();
    }

    @Test
    void checkpointRecordsTheAppliedSource() {
        // When
        state.checkpoint();

        // Then
        assertThat(state.lastApplied()).isEqualTo(source);
        assertThat(state.needToRetry()).isFalse();
        assertThat(state.cache().parserResultUpToDate()).isTrue();
    }

    @Test
    void parserResultIsCopied() {
        // Then
        assertThat(state.cache().objects()).hasSize(1);
        assertThat(state.cache().parserErrors()).isEmpty();
    }
}
