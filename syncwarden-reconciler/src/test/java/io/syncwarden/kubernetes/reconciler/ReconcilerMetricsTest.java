/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerMetricsTest {

    private SimpleMeterRegistry registry;
    private ReconcilerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ReconcilerMetrics(registry);
    }

    @Test
    void countsErrorsByComponentAndCode() {
        // When
        metrics.recordReconcilerErrors("source", List.of(
                ReconcilerError.of(ErrorKind.PARSE, "a"),
                ReconcilerError.of(ErrorKind.PARSE, "b"),
                ReconcilerError.of(ErrorKind.FETCH, "c")));

        // Then
        assertThat(registry.get(ReconcilerMetrics.RECONCILER_ERRORS_METER_NAME)
                .tag(ReconcilerMetrics.COMPONENT_LABEL, "source")
                .tag(ReconcilerMetrics.CODE_LABEL, "1006")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(ReconcilerMetrics.RECONCILER_ERRORS_METER_NAME)
                .tag(ReconcilerMetrics.CODE_LABEL, "2004")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void pipelineErrorsGaugeFollowsLatestValue() {
        // When
        metrics.recordPipelineErrors("sync", 3);
        metrics.recordPipelineErrors("sync", 1);

        // Then
        assertThat(registry.get(ReconcilerMetrics.PIPELINE_ERRORS_METER_NAME)
                .tag(ReconcilerMetrics.COMPONENT_LABEL, "sync")
                .gauge().value()).isEqualTo(1.0);
    }

    @Test
    void lastSyncTimestampInEpochSeconds() {
        // When
        metrics.recordLastSync(ReconcilerMetrics.STATUS_SUCCESS, Instant.ofEpochSecond(1234));

        // Then
        assertThat(registry.get(ReconcilerMetrics.LAST_SYNC_TIMESTAMP_METER_NAME)
                .tag(ReconcilerMetrics.STATUS_LABEL, "success")
                .gauge().value()).isEqualTo(1234.0);
    }

    @Test
    void parserDurationTimer() {
        // When
        metrics.recordParserDuration("reimport", "parse", "success", Duration.ofMillis(5));

        // Then
        assertThat(registry.get(ReconcilerMetrics.PARSER_DURATION_METER_NAME)
                .tag(ReconcilerMetrics.TRIGGER_LABEL, "reimport")
                .timer().count()).isEqualTo(1);
    }

    @Test
    void resourceConflictsByManagerScope() {
        // When
        metrics.recordResourceConflict(true);
        metrics.recordResourceConflict(false);
        metrics.recordResourceConflict(false);

        // Then
        assertThat(registry.get(ReconcilerMetrics.RESOURCE_CONFLICTS_METER_NAME)
                .tag(ReconcilerMetrics.MANAGER_SCOPE_LABEL, "namespace")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void statusTag() {
        assertThat(ReconcilerMetrics.statusTag(List.of())).isEqualTo("success");
        assertThat(ReconcilerMetrics.statusTag(List.of(ReconcilerError.of(ErrorKind.FETCH, "x")))).isEqualTo("error");
    }
}
