/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Meters of the control loop. Tag values are drawn from small closed sets: triggers, stages and error codes.
 */
public class ReconcilerMetrics {

    // Labels
    public static final String TRIGGER_LABEL = "trigger";
    public static final String STAGE_LABEL = "stage";
    public static final String STATUS_LABEL = "status";
    public static final String COMPONENT_LABEL = "component";
    public static final String CODE_LABEL = "code";
    public static final String MANAGER_SCOPE_LABEL = "manager_scope";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    // Metric names
    static final String PARSER_DURATION_METER_NAME = "syncwarden_parser_duration";
    static final String RECONCILER_ERRORS_METER_NAME = "syncwarden_reconciler_errors";
    static final String PIPELINE_ERRORS_METER_NAME = "syncwarden_pipeline_errors";
    static final String LAST_SYNC_TIMESTAMP_METER_NAME = "syncwarden_last_sync_timestamp";
    static final String RESOURCE_CONFLICTS_METER_NAME = "syncwarden_resource_conflicts";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, AtomicLong> pipelineErrors = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> lastSyncTimestamps = new ConcurrentHashMap<>();

    public ReconcilerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    /**
     * @param errors errors of a stage
     * @return {@value #STATUS_SUCCESS} or {@value #STATUS_ERROR}
     */
    public static String statusTag(Collection<ReconcilerError> errors) {
        return errors.isEmpty() ? STATUS_SUCCESS : STATUS_ERROR;
    }

    public void recordParserDuration(String trigger, String stage, String status, Duration duration) {
        Timer.builder(PARSER_DURATION_METER_NAME)
                .description("Time taken by each stage of a parse-apply-watch run.")
                .tag(TRIGGER_LABEL, trigger)
                .tag(STAGE_LABEL, stage)
                .tag(STATUS_LABEL, status)
                .register(registry)
                .record(duration);
    }

    /**
     * Counts errors by the stage they were reported in and their code.
     *
     * @param component source, rendering or sync
     * @param errors the errors
     */
    public void recordReconcilerErrors(String component, Collection<ReconcilerError> errors) {
        for (ReconcilerError error : errors) {
            Counter.builder(RECONCILER_ERRORS_METER_NAME)
                    .description("Count of errors reported in RSync status, by component and error code.")
                    .tag(COMPONENT_LABEL, component)
                    .tag(CODE_LABEL, error.code())
                    .register(registry)
                    .increment();
        }
    }

    /**
     * Records the number of errors currently reported by a component.
     *
     * @param component source, rendering or sync
     * @param count the error count
     */
    public void recordPipelineErrors(String component, int count) {
        pipelineErrors.computeIfAbsent(component, c -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(PIPELINE_ERRORS_METER_NAME, value, AtomicLong::get)
                    .strongReference(true)
                    .description("Number of errors currently reported in RSync status, by component.")
                    .tag(COMPONENT_LABEL, c)
                    .register(registry);
            return value;
        }).set(count);
    }

    /**
     * Records when the last sync attempt ended.
     *
     * @param status {@value #STATUS_SUCCESS} or {@value #STATUS_ERROR}
     * @param timestamp when the sync ended
     */
    public void recordLastSync(String status, Instant timestamp) {
        lastSyncTimestamps.computeIfAbsent(status, s -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(LAST_SYNC_TIMESTAMP_METER_NAME, value, AtomicLong::get)
                    .strongReference(true)
                    .description("Epoch second at which the last sync attempt ended, by outcome.")
                    .tag(STATUS_LABEL, s)
                    .register(registry);
            return value;
        }).set(timestamp.getEpochSecond());
    }

    public void recordResourceConflict(boolean rootScopedManager) {
        Counter.builder(RESOURCE_CONFLICTS_METER_NAME)
                .description("Count of management conflicts detected with another manager.")
                .tag(MANAGER_SCOPE_LABEL, rootScopedManager ? "root" : "namespace")
                .register(registry)
                .increment();
    }
}
