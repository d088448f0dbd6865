/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.api.v1beta1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * The observed state of a sync pipeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "observedGeneration", "reconciler", "lastSyncedCommit", "source", "rendering", "sync", "conditions" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class RSyncStatus implements KubernetesResource {

    @JsonProperty("observedGeneration")
    private Long observedGeneration;

    /**
     * The name of the reconciler process serving this pipeline.
     */
    @JsonProperty("reconciler")
    private String reconciler;

    /**
     * The last commit that was synced without errors.
     */
    @JsonProperty("lastSyncedCommit")
    private String lastSyncedCommit;

    @JsonProperty("source")
    private RSyncStageStatus source;

    @JsonProperty("rendering")
    private RSyncRenderingStatus rendering;

    @JsonProperty("sync")
    private RSyncStageStatus sync;

    @JsonProperty("conditions")
    private List<RSyncCondition> conditions;

    public Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    public String getReconciler() {
        return reconciler;
    }

    public void setReconciler(String reconciler) {
        this.reconciler = reconciler;
    }

    public String getLastSyncedCommit() {
        return lastSyncedCommit;
    }

    public void setLastSyncedCommit(String lastSyncedCommit) {
        this.lastSyncedCommit = lastSyncedCommit;
    }

    public RSyncStageStatus getSource() {
        return source;
    }

    public void setSource(RSyncStageStatus source) {
        this.source = source;
    }

    public RSyncRenderingStatus getRendering() {
        return rendering;
    }

    public void setRendering(RSyncRenderingStatus rendering) {
        this.rendering = rendering;
    }

    public RSyncStageStatus getSync() {
        return sync;
    }

    public void setSync(RSyncStageStatus sync) {
        this.sync = sync;
    }

    public List<RSyncCondition> getConditions() {
        return conditions;
    }

    public void setConditions(List<RSyncCondition> conditions) {
        this.conditions = conditions;
    }
}
