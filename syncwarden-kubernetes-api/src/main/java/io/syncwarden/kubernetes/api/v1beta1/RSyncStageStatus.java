/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.api.v1beta1;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * The status of one stage (source, rendering or sync) of a sync pipeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "git", "oci", "helm", "commit", "lastUpdate", "errors", "errorSummary" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class RSyncStageStatus implements KubernetesResource {

    @JsonProperty("git")
    private GitStatus git;

    @JsonProperty("oci")
    private OciStatus oci;

    @JsonProperty("helm")
    private HelmStatus helm;

    /**
     * The source commit (or image digest, or chart version) this status was computed for.
     */
    @JsonProperty("commit")
    private String commit;

    /**
     * When this stage status was last written.
     */
    @JsonProperty("lastUpdate")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastUpdate;

    /**
     * The errors encountered by this stage, possibly truncated.
     */
    @JsonProperty("errors")
    private List<RSyncError> errors;

    @JsonProperty("errorSummary")
    private ErrorSummary errorSummary;

    public GitStatus getGit() {
        return git;
    }

    public void setGit(GitStatus git) {
        this.git = git;
    }

    public OciStatus getOci() {
        return oci;
    }

    public void setOci(OciStatus oci) {
        this.oci = oci;
    }

    public HelmStatus getHelm() {
        return helm;
    }

    public void setHelm(HelmStatus helm) {
        this.helm = helm;
    }

    public String getCommit() {
        return commit;
    }

    public void setCommit(String commit) {
        this.commit = commit;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(Instant lastUpdate) {
        this.lastUpdate = lastUpdate;
    }

    public List<RSyncError> getErrors() {
        return errors;
    }

    public void setErrors(List<RSyncError> errors) {
        this.errors = errors;
    }

    public ErrorSummary getErrorSummary() {
        return errorSummary;
    }

    public void setErrorSummary(ErrorSummary errorSummary) {
        this.errorSummary = errorSummary;
    }
}
