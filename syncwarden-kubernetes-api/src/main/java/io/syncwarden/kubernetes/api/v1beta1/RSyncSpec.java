/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.api.v1beta1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * The desired state of a sync pipeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "sourceType", "git", "oci", "helm" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class RSyncSpec implements KubernetesResource {

    /**
     * sourceType selects the source of truth: git, oci or helm. Defaults to git.
     */
    @JsonProperty("sourceType")
    private String sourceType;

    /**
     * Git repository settings, used when sourceType is git.
     */
    @JsonProperty("git")
    private GitSource git;

    /**
     * OCI image settings, used when sourceType is oci.
     */
    @JsonProperty("oci")
    private OciSource oci;

    /**
     * Helm chart settings, used when sourceType is helm.
     */
    @JsonProperty("helm")
    private HelmSource helm;

    public String getSourceType() {
        return sourceType;
    }

    public void setSourceType(String sourceType) {
        this.sourceType = sourceType;
    }

    public GitSource getGit() {
        return git;
    }

    public void setGit(GitSource git) {
        this.git = git;
    }

    public OciSource getOci() {
        return oci;
    }

    public void setOci(OciSource oci) {
        this.oci = oci;
    }

    public HelmSource getHelm() {
        return helm;
    }

    public void setHelm(HelmSource helm) {
        this.helm = helm;
    }
}
