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
 * Location of configuration in a Helm chart.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "repo", "chart", "version", "releaseName", "namespace" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class HelmSource implements KubernetesResource {

    /**
     * The Helm repository URL.
     */
    @JsonProperty("repo")
    private String repo;

    /**
     * The chart name.
     */
    @JsonProperty("chart")
    private String chart;

    /**
     * The chart version. Defaults to the latest version.
     */
    @JsonProperty("version")
    private String version;

    /**
     * The release name used when rendering.
     */
    @JsonProperty("releaseName")
    private String releaseName;

    /**
     * The target namespace for the rendered objects.
     */
    @JsonProperty("namespace")
    private String namespace;

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getChart() {
        return chart;
    }

    public void setChart(String chart) {
        this.chart = chart;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getReleaseName() {
        return releaseName;
    }

    public void setReleaseName(String releaseName) {
        this.releaseName = releaseName;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }
}
