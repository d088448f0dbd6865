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
 * The git source a stage status was computed from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "repo", "revision", "branch", "dir" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class GitStatus implements KubernetesResource {

    @JsonProperty("repo")
    private String repo;

    @JsonProperty("revision")
    private String revision;

    @JsonProperty("branch")
    private String branch;

    @JsonProperty("dir")
    private String dir;

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }
}
