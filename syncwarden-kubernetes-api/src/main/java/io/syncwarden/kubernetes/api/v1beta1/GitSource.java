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
 * Location of configuration in a git repository.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "repo", "branch", "revision", "dir", "auth" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class GitSource implements KubernetesResource {

    /**
     * The git repository URL.
     */
    @JsonProperty("repo")
    private String repo;

    /**
     * The branch to sync from. Defaults to the remote HEAD.
     */
    @JsonProperty("branch")
    private String branch;

    /**
     * A tag, commit or ref to sync from. Takes precedence over branch.
     */
    @JsonProperty("revision")
    private String revision;

    /**
     * The path within the repository holding the configuration.
     */
    @JsonProperty("dir")
    private String dir;

    /**
     * The authentication type used to fetch the repository.
     */
    @JsonProperty("auth")
    private String auth;

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public String getAuth() {
        return auth;
    }

    public void setAuth(String auth) {
        this.auth = auth;
    }
}
