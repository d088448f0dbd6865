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
 * Location of configuration in an OCI image.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "image", "dir", "auth" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class OciSource implements KubernetesResource {

    /**
     * The OCI image reference.
     */
    @JsonProperty("image")
    private String image;

    /**
     * The path within the image holding the configuration.
     */
    @JsonProperty("dir")
    private String dir;

    /**
     * The authentication type used to pull the image.
     */
    @JsonProperty("auth")
    private String auth;

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
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
