/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.api.v1beta1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The status of the rendering stage, which additionally carries a human readable message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "git", "oci", "helm", "commit", "lastUpdate", "message", "errors", "errorSummary" })
@lombok.ToString(callSuper = true)
@lombok.EqualsAndHashCode(callSuper = true)
public class RSyncRenderingStatus extends RSyncStageStatus {

    /**
     * A human readable description of the rendering outcome.
     */
    @JsonProperty("message")
    private String message;

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
