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
 * A condition on a sync pipeline, for example {@code Syncing}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "type", "status", "lastUpdateTime", "lastTransitionTime", "reason", "message", "commit", "errors", "errorSummary" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class RSyncCondition implements KubernetesResource {

    @JsonProperty("type")
    private String type;

    /**
     * True, False or Unknown.
     */
    @JsonProperty("status")
    private String status;

    @JsonProperty("lastUpdateTime")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastUpdateTime;

    @JsonProperty("lastTransitionTime")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastTransitionTime;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("message")
    private String message;

    @JsonProperty("commit")
    private String commit;

    @JsonProperty("errors")
    private List<RSyncError> errors;

    @JsonProperty("errorSummary")
    private ErrorSummary errorSummary;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getLastUpdateTime() {
        return lastUpdateTime;
    }

    public void setLastUpdateTime(Instant lastUpdateTime) {
        this.lastUpdateTime = lastUpdateTime;
    }

    public Instant getLastTransitionTime() {
        return lastTransitionTime;
    }

    public void setLastTransitionTime(Instant lastTransitionTime) {
        this.lastTransitionTime = lastTransitionTime;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getCommit() {
        return commit;
    }

    public void setCommit(String commit) {
        this.commit = commit;
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
