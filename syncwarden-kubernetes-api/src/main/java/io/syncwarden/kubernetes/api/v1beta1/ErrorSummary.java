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
 * Summarises the errors of a stage status, including whether the list was truncated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "totalCount", "truncated", "errorCountAfterTruncation" })
@lombok.ToString
@lombok.EqualsAndHashCode
public class ErrorSummary implements KubernetesResource {

    /**
     * The number of errors before truncation.
     */
    @JsonProperty("totalCount")
    private Integer totalCount;

    /**
     * True if the error list was truncated to keep the object under the size limit.
     */
    @JsonProperty("truncated")
    private Boolean truncated;

    /**
     * The number of errors kept after truncation.
     */
    @JsonProperty("errorCountAfterTruncation")
    private Integer errorCountAfterTruncation;

    public Integer getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(Integer totalCount) {
        this.totalCount = totalCount;
    }

    public Boolean getTruncated() {
        return truncated;
    }

    public void setTruncated(Boolean truncated) {
        this.truncated = truncated;
    }

    public Integer getErrorCountAfterTruncation() {
        return errorCountAfterTruncation;
    }

    public void setErrorCountAfterTruncation(Integer errorCountAfterTruncation) {
        this.errorCountAfterTruncation = errorCountAfterTruncation;
    }
}
