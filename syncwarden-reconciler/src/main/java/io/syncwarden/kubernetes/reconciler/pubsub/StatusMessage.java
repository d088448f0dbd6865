/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.pubsub;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * JSON message describing the outcome of an apply.
 *
 * @param clusterName the cluster the reconciler runs in
 * @param nodeName the node the reconciler runs on
 * @param topic the destination topic
 * @param rsyncNamespace namespace of the RSync
 * @param rsyncName name of the RSync
 * @param commit the commit applied
 * @param status the outcome
 * @param error summary of the errors, absent on success
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "clusterName", "nodeName", "topic", "rsyncNamespace", "rsyncName", "commit", "status", "error" })
public record StatusMessage(@JsonProperty("clusterName") String clusterName,
                            @JsonProperty("nodeName") String nodeName,
                            @JsonProperty("topic") String topic,
                            @JsonProperty("rsyncNamespace") String rsyncNamespace,
                            @JsonProperty("rsyncName") String rsyncName,
                            @JsonProperty("commit") @Nullable String commit,
                            @JsonProperty("status") MessageStatus status,
                            @JsonProperty("error") @Nullable String error) {

    public StatusMessage {
        Objects.requireNonNull(clusterName);
        Objects.requireNonNull(nodeName);
        Objects.requireNonNull(topic);
        Objects.requireNonNull(rsyncNamespace);
        Objects.requireNonNull(rsyncName);
        Objects.requireNonNull(status);
    }
}
