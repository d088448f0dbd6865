/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.config;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Where apply outcome messages are published.
 *
 * @param bootstrapServers Kafka bootstrap servers
 * @param topic the topic messages are sent to
 * @param producerProperties extra Kafka producer properties, for example security settings
 */
public record PublishingConfiguration(@JsonProperty(value = "bootstrapServers", required = true) String bootstrapServers,
                                      @JsonProperty(value = "topic", required = true) String topic,
                                      @JsonProperty("producerProperties") @Nullable Map<String, String> producerProperties) {

    public PublishingConfiguration {
        Objects.requireNonNull(bootstrapServers);
        Objects.requireNonNull(topic);
        if (bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("publishing.bootstrapServers must not be blank");
        }
        if (topic.isBlank()) {
            throw new IllegalArgumentException("publishing.topic must not be blank");
        }
        producerProperties = producerProperties == null ? Map.of() : Map.copyOf(producerProperties);
    }
}
