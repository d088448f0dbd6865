/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.pubsub;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.syncwarden.kubernetes.reconciler.config.PublishingConfiguration;
import io.syncwarden.tag.VisibleForTesting;

/**
 * Publishes {@link StatusMessage}s as JSON records to a Kafka topic, keyed by {@code namespace/name} of the RSync
 * so the messages of one RSync stay ordered.
 */
public class KafkaStatusMessagePublisher implements StatusMessagePublisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaStatusMessagePublisher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long SEND_TIMEOUT_SECONDS = 30;

    private final Producer<String, String> producer;

    public KafkaStatusMessagePublisher(PublishingConfiguration configuration) {
        this(new KafkaProducer<>(producerConfig(configuration), new StringSerializer(), new StringSerializer()));
    }

    @VisibleForTesting
    KafkaStatusMessagePublisher(Producer<String, String> producer) {
        this.producer = Objects.requireNonNull(producer);
    }

    @VisibleForTesting
    static Map<String, Object> producerConfig(PublishingConfiguration configuration) {
        Map<String, Object> config = new HashMap<>(configuration.producerProperties());
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, configuration.bootstrapServers());
        config.putIfAbsent(ProducerConfig.ACKS_CONFIG, "all");
        config.putIfAbsent(ProducerConfig.CLIENT_ID_CONFIG, "syncwarden-reconciler");
        return config;
    }

    @VisibleForTesting
    static String encode(StatusMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        }
        catch (JsonProcessingException e) {
            throw new PublishingException("Failed to encode status message", e);
        }
    }

    @Override
    public void publish(StatusMessage message) {
        var producerRecord = new ProducerRecord<>(message.topic(), message.rsyncNamespace() + "/" + message.rsyncName(), encode(message));
        try {
            RecordMetadata metadata = producer.send(producerRecord).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOGGER.info("Published a {} message for commit {} to {}-{}@{}", message.status().value(), message.commit(), metadata.topic(),
                    metadata.partition(), metadata.offset());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishingException("Interrupted while publishing to " + message.topic(), e);
        }
        catch (ExecutionException e) {
            throw new PublishingException("Failed to publish to " + message.topic(), e.getCause());
        }
        catch (TimeoutException e) {
            throw new PublishingException("Timed out publishing to " + message.topic(), e);
        }
    }

    @Override
    public void close() {
        producer.close();
    }
}
