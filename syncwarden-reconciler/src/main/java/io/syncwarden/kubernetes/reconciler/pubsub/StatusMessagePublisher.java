/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.pubsub;

/**
 * Sends {@link StatusMessage}s somewhere other processes can read them.
 */
public interface StatusMessagePublisher extends AutoCloseable {

    /**
     * @param message the message
     * @throws PublishingException if the message could not be sent
     */
    void publish(StatusMessage message);

    @Override
    default void close() {
    }

    /**
     * @return a publisher that drops every message
     */
    static StatusMessagePublisher noop() {
        return message -> {
        };
    }
}
