/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.pubsub;

/**
 * Thrown when a {@link StatusMessage} could not be published.
 */
public class PublishingException extends RuntimeException {

    public PublishingException(String message, Throwable cause) {
        super(message, cause);
    }
}
