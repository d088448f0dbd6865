/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.pubsub;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by a {@link StatusMessage}. Each outcome has an opposite; publishing one forgets the other,
 * so a later flip back is published again.
 */
public enum MessageStatus {
    APPLY_SUCCEEDED("applySucceeded"),
    APPLY_FAILED("applyFailed"),
    RECONCILE_SUCCEEDED("reconcileSucceeded"),
    RECONCILE_FAILED("reconcileFailed");

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public MessageStatus opposite() {
        return switch (this) {
            case APPLY_SUCCEEDED -> APPLY_FAILED;
            case APPLY_FAILED -> APPLY_SUCCEEDED;
            case RECONCILE_SUCCEEDED -> RECONCILE_FAILED;
            case RECONCILE_FAILED -> RECONCILE_SUCCEEDED;
        };
    }
}
