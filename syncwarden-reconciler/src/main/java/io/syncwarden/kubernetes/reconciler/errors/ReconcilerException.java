/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.errors;

import java.util.Objects;

/**
 * Carries a {@link ReconcilerError} out of a collaborator that cannot return it, such as a status write.
 * The control loop catches it and records the error like any other.
 */
public class ReconcilerException extends RuntimeException {

    private final transient ReconcilerError error;

    public ReconcilerException(ReconcilerError error) {
        super(error.message(), error.cause());
        this.error = Objects.requireNonNull(error);
    }

    public ReconcilerError error() {
        return error;
    }
}
