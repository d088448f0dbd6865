/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

/**
 * Thrown when the declared fields of an object cannot be determined.
 */
public class DeclaredFieldsException extends RuntimeException {

    public DeclaredFieldsException(String message) {
        super(message);
    }
}
