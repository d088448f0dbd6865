/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.config;

/**
 * A problem with the reconciler's own configuration which prevents it from starting.
 * Such problems exist independently of the RSync being served.
 */
public class ReconcilerConfigurationException extends RuntimeException {
    public ReconcilerConfigurationException(String msg) {
        super(msg);
    }

    public ReconcilerConfigurationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
