/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

import java.util.Objects;

import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;

/**
 * The outcome of reviewing a write to a managed object.
 *
 * @param allowed whether the write may proceed
 * @param deniedFields the protected fields the write touches, empty when allowed
 * @param message a human readable reason, empty when allowed
 */
public record AdmissionDecision(boolean allowed, FieldPathSet deniedFields, String message) {

    public AdmissionDecision {
        Objects.requireNonNull(deniedFields);
        Objects.requireNonNull(message);
    }

    static AdmissionDecision allow() {
        return new AdmissionDecision(true, FieldPathSet.empty(), "");
    }

    static AdmissionDecision deny(FieldPathSet fields, String message) {
        return new AdmissionDecision(false, fields, message);
    }
}
