/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * The outcome of one run.
 *
 * @param sourceChanged true if a new sync directory was read, which resets the retry backoff
 * @param success true if every step succeeded, including the final status write
 * @param errors the errors of the run
 */
public record RunResult(boolean sourceChanged, boolean success, List<ReconcilerError> errors) {

    public RunResult {
        errors = List.copyOf(errors);
    }

    static RunResult failed(List<ReconcilerError> errors) {
        return new RunResult(false, false, errors);
    }
}
