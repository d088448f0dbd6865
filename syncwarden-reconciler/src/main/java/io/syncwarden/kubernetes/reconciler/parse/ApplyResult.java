/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;
import java.util.Set;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * What an apply did.
 *
 * @param appliedGroupKinds the {@code group/Kind} of every object applied; core objects have an empty group
 * @param errors the object operation errors
 */
public record ApplyResult(Set<String> appliedGroupKinds, List<ReconcilerError> errors) {
    public ApplyResult {
        appliedGroupKinds = Set.copyOf(appliedGroupKinds);
        errors = List.copyOf(errors);
    }
}
