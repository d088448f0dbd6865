/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * The objects decoded from a source and the errors met decoding it. Decoding continues past a bad file, so both
 * may be non-empty.
 *
 * @param manifests the decoded objects, in file order
 * @param errors the decoding errors
 */
public record ParseResult(List<ParsedManifest> manifests, List<ReconcilerError> errors) {
    public ParseResult {
        manifests = List.copyOf(manifests);
        errors = List.copyOf(errors);
    }
}
