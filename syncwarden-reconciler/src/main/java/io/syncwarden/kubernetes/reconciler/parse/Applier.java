/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Makes the cluster match the declared objects: creates and updates them, and prunes objects applied earlier that
 * are no longer declared.
 */
public interface Applier {

    /**
     * @param objects every object the source declares
     * @return what was applied, and the errors
     */
    ApplyResult apply(List<HasMetadata> objects);

    /**
     * @return the errors of the last apply, or destroy
     */
    List<ReconcilerError> errors();

    /**
     * Deletes every object this applier manages.
     *
     * @return the errors
     */
    List<ReconcilerError> destroy();
}
