/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.errors;

import java.util.Objects;

import io.syncwarden.kubernetes.reconciler.declared.ManagerName;

/**
 * Reported by the remediator when an object declared by this pipeline is found to be managed by another one.
 *
 * @param resource the identity of the contested object
 * @param currentManager the manager currently recorded on the live object
 * @param desiredManager this pipeline's manager name
 */
public record ManagementConflict(String resource, ManagerName currentManager, ManagerName desiredManager) {

    public ManagementConflict {
        Objects.requireNonNull(resource);
        Objects.requireNonNull(currentManager);
        Objects.requireNonNull(desiredManager);
    }

    /**
     * @return the conflict as seen by this pipeline
     */
    public ReconcilerError toError() {
        return new ReconcilerError(ErrorKind.MANAGEMENT_CONFLICT,
                "detected a management conflict for " + resource + ": declared by " + desiredManager.value()
                        + " but currently managed by " + currentManager.value(),
                resource,
                null);
    }

    /**
     * @return the same conflict as reported to the other manager
     */
    public ManagementConflict invert() {
        return new ManagementConflict(resource, desiredManager, currentManager);
    }
}
