/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.errors.ManagementConflict;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Watches the applied objects and reverts drift on them between applies. The control loop only reads what the
 * remediator has accumulated; the remediator never changes control loop state.
 */
public interface Remediator {

    /**
     * @return true while drift is being corrected
     */
    boolean remediating();

    /**
     * Stops correcting drift, so an apply does not race with it.
     */
    void pause();

    void resume();

    /**
     * @return true if the set of watched kinds is out of date
     */
    boolean needsWatchUpdate();

    /**
     * @param groupKinds the {@code group/Kind} of every applied object
     * @param declared the declared objects
     * @return the errors starting or stopping watches
     */
    List<ReconcilerError> updateWatches(Set<String> groupKinds, List<HasMetadata> declared);

    /**
     * @return the errors met correcting drift, fights included
     */
    List<ReconcilerError> errors();

    /**
     * @return objects declared here but currently managed by another pipeline
     */
    List<ManagementConflict> managementConflicts();

    /**
     * @return a remediator that watches nothing
     */
    static Remediator disabled() {
        return new Remediator() {
            @Override
            public boolean remediating() {
                return false;
            }

            @Override
            public void pause() {
            }

            @Override
            public void resume() {
            }

            @Override
            public boolean needsWatchUpdate() {
                return false;
            }

            @Override
            public List<ReconcilerError> updateWatches(Set<String> groupKinds, List<HasMetadata> declared) {
                return List.of();
            }

            @Override
            public List<ReconcilerError> errors() {
                return List.of();
            }

            @Override
            public List<ManagementConflict> managementConflicts() {
                return List.of();
            }
        };
    }
}
