/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.namespace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class NamespaceEventReconcilerTest {

    @Mock
    Context<Namespace> context;

    private final NamespaceControllerState state = new NamespaceControllerState();
    private final NamespaceEventReconciler reconciler = new NamespaceEventReconciler(state);

    @Test
    void labelChangeSchedulesNamespaceResync() {
        // Given
        Namespace namespace = new NamespaceBuilder().withNewMetadata().withName("team-a").addToLabels("env", "prod").endMetadata().build();

        // When
        UpdateControl<Namespace> control = reconciler.reconcile(namespace, context);

        // Then
        assertThat(control.isNoUpdate()).isTrue();
        assertThat(state.scheduleSync()).isTrue();
    }

    @Test
    void deletedNamespaceIsForgotten() {
        // Given
        reconciler.reconcile(new NamespaceBuilder().withNewMetadata().withName("team-a").endMetadata().build(), context);
        state.scheduleSync();
        Namespace deleting = new NamespaceBuilder().withNewMetadata().withName("team-a").withDeletionTimestamp("2026-01-01T00:00:00Z").endMetadata().build();

        // When
        reconciler.reconcile(deleting, context);

        // Then
        assertThat(state.scheduleSync()).isTrue();
    }
}
