/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.namespace;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NamespaceControllerStateTest {

    private final NamespaceControllerState state = new NamespaceControllerState();

    @Test
    void newNamespaceSchedulesSyncOnce() {
        // When
        boolean scheduled = state.observe("team-a", Map.of("env", "prod"));

        // Then
        assertThat(scheduled).isTrue();
        assertThat(state.scheduleSync()).isTrue();
        assertThat(state.scheduleSync()).isFalse();
    }

    @Test
    void unchangedLabelsDoNotScheduleSync() {
        // Given
        state.observe("team-a", Map.of("env", "prod"));
        state.scheduleSync();

        // When
        boolean scheduled = state.observe("team-a", Map.of("env", "prod"));

        // Then
        assertThat(scheduled).isFalse();
        assertThat(state.isSyncPending()).isFalse();
    }

    @Test
    void changedLabelsScheduleSync() {
        // Given
        state.observe("team-a", Map.of("env", "prod"));
        state.scheduleSync();

        // When
        boolean scheduled = state.observe("team-a", Map.of("env", "staging"));

        // Then
        assertThat(scheduled).isTrue();
        assertThat(state.isSyncPending()).isTrue();
    }

    @Test
    void forgettingOnlySchedulesSyncForKnownNamespaces() {
        // Given
        state.observe("team-a", Map.of());
        state.scheduleSync();

        // When
        boolean unknown = state.forget("team-b");
        boolean known = state.forget("team-a");

        // Then
        assertThat(unknown).isFalse();
        assertThat(known).isTrue();
        assertThat(state.scheduleSync()).isTrue();
    }
}
