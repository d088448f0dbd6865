/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.declared;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManagerNameTest {

    @Test
    void rootScopedValue() {
        var manager = ManagerName.root("root-sync");
        assertThat(manager.value()).isEqualTo(":root_root-sync");
        assertThat(manager.isRootScoped()).isTrue();
    }

    @Test
    void namespacedValue() {
        var manager = ManagerName.namespaced("bookstore", "repo-sync");
        assertThat(manager).hasToString("bookstore_repo-sync");
        assertThat(manager.isRootScoped()).isFalse();
    }

    @Test
    void parseSplitsAtFirstSeparator() {
        assertThat(ManagerName.parse("bookstore_repo_sync"))
                .isEqualTo(ManagerName.namespaced("bookstore", "repo_sync"));
        assertThat(ManagerName.parse(":root_root-sync")).isEqualTo(ManagerName.root("root-sync"));
    }

    @ParameterizedTest
    @CsvSource({
            ":root_root-sync, root-reconciler",
            ":root_team-a, root-reconciler-team-a",
            "bookstore_repo-sync, ns-reconciler-bookstore",
            "bookstore_orders, ns-reconciler-bookstore-orders-6"
    })
    void reconcilerNameFollowsScopeAndName(String manager, String expected) {
        assertThat(ManagerName.parse(manager).reconcilerName()).isEqualTo(expected);
    }

    @Test
    void serviceAccountUserNamesTheReconciler() {
        assertThat(ManagerName.root("root-sync").serviceAccountUser("syncwarden-system"))
                .isEqualTo("system:serviceaccount:syncwarden-system:root-reconciler");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "nounderscore", "_leading", "trailing_" })
    void parseRejectsMalformedValues(String value) {
        assertThatThrownBy(() -> ManagerName.parse(value)).isInstanceOf(IllegalArgumentException.class);
    }
}
