/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.errors;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import io.fabric8.kubernetes.api.model.rbac.RoleBuilder;

import io.syncwarden.kubernetes.reconciler.declared.ManagerName;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerErrorTest {

    @Test
    void forObjectNamesTheObject() {
        // Given
        var role = new RoleBuilder().withNewMetadata().withName("hello").withNamespace("world").endMetadata().build();

        // When
        var error = ReconcilerError.forObject(ErrorKind.OBJECT_OPERATION, role, "failed to apply");

        // Then
        assertThat(error.resource()).isEqualTo("rbac.authorization.k8s.io/Role world/hello");
        assertThat(error.message()).isEqualTo("failed to apply for rbac.authorization.k8s.io/Role world/hello");
        assertThat(error.code()).isEqualTo("2009");
    }

    @Test
    void equalityIgnoresCause() {
        var withCause = ReconcilerError.of(ErrorKind.FETCH, "boom", new IllegalStateException());
        var withoutCause = ReconcilerError.of(ErrorKind.FETCH, "boom");
        assertThat(withCause).isEqualTo(withoutCause).hasSameHashCodeAs(withoutCause);
    }

    @Test
    void wrapPrefixesStage() {
        var error = ReconcilerError.of(ErrorKind.PARSE, "bad yaml").wrap("parse");
        assertThat(error.message()).isEqualTo("parse: bad yaml");
        assertThat(error.kind()).isEqualTo(ErrorKind.PARSE);
    }

    @Test
    void summarizeJoinsCodesAndMessages() {
        var errors = List.of(ReconcilerError.of(ErrorKind.FETCH, "a"), ReconcilerError.of(ErrorKind.PARSE, "b"));
        assertThat(ReconcilerError.summarize(errors)).isEqualTo("[2004] a; [1006] b");
    }

    @Test
    void ofKindSelectsStage() {
        var fetch = ReconcilerError.of(ErrorKind.FETCH, "a");
        var render = ReconcilerError.of(ErrorKind.RENDERING, "b");
        var apply = ReconcilerError.of(ErrorKind.OBJECT_OPERATION, "c");
        assertThat(ReconcilerError.ofKind(List.of(fetch, render, apply), ErrorKind.Stage.SOURCE)).containsExactly(fetch);
        assertThat(ReconcilerError.ofKind(List.of(fetch, render, apply), ErrorKind.Stage.SYNC)).containsExactly(apply);
        assertThat(ReconcilerError.anyBlocksApply(List.of(apply))).isFalse();
        assertThat(ReconcilerError.anyBlocksApply(List.of(apply, render))).isTrue();
        assertThat(ReconcilerError.anyRetriable(List.of(render))).isFalse();
        assertThat(ReconcilerError.anyRetriable(List.of(render, fetch))).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "FETCH, SOURCE, true",
            "PARSE, SOURCE, false",
            "VALIDATION, SOURCE, false",
            "RENDERING, RENDERING, false",
            "OBJECT_OPERATION, SYNC, true",
            "OBJECT_RECONCILE, SYNC, false",
            "MANAGEMENT_CONFLICT, SYNC, true",
            "FIGHT, SYNC, false"
    })
    void classification(ErrorKind kind, ErrorKind.Stage stage, boolean retriable) {
        assertThat(kind.stage()).isEqualTo(stage);
        assertThat(kind.isRetriable()).isEqualTo(retriable);
        assertThat(kind.blocksApply()).isEqualTo(stage != ErrorKind.Stage.SYNC);
    }

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    void codesRoundTrip(ErrorKind kind) {
        assertThat(ErrorKind.fromCode(kind.code())).isEqualTo(kind);
    }

    @Test
    void unknownCodeIsInternal() {
        assertThat(ErrorKind.fromCode("0000")).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void managementConflictInverts() {
        // Given
        var conflict = new ManagementConflict("/ConfigMap ns/cm", ManagerName.root("other"), ManagerName.namespaced("ns", "mine"));

        // When
        var inverted = conflict.invert();

        // Then
        assertThat(inverted.currentManager()).isEqualTo(ManagerName.namespaced("ns", "mine"));
        assertThat(inverted.desiredManager()).isEqualTo(ManagerName.root("other"));
        assertThat(conflict.toError().message())
                .isEqualTo("detected a management conflict for /ConfigMap ns/cm: declared by ns_mine but currently managed by :root_other");
        assertThat(conflict.toError().kind()).isEqualTo(ErrorKind.MANAGEMENT_CONFLICT);
    }
}
