/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldDifferTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FieldDiffer structural = new FieldDiffer(DiffComparator.STRUCTURAL);
    private final FieldDiffer equivalent = new FieldDiffer(DiffComparator.EQUIVALENT);

    @Test
    void defaultComparatorIsEquivalent() {
        assertThat(new FieldDiffer().comparator()).isEqualTo(DiffComparator.EQUIVALENT);
    }

    @ParameterizedTest
    @EnumSource(DiffComparator.class)
    void identicalObjectsHaveNoDiff(DiffComparator comparator) {
        var doc = Map.of("a", Map.of("b", 1), "l", List.of(1, 2));
        assertThat(new FieldDiffer(comparator).diff(doc, doc).isEmpty()).isTrue();
    }

    @Test
    void reorderedListIsAChangeOnlyForStructuralComparator() {
        // Given
        var before = Map.of("spec", Map.of("args", List.of("a", "b")));
        var after = Map.of("spec", Map.of("args", List.of("b", "a")));

        // Then
        assertThat(structural.diff(before, after)).containsExactly("/spec/args");
        assertThat(equivalent.diff(before, after).isEmpty()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(DiffComparator.class)
    void changeInsideListElementReportsTheList(DiffComparator comparator) {
        // Given
        var before = Map.of("spec", Map.of("containers", List.of(Map.of("name", "app", "image", "v1"))));
        var after = Map.of("spec", Map.of("containers", List.of(Map.of("name", "app", "image", "v2"))));

        // Then
        assertThat(new FieldDiffer(comparator).diff(before, after)).containsExactly("/spec/containers");
    }

    @ParameterizedTest
    @EnumSource(DiffComparator.class)
    void addAndReplaceReportOwnPath(DiffComparator comparator) {
        // Given
        var before = Map.of("data", Map.of("a", "1"));
        var after = Map.of("data", Map.of("a", "2", "b", "3"));

        // Then
        assertThat(new FieldDiffer(comparator).diff(before, after)).containsExactly("/data/a", "/data/b");
    }

    @Test
    void removedMapExpandsToItsKeys() {
        // Given
        var before = Map.of("metadata", Map.of("labels", Map.of("app", "web", "tier", "front")));
        var after = Map.of("metadata", Map.of());

        // Then
        assertThat(equivalent.diff(before, after)).containsExactly("/metadata/labels/app", "/metadata/labels/tier");
    }

    @Test
    void removedScalarReportsOwnPathAndRemovedEmptyMapNothing() {
        // Given
        var before = Map.of("a", "x", "b", Map.of());
        var after = Map.of();

        // Then
        assertThat(equivalent.diff(before, after)).containsExactly("/a");
    }

    @Test
    void removingOnlyAnEmptyMapIsNoChange() {
        // When
        var changed = equivalent.diff(Map.of("b", Map.of()), Map.of());

        // Then
        assertThat(changed.isEmpty()).isTrue();
    }

    @Test
    void keysContainingSlashAreEscaped() {
        // Given
        var before = new ConfigMapBuilder().withNewMetadata().withName("cm").addToLabels("app", "web").endMetadata().build();
        var after = new ConfigMapBuilder(before).editMetadata().addToLabels("app.kubernetes.io/name", "web").endMetadata().build();

        // Then
        assertThat(equivalent.diff(before, after)).containsExactly("/metadata/labels/app.kubernetes.io~1name");
    }

    @Test
    void alignEquivalentListsRecursesIntoNestedLists() throws Exception {
        // Given
        JsonNode source = MAPPER.readTree("{\"l\":[{\"m\":[1,2]},3]}");
        JsonNode target = MAPPER.readTree("{\"l\":[{\"m\":[2,1]},4]}");

        // When
        JsonNode aligned = FieldDiffer.alignEquivalentLists(source, target);

        // Then
        assertThat(aligned).isEqualTo(MAPPER.readTree("{\"l\":[{\"m\":[1,2]},4]}"));
    }

    @Test
    void duplicatesMustMatchInCount() {
        var before = Map.of("l", List.of(1, 1, 2));
        var after = Map.of("l", List.of(1, 2, 2));
        assertThat(equivalent.diff(before, after)).containsExactly("/l");
    }

    @Test
    void declaredSubsetReadsAnnotation() {
        // Given
        var configMap = new ConfigMap();
        Annotations.annotateWithDeclaredFields(configMap, FieldPathSet.of("/data/a"));

        // Then
        assertThat(FieldDiffer.declaredSubset(configMap)).containsExactly("/data/a");
    }

    @Test
    void declaredSubsetRequiresAnnotation() {
        var configMap = new ConfigMapBuilder().withNewMetadata().withName("cm").withNamespace("ns").endMetadata().build();
        assertThatThrownBy(() -> FieldDiffer.declaredSubset(configMap))
                .isInstanceOf(DeclaredFieldsException.class)
                .hasMessageContaining("ConfigMap ns/cm");
    }

    @Test
    void reservedMetadataSubset() {
        // Given
        var fields = FieldPathSet.of(
                "/metadata/annotations/syncwarden.io~1manager",
                "/metadata/annotations/example.com~1other",
                "/metadata/labels/app.kubernetes.io~1managed-by",
                "/metadata/labels/app",
                "/data/syncwarden.io~1manager");

        // Then
        assertThat(FieldDiffer.reservedMetadataSubset(fields)).containsExactly(
                "/metadata/annotations/syncwarden.io~1manager",
                "/metadata/labels/app.kubernetes.io~1managed-by");
    }
}
