/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flipkart.zjsonpatch.DiffFlags;
import com.flipkart.zjsonpatch.JsonDiff;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.declared.Documents;
import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;
import io.syncwarden.tag.VisibleForTesting;

/**
 * Computes which field paths differ between two versions of an object.
 * <p>
 * The objects are compared as generic trees with a JSON patch. Each operation is reduced to a path:
 * an add or replace contributes its own path, a remove of a map contributes one path per removed key and any
 * other remove contributes its own path. Every path then has its list index suffix stripped, so a change
 * anywhere inside a list is reported as a change to the list. That matches the granularity at which fields are
 * declared: lists are always leaves.
 * </p>
 */
public class FieldDiffer {

    private static final String METADATA_ANNOTATIONS = "/metadata/annotations/";
    private static final String METADATA_LABELS = "/metadata/labels/";

    // remove operations must carry the old value so that removed maps can be expanded key by key
    private static final EnumSet<DiffFlags> DIFF_FLAGS = EnumSet.of(DiffFlags.OMIT_MOVE_OPERATION, DiffFlags.OMIT_COPY_OPERATION);

    private final DiffComparator comparator;

    public FieldDiffer() {
        this(DiffComparator.EQUIVALENT);
    }

    public FieldDiffer(DiffComparator comparator) {
        this.comparator = Objects.requireNonNull(comparator);
    }

    public DiffComparator comparator() {
        return comparator;
    }

    /**
     * @param oldObject the object before the change: a typed object, a generic resource or a map
     * @param newObject the object after the change, in any of the same forms
     * @return the paths that changed
     */
    public FieldPathSet diff(Object oldObject, Object newObject) {
        JsonNode source = Documents.toJsonNode(oldObject);
        JsonNode target = Documents.toJsonNode(newObject);
        if (comparator == DiffComparator.EQUIVALENT) {
            target = alignEquivalentLists(source, target.deepCopy());
        }
        JsonNode patch = JsonDiff.asJson(source, target, DIFF_FLAGS);
        var paths = new TreeSet<String>();
        for (JsonNode operation : patch) {
            String op = operation.path("op").asText();
            String path = operation.path("path").asText();
            switch (op) {
                case "add", "replace" -> paths.add(FieldPathSet.stripListIndex(path));
                case "remove" -> {
                    JsonNode removed = operation.get("value");
                    // a removed map contributes its keys only, so an empty map contributes nothing
                    if (removed != null && removed.isObject()) {
                        removed.fieldNames().forEachRemaining(key -> paths.add(FieldPathSet.stripListIndex(path + "/" + FieldPathSet.escape(key))));
                    }
                    else {
                        paths.add(FieldPathSet.stripListIndex(path));
                    }
                }
                default -> {
                    // move, copy and test are not emitted with DIFF_FLAGS
                }
            }
        }
        return FieldPathSet.of(paths);
    }

    /**
     * Replaces every list in {@code target} that holds the same elements as the list at the same location of
     * {@code source}, in any order, with the source list, so that the patch sees no change there.
     */
    @VisibleForTesting
    static JsonNode alignEquivalentLists(JsonNode source, JsonNode target) {
        if (source.isArray() && target.isArray()) {
            if (sameElementsInAnyOrder((ArrayNode) source, (ArrayNode) target)) {
                return source.deepCopy();
            }
            var targetArray = (ArrayNode) target;
            int common = Math.min(source.size(), targetArray.size());
            for (int i = 0; i < common; i++) {
                targetArray.set(i, alignEquivalentLists(source.get(i), targetArray.get(i)));
            }
            return targetArray;
        }
        if (source.isObject() && target.isObject()) {
            var targetObject = (ObjectNode) target;
            Iterator<Map.Entry<String, JsonNode>> fields = targetObject.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode counterpart = source.get(field.getKey());
                if (counterpart != null) {
                    field.setValue(alignEquivalentLists(counterpart, field.getValue()));
                }
            }
            return targetObject;
        }
        return target;
    }

    private static boolean sameElementsInAnyOrder(ArrayNode a, ArrayNode b) {
        if (a.size() != b.size()) {
            return false;
        }
        boolean[] matched = new boolean[b.size()];
        for (JsonNode element : a) {
            boolean found = false;
            for (int i = 0; i < b.size(); i++) {
                if (!matched[i] && element.equals(b.get(i))) {
                    matched[i] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param object a managed object
     * @return the fields the object's manifest declares
     * @throws DeclaredFieldsException if the object carries no declared-fields annotation
     */
    public static FieldPathSet declaredSubset(HasMetadata object) {
        return Annotations.readDeclaredFieldsFrom(object)
                .orElseThrow(() -> new DeclaredFieldsException(
                        Annotations.DECLARED_FIELDS_ANNOTATION_KEY + " annotation is missing from " + ResourcesUtil.describe(object)));
    }

    /**
     * Filters a set down to the annotation and label paths whose key is one the reconciler maintains itself.
     *
     * @param fields any set of paths
     * @return the reserved metadata paths
     */
    public static FieldPathSet reservedMetadataSubset(FieldPathSet fields) {
        return fields.filter(FieldDiffer::isReservedMetadataPath);
    }

    private static boolean isReservedMetadataPath(String path) {
        if (path.startsWith(METADATA_ANNOTATIONS)) {
            return Annotations.isReservedAnnotationKey(FieldPathSet.unescape(path.substring(METADATA_ANNOTATIONS.length())));
        }
        if (path.startsWith(METADATA_LABELS)) {
            return Annotations.isReservedLabelKey(FieldPathSet.unescape(path.substring(METADATA_LABELS.length())));
        }
        return false;
    }
}
