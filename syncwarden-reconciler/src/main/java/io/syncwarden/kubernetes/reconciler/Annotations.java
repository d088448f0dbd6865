/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.utils.KubernetesResourceUtil;

import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Used to read/write the reconciler's bookkeeping annotations and labels on managed objects and on the
 * RSync resources. This class aims to encapsulate annotation logic so that we can make breaking changes to
 * the annotation keys or data without changing client interfaces.
 */
public class Annotations {

    public static final String DECLARED_FIELDS_ANNOTATION_KEY = "syncwarden.io/declared-fields";
    public static final String MANAGER_ANNOTATION_KEY = "syncwarden.io/manager";
    public static final String MANAGEMENT_ANNOTATION_KEY = "syncwarden.io/managed";
    public static final String SOURCE_PATH_ANNOTATION_KEY = "syncwarden.io/source-path";
    public static final String RESOURCE_ID_ANNOTATION_KEY = "syncwarden.io/resource-id";
    public static final String SYNC_TOKEN_ANNOTATION_KEY = "syncwarden.io/sync-token";
    public static final String GIT_CONTEXT_ANNOTATION_KEY = "syncwarden.io/git-context";
    public static final String OWNING_INVENTORY_ANNOTATION_KEY = "syncwarden.io/owning-inventory";

    /**
     * Set on an RSync (not on managed objects) to tell the reconciler manager whether the source needs rendering.
     */
    public static final String REQUIRES_RENDERING_ANNOTATION_KEY = "syncwarden.io/requires-rendering";

    /**
     * Set on an RSync to request that managed objects are deleted before the RSync itself is.
     */
    public static final String DELETION_PROPAGATION_POLICY_ANNOTATION_KEY = "syncwarden.io/deletion-propagation-policy";
    public static final String DELETION_PROPAGATION_FOREGROUND = "Foreground";

    public static final String MANAGEMENT_ENABLED = "enabled";
    public static final String MANAGEMENT_DISABLED = "disabled";

    public static final String MANAGED_BY_LABEL_KEY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "syncwarden";
    public static final String DECLARED_VERSION_LABEL_KEY = "syncwarden.io/declared-version";

    @VisibleForTesting
    static final Set<String> RESERVED_ANNOTATION_KEYS = Set.of(
            DECLARED_FIELDS_ANNOTATION_KEY,
            MANAGER_ANNOTATION_KEY,
            MANAGEMENT_ANNOTATION_KEY,
            SOURCE_PATH_ANNOTATION_KEY,
            RESOURCE_ID_ANNOTATION_KEY,
            SYNC_TOKEN_ANNOTATION_KEY,
            GIT_CONTEXT_ANNOTATION_KEY,
            OWNING_INVENTORY_ANNOTATION_KEY);

    @VisibleForTesting
    static final Set<String> RESERVED_LABEL_KEYS = Set.of(
            MANAGED_BY_LABEL_KEY,
            DECLARED_VERSION_LABEL_KEY);

    private Annotations() {
    }

    /**
     * @param key an unescaped annotation key
     * @return true if the key is one of the annotations the reconciler maintains on managed objects
     */
    public static boolean isReservedAnnotationKey(String key) {
        return RESERVED_ANNOTATION_KEYS.contains(key);
    }

    /**
     * @param key an unescaped label key
     * @return true if the key is one of the labels the reconciler maintains on managed objects
     */
    public static boolean isReservedLabelKey(String key) {
        return RESERVED_LABEL_KEYS.contains(key);
    }

    /**
     * Mutates a HasMetadata, adding a `syncwarden.io/declared-fields` annotation holding the compact
     * form of the given set. Metadata and annotations are created if they are null.
     * @param hasMetadata the object to annotate
     * @param declaredFields the declared fields
     */
    public static void annotateWithDeclaredFields(HasMetadata hasMetadata, FieldPathSet declaredFields) {
        Objects.requireNonNull(hasMetadata);
        Objects.requireNonNull(declaredFields);
        KubernetesResourceUtil.getOrCreateAnnotations(hasMetadata).put(DECLARED_FIELDS_ANNOTATION_KEY, declaredFields.toAnnotationValue());
    }

    /**
     * Reads the declared fields of an object from its `syncwarden.io/declared-fields` annotation.
     * @param hasMetadata the object
     * @return the declared fields, or empty if the annotation is absent
     */
    public static Optional<FieldPathSet> readDeclaredFieldsFrom(HasMetadata hasMetadata) {
        Objects.requireNonNull(hasMetadata);
        return Optional.ofNullable(annotations(hasMetadata).get(DECLARED_FIELDS_ANNOTATION_KEY))
                .map(FieldPathSet::fromAnnotationValue);
    }

    public static void removeAnnotation(HasMetadata hasMetadata, String key) {
        Objects.requireNonNull(hasMetadata);
        var metadata = hasMetadata.getMetadata();
        if (metadata != null && metadata.getAnnotations() != null) {
            metadata.getAnnotations().remove(key);
        }
    }

    public static void annotate(HasMetadata hasMetadata, String key, String value) {
        Objects.requireNonNull(hasMetadata);
        KubernetesResourceUtil.getOrCreateAnnotations(hasMetadata).put(key, value);
    }

    public static void label(HasMetadata hasMetadata, String key, String value) {
        Objects.requireNonNull(hasMetadata);
        KubernetesResourceUtil.getOrCreateLabels(hasMetadata).put(key, value);
    }

    public static Optional<String> readAnnotation(HasMetadata hasMetadata, String key) {
        Objects.requireNonNull(hasMetadata);
        return Optional.ofNullable(annotations(hasMetadata).get(key));
    }

    /**
     * @param hasMetadata an object
     * @return true if the object opted out of management with {@code syncwarden.io/managed: disabled}
     */
    public static boolean isManagementDisabled(HasMetadata hasMetadata) {
        return MANAGEMENT_DISABLED.equals(annotations(hasMetadata).get(MANAGEMENT_ANNOTATION_KEY));
    }

    @NonNull
    private static Map<String, String> annotations(HasMetadata hasMetadata) {
        return Optional.ofNullable(hasMetadata.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .orElse(Map.of());
    }
}
