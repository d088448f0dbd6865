/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.declared;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

/**
 * Converts typed and generic Kubernetes objects into the generic tree forms used for field path computation and
 * diffing. The fabric8 serialization is used so that a typed object and its generic counterpart produce the same tree.
 */
public class Documents {

    private static final KubernetesSerialization SERIALIZATION = new KubernetesSerialization();

    private Documents() {
    }

    /**
     * @param object a typed object, a generic resource or a map
     * @return the object as nested maps, lists and scalars
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> toDocument(Object object) {
        Objects.requireNonNull(object);
        return SERIALIZATION.convertValue(object, Map.class);
    }

    /**
     * @param object a typed object, a generic resource or a map
     * @return the object as a Jackson tree
     */
    public static JsonNode toJsonNode(Object object) {
        Objects.requireNonNull(object);
        return SERIALIZATION.convertValue(object, JsonNode.class);
    }

    public static KubernetesSerialization serialization() {
        return SERIALIZATION;
    }
}
