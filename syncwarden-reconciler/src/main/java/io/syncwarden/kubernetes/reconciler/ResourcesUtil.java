/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Static helpers for reading identity out of Kubernetes objects and classifying API server failures.
 */
public class ResourcesUtil {

    private static final String REQUEST_TOO_LARGE_MESSAGE = "request is too large";
    private static final int HTTP_REQUEST_ENTITY_TOO_LARGE = 413;

    private ResourcesUtil() {
    }

    public static String name(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata()).map(ObjectMeta::getName).orElse("");
    }

    public static String namespace(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata()).map(ObjectMeta::getNamespace).orElse("");
    }

    public static String group(HasMetadata resource) {
        String apiVersion = Objects.requireNonNullElse(resource.getApiVersion(), "");
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    /**
     * Formats the group, kind, namespace and name of an object, for example {@code rbac.authorization.k8s.io/Role world/hello}.
     * Core group objects omit the group and cluster scoped objects omit the namespace.
     * @param resource the object
     * @return a human readable identity
     */
    public static String describe(HasMetadata resource) {
        String group = group(resource);
        String kind = Objects.requireNonNullElse(resource.getKind(), "");
        String namespace = namespace(resource);
        String groupKind = group.isEmpty() ? kind : group + "/" + kind;
        String namespacedName = namespace.isEmpty() ? name(resource) : namespace + "/" + name(resource);
        return groupKind + " " + namespacedName;
    }

    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    /**
     * An object can be rejected for size either by the API server (413) or by etcd, which surfaces as an
     * internal error carrying the etcd message.
     * @param e the failure
     * @return true if the write failed because the object was too large
     */
    public static boolean isRequestTooLarge(KubernetesClientException e) {
        if (e.getCode() == HTTP_REQUEST_ENTITY_TOO_LARGE) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains(REQUEST_TOO_LARGE_MESSAGE);
    }
}
