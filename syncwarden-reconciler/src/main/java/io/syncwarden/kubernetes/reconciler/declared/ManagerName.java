/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.declared;

import java.util.Objects;

/**
 * Identifies the pipeline that manages an object, as recorded in the {@code syncwarden.io/manager} annotation.
 * A root scoped pipeline is written {@code :root_<name>}, a namespace scoped one {@code <namespace>_<name>}.
 *
 * @param scope {@value #ROOT_SCOPE} or the namespace of the RepoSync
 * @param name the RSync name
 */
public record ManagerName(String scope, String name) {

    public static final String ROOT_SCOPE = ":root";
    public static final String DEFAULT_ROOT_SYNC_NAME = "root-sync";
    public static final String DEFAULT_REPO_SYNC_NAME = "repo-sync";
    private static final String ROOT_RECONCILER_PREFIX = "root-reconciler";
    private static final String NS_RECONCILER_PREFIX = "ns-reconciler";
    private static final String SERVICE_ACCOUNT_USER_PREFIX = "system:serviceaccount:";
    private static final char SEPARATOR = '_';

    public ManagerName {
        Objects.requireNonNull(scope);
        Objects.requireNonNull(name);
        if (scope.isEmpty()) {
            throw new IllegalArgumentException("scope must not be empty");
        }
    }

    public static ManagerName root(String name) {
        return new ManagerName(ROOT_SCOPE, name);
    }

    public static ManagerName namespaced(String namespace, String name) {
        return new ManagerName(namespace, name);
    }

    /**
     * Parses a manager annotation value. Namespaces cannot contain {@code _}, so the first separator ends the scope.
     *
     * @param value the annotation value
     * @return the manager
     * @throws IllegalArgumentException if the value is not a manager name
     */
    public static ManagerName parse(String value) {
        Objects.requireNonNull(value);
        int separator = value.indexOf(SEPARATOR);
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("'" + value + "' is not a valid manager name");
        }
        return new ManagerName(value.substring(0, separator), value.substring(separator + 1));
    }

    public boolean isRootScoped() {
        return ROOT_SCOPE.equals(scope);
    }

    /**
     * The name of the reconciler serving this pipeline, which is also the name of its service account.
     * The default RSync of each scope gets the short form.
     *
     * @return {@code root-reconciler[-<name>]} or {@code ns-reconciler-<namespace>[-<name>-<length of name>]}
     */
    public String reconcilerName() {
        if (isRootScoped()) {
            return DEFAULT_ROOT_SYNC_NAME.equals(name) ? ROOT_RECONCILER_PREFIX : ROOT_RECONCILER_PREFIX + "-" + name;
        }
        String prefix = NS_RECONCILER_PREFIX + "-" + scope;
        return DEFAULT_REPO_SYNC_NAME.equals(name) ? prefix : prefix + "-" + name + "-" + name.length();
    }

    /**
     * @param reconcilerNamespace the namespace the reconcilers run in
     * @return the user name the API server reports for writes made by the reconciler serving this pipeline
     */
    public String serviceAccountUser(String reconcilerNamespace) {
        return SERVICE_ACCOUNT_USER_PREFIX + reconcilerNamespace + ":" + reconcilerName();
    }

    /**
     * @return the annotation value
     */
    public String value() {
        return scope + SEPARATOR + name;
    }

    @Override
    public String toString() {
        return value();
    }
}
