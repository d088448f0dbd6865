/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

/**
 * An object decoded from a manifest file.
 *
 * @param relativePath the file, relative to the sync directory
 * @param object the object
 */
public record ParsedManifest(Path relativePath, GenericKubernetesResource object) {
    public ParsedManifest {
        Objects.requireNonNull(relativePath);
        Objects.requireNonNull(object);
    }
}
