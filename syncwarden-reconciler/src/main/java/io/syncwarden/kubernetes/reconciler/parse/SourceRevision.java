/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A resolved revision of the source on disk.
 *
 * @param commit the commit, image digest or {@code chart:version}
 * @param syncDir the absolute directory holding the manifests of that revision
 */
public record SourceRevision(String commit, Path syncDir) {
    public SourceRevision {
        Objects.requireNonNull(commit);
        Objects.requireNonNull(syncDir);
    }
}
