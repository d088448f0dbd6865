/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import io.syncwarden.kubernetes.reconciler.errors.SourceFetchException;

/**
 * Locates the source, and the rendered output of the source, on local disk. Fetching them there is the job of
 * sidecar processes.
 */
public interface SourceReader {

    /**
     * @return the revision of the source currently checked out
     * @throws SourceFetchException if no revision can be resolved
     */
    SourceRevision readSource();

    /**
     * @return the revision of the rendered output, or empty if the source was not rendered at all
     * @throws SourceFetchException if rendered output exists but cannot be resolved
     */
    Optional<SourceRevision> readHydrated();

    /**
     * @return the commit the renderer last finished with, or empty if it has not finished any
     * @throws SourceFetchException if the marker exists but cannot be read
     */
    Optional<String> renderingDoneCommit();

    /**
     * @param syncDir a resolved sync directory
     * @return the manifest files below it, sorted
     * @throws SourceFetchException if the directory cannot be listed
     */
    List<Path> listConfigFiles(Path syncDir);
}
