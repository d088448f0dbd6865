/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

/**
 * Decodes the manifest files of a source into objects.
 */
@FunctionalInterface
public interface ManifestParser {

    /**
     * @param source the source, with its files listed
     * @return the decoded objects and any decoding errors
     */
    ParseResult parse(SourceState source);
}
