/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.syncwarden.kubernetes.reconciler.status.SourceSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A revision of the source together with the manifest files read from it.
 *
 * @param spec the configured source
 * @param commit the resolved commit
 * @param syncDir the resolved sync directory
 * @param files the manifest files, empty until they have been listed
 */
public record SourceState(@Nullable SourceSpec spec, String commit, Path syncDir, List<Path> files) {

    private static final Set<String> KUSTOMIZATION_FILE_NAMES = Set.of("kustomization.yaml", "kustomization.yml", "Kustomization");

    public SourceState {
        Objects.requireNonNull(commit);
        Objects.requireNonNull(syncDir);
        files = List.copyOf(files);
    }

    public SourceState withFiles(List<Path> files) {
        return new SourceState(spec, commit, syncDir, files);
    }

    /**
     * @return true if any of the files is a Kustomize configuration, meaning the source must be rendered
     */
    public boolean hasKustomization() {
        return files.stream()
                .map(Path::getFileName)
                .filter(Objects::nonNull)
                .anyMatch(name -> KUSTOMIZATION_FILE_NAMES.contains(name.toString()));
    }
}
