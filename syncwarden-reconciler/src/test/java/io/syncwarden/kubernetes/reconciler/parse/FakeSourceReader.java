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

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A source that is checked out at whatever commit the test says, without touching the file system.
 */
final class FakeSourceReader implements SourceReader {

    private static final Path SOURCE_ROOT = Path.of("/repo/source");
    private static final Path HYDRATED_ROOT = Path.of("/repo/hydrated");

    private @Nullable String commit;
    private @Nullable String fetchFailure;
    private @Nullable String renderedCommit;
    private boolean hydrated;
    private List<String> fileNames = List.of("configmap.yaml");
    int listCalls;

    FakeSourceReader checkedOutAt(String commit) {
        this.commit = commit;
        this.fetchFailure = null;
        return this;
    }

    FakeSourceReader failingWith(String message) {
        this.fetchFailure = message;
        return this;
    }

    FakeSourceReader renderedAt(@Nullable String commit) {
        this.renderedCommit = commit;
        this.hydrated = commit != null;
        return this;
    }

    FakeSourceReader withFiles(String... fileNames) {
        this.fileNames = List.of(fileNames);
        return this;
    }

    static Path syncDir(String commit) {
        return SOURCE_ROOT.resolve(commit).resolve("configs");
    }

    @Override
    public SourceRevision readSource() {
        if (fetchFailure != null) {
            throw new SourceFetchException(fetchFailure);
        }
        if (commit == null) {
            throw new SourceFetchException("nothing checked out");
        }
        return new SourceRevision(commit, syncDir(commit));
    }

    @Override
    public Optional<SourceRevision> readHydrated() {
        if (!hydrated || renderedCommit == null) {
            return Optional.empty();
        }
        return Optional.of(new SourceRevision(renderedCommit, HYDRATED_ROOT.resolve(renderedCommit).resolve("configs")));
    }

    @Override
    public Optional<String> renderingDoneCommit() {
        return Optional.ofNullable(renderedCommit);
    }

    @Override
    public List<Path> listConfigFiles(Path syncDir) {
        listCalls++;
        return fileNames.stream().map(syncDir::resolve).toList();
    }
}
