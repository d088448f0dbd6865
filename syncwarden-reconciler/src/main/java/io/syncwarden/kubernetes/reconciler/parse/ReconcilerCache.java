/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * What the control loop remembers about the source between runs, so a run can skip the steps whose inputs have
 * not changed. Owned by {@link ReconcilerState}; not thread safe.
 */
public class ReconcilerCache {

    private @Nullable SourceState source;
    private List<HasMetadata> objects = List.of();
    private List<ReconcilerError> parserErrors = List.of();
    private boolean parserResultUpToDate;
    private boolean needToRetry;

    /**
     * @return the last source read successfully, or null if there is none
     */
    public @Nullable SourceState source() {
        return source;
    }

    void source(SourceState source) {
        this.source = source;
    }

    /**
     * @return the objects of the last parse, ready to apply
     */
    public List<HasMetadata> objects() {
        return objects;
    }

    public List<ReconcilerError> parserErrors() {
        return parserErrors;
    }

    void setParserResult(List<HasMetadata> objects, List<ReconcilerError> errors) {
        this.objects = List.copyOf(objects);
        this.parserErrors = List.copyOf(errors);
        this.parserResultUpToDate = true;
    }

    /**
     * @return true if the objects reflect the cached source, so parsing can be skipped
     */
    public boolean parserResultUpToDate() {
        return parserResultUpToDate;
    }

    public boolean needToRetry() {
        return needToRetry;
    }

    void needToRetry(boolean needToRetry) {
        this.needToRetry = needToRetry;
    }

    /**
     * Forgets everything, so every step of the next run executes.
     */
    void reset() {
        source = null;
        objects = List.of();
        parserErrors = List.of();
        parserResultUpToDate = false;
        needToRetry = false;
    }

    /**
     * Forgets the parse result but keeps the source and the retry flag, so the next run re-parses and re-applies
     * without re-reading the files.
     */
    void resetPartial() {
        objects = List.of();
        parserErrors = List.of();
        parserResultUpToDate = false;
    }
}
