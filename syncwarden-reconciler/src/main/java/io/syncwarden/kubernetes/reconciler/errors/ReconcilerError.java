/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.errors;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.ResourcesUtil;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A classified error. Errors are values: they are collected, compared and written into RSync status rather than
 * thrown. Two errors are equal when their kind, message and resource are equal; the cause is carried for logging
 * only.
 *
 * @param kind the classification
 * @param message the message as reported in status
 * @param resource the identity of the object the error concerns, if any
 * @param cause the underlying exception, if any
 */
public record ReconcilerError(ErrorKind kind,
                              String message,
                              @Nullable String resource,
                              @Nullable Throwable cause) {

    public ReconcilerError {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(message);
    }

    public static ReconcilerError of(ErrorKind kind, String message) {
        return new ReconcilerError(kind, message, null, null);
    }

    public static ReconcilerError of(ErrorKind kind, String message, Throwable cause) {
        return new ReconcilerError(kind, message, null, cause);
    }

    /**
     * @param kind the classification
     * @param object the object the error concerns
     * @param message what went wrong
     * @return an error whose message names the object
     */
    public static ReconcilerError forObject(ErrorKind kind, HasMetadata object, String message) {
        String resource = ResourcesUtil.describe(object);
        return new ReconcilerError(kind, message + " for " + resource, resource, null);
    }

    public static ReconcilerError forObject(ErrorKind kind, HasMetadata object, Throwable cause) {
        String resource = ResourcesUtil.describe(object);
        return new ReconcilerError(kind, String.valueOf(cause.getMessage()) + " for " + resource, resource, cause);
    }

    /**
     * @param stage the stage the error surfaced in
     * @return a copy whose message is prefixed with {@code "<stage>: "}
     */
    public ReconcilerError wrap(String stage) {
        return new ReconcilerError(kind, stage + ": " + message, resource, cause);
    }

    public String code() {
        return kind.code();
    }

    public boolean isRetriable() {
        return kind.isRetriable();
    }

    public static boolean anyBlocksApply(Collection<ReconcilerError> errors) {
        return errors.stream().anyMatch(e -> e.kind().blocksApply());
    }

    public static boolean anyRetriable(Collection<ReconcilerError> errors) {
        return errors.stream().anyMatch(ReconcilerError::isRetriable);
    }

    public static List<ReconcilerError> ofKind(Collection<ReconcilerError> errors, ErrorKind.Stage stage) {
        return errors.stream().filter(e -> e.kind().stage() == stage).toList();
    }

    /**
     * @param errors errors
     * @return the messages joined for a single log line
     */
    public static String summarize(Collection<ReconcilerError> errors) {
        return errors.stream().map(e -> "[" + e.code() + "] " + e.message()).collect(Collectors.joining("; "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReconcilerError that)) {
            return false;
        }
        return kind == that.kind && message.equals(that.message) && Objects.equals(resource, that.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, resource);
    }

    @Override
    public String toString() {
        return "ReconcilerError[" + kind + " " + code() + ": " + message + "]";
    }
}
