/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.errors;

/**
 * Classifies every error the reconciler reports. The kind decides which status stage the error is reported
 * in, whether the control loop retries it and whether it prevents objects from being applied.
 */
public enum ErrorKind {

    /** The source could not be read: unreachable, corrupt or not yet synced to disk. */
    FETCH("2004"),
    /** A manifest could not be decoded into an object. */
    PARSE("1006"),
    /** A decoded object is not acceptable to this pipeline. */
    VALIDATION("1021"),
    /** Rendering of the source failed or its configuration does not match the source. */
    RENDERING("1068"),
    /** A managed object could not be created, updated or deleted. */
    OBJECT_OPERATION("2009"),
    /** A managed object exists but has not reached a ready state yet. */
    OBJECT_RECONCILE("2010"),
    /** The RSync status could not be persisted. */
    STATUS_UPDATE("2008"),
    /** Any other API server failure. */
    API_SERVER("2002"),
    /** Another pipeline manages an object this pipeline declares. */
    MANAGEMENT_CONFLICT("1060"),
    /** An object is being rewritten by another actor at high frequency. */
    FIGHT("2005"),
    INTERNAL("9998");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    /**
     * @return the stable error code written to the status
     */
    public String code() {
        return code;
    }

    /**
     * @param code a code read back from a status
     * @return the kind with that code, {@link #INTERNAL} if the code is unknown
     */
    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        return INTERNAL;
    }

    /**
     * @return the status stage errors of this kind are reported under
     */
    public Stage stage() {
        return switch (this) {
            case FETCH, PARSE, VALIDATION -> Stage.SOURCE;
            case RENDERING -> Stage.RENDERING;
            default -> Stage.SYNC;
        };
    }

    /**
     * Parse and validation errors need a new commit to be fixed, so retrying without one is pointless; they are
     * re-checked on every reimport instead. Object reconcile errors resolve themselves and are waited on through
     * the next watch event.
     *
     * @return true if the control loop should schedule a retry for errors of this kind
     */
    public boolean isRetriable() {
        return switch (this) {
            case PARSE, VALIDATION, RENDERING, OBJECT_RECONCILE, FIGHT -> false;
            case FETCH, OBJECT_OPERATION, STATUS_UPDATE, API_SERVER, MANAGEMENT_CONFLICT, INTERNAL -> true;
        };
    }

    /**
     * @return true if an error of this kind means the parsed objects must not be handed to the applier
     */
    public boolean blocksApply() {
        return stage() != Stage.SYNC;
    }

    /**
     * The three independently written stages of RSync status.
     */
    public enum Stage {
        SOURCE,
        RENDERING,
        SYNC
    }
}
