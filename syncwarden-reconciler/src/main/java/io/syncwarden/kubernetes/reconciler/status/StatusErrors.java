/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.util.List;
import java.util.Objects;

import io.syncwarden.kubernetes.api.v1beta1.ErrorSummary;
import io.syncwarden.kubernetes.api.v1beta1.RSyncError;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Converts reconciler errors to and from their status form and truncates them to fit in an object.
 */
public class StatusErrors {

    public static final int DEFAULT_DENOMINATOR = 1;

    private StatusErrors() {
    }

    /**
     * The errors to write, together with a summary of what was dropped.
     *
     * @param errors the retained errors
     * @param summary the summary
     */
    public record Truncated(List<RSyncError> errors, ErrorSummary summary) {
        public Truncated {
            Objects.requireNonNull(errors);
            Objects.requireNonNull(summary);
        }
    }

    /**
     * Keeps the first {@code errors.size() / denominator} errors. A denominator of 1 keeps all of them; each
     * rejected write doubles the denominator so the retained list halves until the object fits.
     *
     * @param errors all errors
     * @param denominator a positive divisor
     * @return the retained errors and their summary
     * @throws IllegalArgumentException if the denominator is not positive
     */
    public static Truncated truncate(List<ReconcilerError> errors, int denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("The denominator must be a positive number");
        }
        int total = errors.size();
        int kept = total / denominator;
        var retained = errors.subList(0, kept).stream().map(StatusErrors::toRSyncError).toList();
        var summary = new ErrorSummary();
        summary.setTotalCount(total);
        summary.setTruncated(kept < total);
        summary.setErrorCountAfterTruncation(kept);
        return new Truncated(retained, summary);
    }

    public static RSyncError toRSyncError(ReconcilerError error) {
        var rsyncError = new RSyncError();
        rsyncError.setCode(error.code());
        rsyncError.setErrorMessage(error.message());
        return rsyncError;
    }

    public static ReconcilerError fromRSyncError(RSyncError error) {
        return ReconcilerError.of(ErrorKind.fromCode(String.valueOf(error.getCode())), String.valueOf(error.getErrorMessage()));
    }

    public static List<ReconcilerError> fromRSyncErrors(List<RSyncError> errors) {
        return errors == null ? List.of() : errors.stream().map(StatusErrors::fromRSyncError).toList();
    }

    /**
     * Errors read back from the cluster have lost their resource and cause, so errors are compared by what the
     * status shows: code and message, in order.
     *
     * @param a some errors
     * @param b other errors
     * @return true if both would be written identically
     */
    public static boolean sameErrors(List<ReconcilerError> a, List<ReconcilerError> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            ReconcilerError x = a.get(i);
            ReconcilerError y = b.get(i);
            if (!x.code().equals(y.code()) || !x.message().equals(y.message())) {
                return false;
            }
        }
        return true;
    }
}
