/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.syncwarden.kubernetes.api.v1beta1.ErrorSummary;
import io.syncwarden.kubernetes.api.v1beta1.RSyncCondition;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Maintains the {@code Syncing} condition of an RSync.
 */
class SyncingConditions {

    static final String TRUE = "True";
    static final String FALSE = "False";

    private SyncingConditions() {
    }

    /**
     * Sets the {@code Syncing} condition, creating it if needed. The transition time only moves when the condition
     * status flips.
     */
    static void setSyncing(RSyncStatus status,
                           boolean syncing,
                           String reason,
                           String message,
                           String commit,
                           @Nullable ErrorSummary errorSummary,
                           Instant timestamp) {
        List<RSyncCondition> conditions = status.getConditions() == null ? new ArrayList<>() : new ArrayList<>(status.getConditions());
        RSyncCondition condition = conditions.stream()
                .filter(c -> ReconcilerStatus.SYNCING_CONDITION_TYPE.equals(c.getType()))
                .findFirst()
                .orElse(null);
        String conditionStatus = syncing ? TRUE : FALSE;
        if (condition == null) {
            condition = new RSyncCondition();
            condition.setType(ReconcilerStatus.SYNCING_CONDITION_TYPE);
            conditions.add(condition);
        }
        if (!conditionStatus.equals(condition.getStatus())) {
            condition.setLastTransitionTime(timestamp);
        }
        condition.setStatus(conditionStatus);
        condition.setLastUpdateTime(timestamp);
        condition.setReason(reason);
        condition.setMessage(message);
        condition.setCommit(commit);
        condition.setErrors(null);
        condition.setErrorSummary(errorSummary != null && totalCount(errorSummary) > 0 ? errorSummary : null);
        status.setConditions(conditions);
    }

    /**
     * Adds up the errors of every stage that reported on the given commit.
     */
    static ErrorSummary summarizeErrorsForCommit(RSyncStatus status, String commit) {
        int total = 0;
        int afterTruncation = 0;
        boolean truncated = false;
        for (RSyncStageStatus stage : new RSyncStageStatus[]{ status.getSource(), status.getRendering(), status.getSync() }) {
            if (stage == null || !Objects.equals(commit, stage.getCommit()) || stage.getErrorSummary() == null) {
                continue;
            }
            ErrorSummary summary = stage.getErrorSummary();
            total += totalCount(summary);
            afterTruncation += summary.getErrorCountAfterTruncation() == null ? 0 : summary.getErrorCountAfterTruncation();
            truncated |= Boolean.TRUE.equals(summary.getTruncated());
        }
        var summary = new ErrorSummary();
        summary.setTotalCount(total);
        summary.setTruncated(truncated);
        summary.setErrorCountAfterTruncation(afterTruncation);
        return summary;
    }

    static int totalCount(@Nullable ErrorSummary summary) {
        return summary == null || summary.getTotalCount() == null ? 0 : summary.getTotalCount();
    }
}
