/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

/**
 * What handling an {@link Event} did, fed back to every {@link Publisher}.
 *
 * @param runAttempted true if a run was started
 * @param resetRetryBackoff true if retries should start again from the initial delay
 * @param triggerRetryBackoff true if the next retry should wait for the next backoff step
 */
public record EventResult(boolean runAttempted, boolean resetRetryBackoff, boolean triggerRetryBackoff) {

    public static final EventResult NONE = new EventResult(false, false, false);
}
