/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Delays that grow by a constant factor with each failure, with up to {@code jitter} of the delay added at random.
 * The step count may be capped; the delay itself is only capped when a maximum is given, so a retry loop using the
 * main sync backoff keeps going for as long as it takes.
 */
public class ExponentialBackoff implements BackoffStrategy {

    /** Sync retries stop after this many consecutive failures, until a success or a new commit resets them. */
    public static final int SYNC_RETRY_STEP_LIMIT = 12;

    private final Duration initialDelay;
    private final @Nullable Duration maximumDelay;
    private final double multiplier;
    private final double jitter;
    private final int stepLimit;
    private final Random random;

    public ExponentialBackoff(Duration initialDelay,
                              @Nullable Duration maximumDelay,
                              double multiplier,
                              double jitter,
                              int stepLimit,
                              Random random) {
        this.initialDelay = Objects.requireNonNull(initialDelay);
        this.maximumDelay = maximumDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.stepLimit = stepLimit;
        this.random = Objects.requireNonNull(random);
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier should not reduce the initial delay");
        }
        if (jitter < 0.0) {
            throw new IllegalArgumentException("jitter must not be negative");
        }
        if (stepLimit < 1) {
            throw new IllegalArgumentException("stepLimit must be positive");
        }
    }

    /**
     * The backoff used between sync retries: doubling from the retry period, 10% jitter,
     * {@value #SYNC_RETRY_STEP_LIMIT} steps and no maximum delay.
     *
     * @param retryPeriod the first delay
     * @return the backoff
     */
    public static ExponentialBackoff forSyncRetries(Duration retryPeriod) {
        return new ExponentialBackoff(retryPeriod, null, 2.0, 0.1, SYNC_RETRY_STEP_LIMIT, new Random());
    }

    @Override
    public Duration getDelay(int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must not be negative");
        }
        if (failures == 0) {
            return Duration.ZERO;
        }
        Duration backoff = exponentialBackoff(failures);
        if (jitter > 0.0) {
            backoff = backoff.plusMillis((long) (backoff.toMillis() * jitter * random.nextDouble()));
        }
        if (maximumDelay != null && backoff.compareTo(maximumDelay) > 0) {
            return maximumDelay;
        }
        return backoff;
    }

    private Duration exponentialBackoff(int failures) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failures - 1.0);
        // saturate rather than overflow once the step limit is lifted
        return Duration.ofMillis(millis >= Long.MAX_VALUE / 2.0 ? Long.MAX_VALUE / 2 : (long) millis);
    }

    @Override
    public int stepLimit() {
        return stepLimit;
    }
}
