/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.backoff.BackoffStrategy;

/**
 * <p>Publishes {@link EventType#RETRY_SYNC} events. While nothing fails they come at the backoff's initial delay,
 * which is cheap because the handler only runs when something needs retrying.</p>
 *
 * <p>Each result with {@link EventResult#triggerRetryBackoff()} moves the next event one backoff step further
 * away. Once the backoff's step limit is used up no more retries are published until a result with
 * {@link EventResult#resetRetryBackoff()} arrives, which happens when a run succeeds or the source changes. The
 * total time spent retrying is not limited.</p>
 */
public class RetryPublisher implements Publisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPublisher.class);

    private final BackoffStrategy backoff;
    private int failures;
    private Instant nextDue;

    public RetryPublisher(BackoffStrategy backoff, Instant start) {
        this.backoff = Objects.requireNonNull(backoff);
        this.nextDue = start.plus(backoff.getDelay(1));
    }

    @Override
    public EventType type() {
        return EventType.RETRY_SYNC;
    }

    @Override
    public synchronized Instant nextDue() {
        return nextDue;
    }

    @Override
    public synchronized Event publish(Instant now) {
        nextDue = schedule(now);
        return new Event(EventType.RETRY_SYNC);
    }

    @Override
    public synchronized void handleResult(EventResult result, Instant now) {
        if (result.resetRetryBackoff()) {
            if (failures > 0) {
                LOGGER.debug("Resetting the retry backoff after {} retries", failures);
            }
            failures = 0;
            nextDue = schedule(now);
        }
        else if (result.triggerRetryBackoff()) {
            failures++;
            nextDue = schedule(now);
            if (nextDue.equals(Instant.MAX)) {
                LOGGER.warn("Giving up retrying after {} attempts, waiting for the next sync", failures);
            }
        }
    }

    private Instant schedule(Instant now) {
        if (failures >= backoff.stepLimit()) {
            return Instant.MAX;
        }
        return now.plus(backoff.getDelay(failures + 1));
    }

    synchronized int failures() {
        return failures;
    }

    @Override
    public String toString() {
        return "RetryPublisher[failures=" + failures + "]";
    }
}
