/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Publishes an event every {@code period}. When {@code delayOnRunAttempt} is set, a run started by any other
 * event pushes the next event back by a whole period, since that run did what this event would have done.
 */
public class PeriodicPublisher implements Publisher {

    private final EventType type;
    private final Duration period;
    private final boolean delayOnRunAttempt;
    private Instant nextDue;

    public PeriodicPublisher(EventType type, Duration period, boolean delayOnRunAttempt, Instant start) {
        this.type = Objects.requireNonNull(type);
        this.period = Objects.requireNonNull(period);
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive, but was " + period);
        }
        this.delayOnRunAttempt = delayOnRunAttempt;
        this.nextDue = start.plus(period);
    }

    @Override
    public EventType type() {
        return type;
    }

    @Override
    public synchronized Instant nextDue() {
        return nextDue;
    }

    @Override
    public synchronized Event publish(Instant now) {
        nextDue = now.plus(period);
        return new Event(type);
    }

    @Override
    public synchronized void handleResult(EventResult result, Instant now) {
        if (delayOnRunAttempt && result.runAttempted()) {
            nextDue = now.plus(period);
        }
    }

    @Override
    public String toString() {
        return "PeriodicPublisher[" + type + ", " + period + "]";
    }
}
