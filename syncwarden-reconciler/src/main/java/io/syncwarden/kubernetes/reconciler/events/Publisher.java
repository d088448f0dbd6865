/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Instant;

/**
 * A timed source of events. The {@link Funnel} asks every publisher when it is next due, publishes the
 * earliest, and then reports the outcome back to all of them.
 */
public interface Publisher {

    EventType type();

    /**
     * @return when the next event is due, {@link Instant#MAX} if none is scheduled
     */
    Instant nextDue();

    /**
     * Emits the due event and schedules the next one.
     *
     * @param now the current time
     * @return the event
     */
    Event publish(Instant now);

    /**
     * @param result the outcome of handling an event, from any publisher
     * @param now the current time
     */
    void handleResult(EventResult result, Instant now);
}
