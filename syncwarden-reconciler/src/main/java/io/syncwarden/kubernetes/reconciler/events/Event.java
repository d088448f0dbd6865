/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.util.Objects;

/**
 * An event handed by the {@link Funnel} to its {@link Subscriber}.
 *
 * @param type the event type
 */
public record Event(EventType type) {

    public Event {
        Objects.requireNonNull(type);
    }
}
