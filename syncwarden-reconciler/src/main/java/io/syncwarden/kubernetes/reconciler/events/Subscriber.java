/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

/**
 * Handles the events published through a {@link Funnel}, one at a time.
 */
@FunctionalInterface
public interface Subscriber {

    EventResult handle(Event event);
}
