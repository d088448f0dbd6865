/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.syncwarden.kubernetes.reconciler.backoff.BackoffStrategy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds the publishers driving a reconciler.
 */
public final class PublisherGroup {

    private PublisherGroup() {
    }

    /**
     * @param clock the clock the funnel runs on
     * @param syncPeriod how often the source is polled for a new commit
     * @param resyncPeriod how often everything is reapplied from scratch
     * @param statusUpdatePeriod how often the sync status is refreshed between runs
     * @param namespaceResyncPeriod how often the namespace controller is checked, null if it is not running
     * @param retryBackoff the backoff between retries of a failed run
     * @return the publishers
     */
    public static List<Publisher> build(Clock clock,
                                        Duration syncPeriod,
                                        Duration resyncPeriod,
                                        Duration statusUpdatePeriod,
                                        @Nullable Duration namespaceResyncPeriod,
                                        BackoffStrategy retryBackoff) {
        Instant start = clock.instant();
        var publishers = new ArrayList<Publisher>();
        publishers.add(new PeriodicPublisher(EventType.SYNC_WITH_REIMPORT, resyncPeriod, false, start));
        // the first sync is due at once
        publishers.add(new PeriodicPublisher(EventType.SYNC, syncPeriod, true, start.minus(syncPeriod)));
        if (namespaceResyncPeriod != null) {
            publishers.add(new PeriodicPublisher(EventType.NAMESPACE_RESYNC, namespaceResyncPeriod, false, start));
        }
        publishers.add(new RetryPublisher(retryBackoff, start));
        publishers.add(new PeriodicPublisher(EventType.STATUS_UPDATE, statusUpdatePeriod, true, start));
        return publishers;
    }
}
