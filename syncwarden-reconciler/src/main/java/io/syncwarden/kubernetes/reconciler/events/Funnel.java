/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.tag.RunsOnThread;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Serializes the events of several {@link Publisher}s into a single thread, handing them one at a time to a
 * {@link Subscriber}. The publisher whose event is due first goes next; ties go to the publisher listed first.
 * After each event the subscriber's {@link EventResult} is given to every publisher, so that they can reschedule.</p>
 *
 * <p>{@link #stop()} lets the event being handled finish; no further event is published after it.</p>
 */
public class Funnel implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Funnel.class);
    static final String THREAD_NAME = "syncwarden-funnel";

    // bounds each wait, so a publisher rescheduled by handleResult is noticed
    private static final Duration MAX_IDLE = Duration.ofSeconds(1);

    private final List<Publisher> publishers;
    private final Subscriber subscriber;
    private final Clock clock;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private @Nullable Thread thread;

    public Funnel(List<Publisher> publishers, Subscriber subscriber, Clock clock) {
        if (publishers.isEmpty()) {
            throw new IllegalArgumentException("at least one publisher is required");
        }
        this.publishers = List.copyOf(publishers);
        this.subscriber = Objects.requireNonNull(subscriber);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Starts the funnel thread.
     *
     * @return a future completing once the funnel thread has exited
     */
    public synchronized CompletableFuture<Void> start() {
        if (thread != null) {
            throw new IllegalStateException("funnel already started");
        }
        thread = new Thread(this::loop, THREAD_NAME);
        thread.start();
        LOGGER.info("Funnel started with publishers {}", publishers);
        return done;
    }

    @RunsOnThread(THREAD_NAME)
    private void loop() {
        try {
            while (!isStopped()) {
                Instant now = clock.instant();
                Publisher next = nextPublisher();
                Instant due = next.nextDue();
                if (due.isAfter(now)) {
                    Duration wait = due.isAfter(now.plus(MAX_IDLE)) ? MAX_IDLE : Duration.between(now, due);
                    if (stopSignal.await(wait.toNanos(), TimeUnit.NANOSECONDS)) {
                        break;
                    }
                }
                else {
                    dispatch(next, now);
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Funnel interrupted");
        }
        finally {
            LOGGER.info("Funnel stopped");
            done.complete(null);
        }
    }

    /**
     * Publishes and handles the earliest event, if it is due.
     *
     * @param now the current time
     * @return true if an event was handled
     */
    @VisibleForTesting
    boolean runOnce(Instant now) {
        Publisher next = nextPublisher();
        if (next.nextDue().isAfter(now)) {
            return false;
        }
        dispatch(next, now);
        return true;
    }

    private Publisher nextPublisher() {
        return publishers.stream()
                .min(Comparator.comparing(Publisher::nextDue))
                .orElseThrow();
    }

    private void dispatch(Publisher publisher, Instant now) {
        Event event = publisher.publish(now);
        LOGGER.debug("Handling {} event", event.type());
        EventResult result;
        try {
            result = subscriber.handle(event);
        }
        catch (RuntimeException e) {
            LOGGER.error("Unexpected failure handling {} event", event.type(), e);
            result = EventResult.NONE;
        }
        Instant handled = clock.instant();
        for (Publisher p : publishers) {
            p.handleResult(result, handled);
        }
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Stops publishing. Returns at once; use the future returned by {@link #start()} to wait for the event being
     * handled to finish.
     */
    public void stop() {
        stopSignal.countDown();
    }

    /**
     * Stops publishing and waits for the funnel thread to exit.
     */
    @Override
    public void close() {
        stop();
        synchronized (this) {
            if (thread == null) {
                return;
            }
        }
        done.join();
    }
}
