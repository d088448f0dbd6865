/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.events;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodicPublisherTest {

    private static final Instant T0 = Instant.EPOCH;
    private static final Duration PERIOD = Duration.ofSeconds(10);

    @Test
    void firstEventIsDueAfterOnePeriod() {
        var publisher = new PeriodicPublisher(EventType.SYNC, PERIOD, false, T0);
        assertThat(publisher.nextDue()).isEqualTo(T0.plus(PERIOD));
        assertThat(publisher.type()).isEqualTo(EventType.SYNC);
    }

    @Test
    void publishingSchedulesNextPeriod() {
        // Given
        var publisher = new PeriodicPublisher(EventType.SYNC, PERIOD, false, T0);

        // When
        Event event = publisher.publish(T0.plusSeconds(12));

        // Then
        assertThat(event.type()).isEqualTo(EventType.SYNC);
        assertThat(publisher.nextDue()).isEqualTo(T0.plusSeconds(22));
    }

    @Test
    void runAttemptDelaysWhenConfigured() {
        // Given
        var publisher = new PeriodicPublisher(EventType.STATUS_UPDATE, PERIOD, true, T0);

        // When
        publisher.handleResult(new EventResult(true, false, false), T0.plusSeconds(5));

        // Then
        assertThat(publisher.nextDue()).isEqualTo(T0.plusSeconds(15));
    }

    @Test
    void runAttemptIgnoredWhenNotConfigured() {
        // Given
        var publisher = new PeriodicPublisher(EventType.SYNC_WITH_REIMPORT, PERIOD, false, T0);

        // When
        publisher.handleResult(new EventResult(true, true, false), T0.plusSeconds(5));

        // Then
        assertThat(publisher.nextDue()).isEqualTo(T0.plus(PERIOD));
    }

    @Test
    void noRunLeavesScheduleAlone() {
        var publisher = new PeriodicPublisher(EventType.SYNC, PERIOD, true, T0);
        publisher.handleResult(EventResult.NONE, T0.plusSeconds(5));
        assertThat(publisher.nextDue()).isEqualTo(T0.plus(PERIOD));
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThatThrownBy(() -> new PeriodicPublisher(EventType.SYNC, Duration.ZERO, false, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
