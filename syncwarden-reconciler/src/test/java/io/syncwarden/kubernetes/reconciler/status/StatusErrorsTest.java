/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import io.syncwarden.kubernetes.api.v1beta1.RSyncError;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusErrorsTest {

    private static List<ReconcilerError> errors(int count) {
        return IntStream.range(0, count).mapToObj(i -> ReconcilerError.of(ErrorKind.OBJECT_OPERATION, "error " + i)).toList();
    }

    @ParameterizedTest
    @CsvSource({
            "8, 1, 8, false",
            "8, 2, 4, true",
            "8, 4, 2, true",
            "8, 8, 1, true",
            "8, 16, 0, true",
            "0, 1, 0, false",
            "5, 2, 2, true"
    })
    void truncateKeepsLeadingFraction(int total, int denominator, int kept, boolean truncated) {
        // When
        StatusErrors.Truncated result = StatusErrors.truncate(errors(total), denominator);

        // Then
        assertThat(result.errors()).hasSize(kept);
        assertThat(result.summary().getTotalCount()).isEqualTo(total);
        assertThat(result.summary().getErrorCountAfterTruncation()).isEqualTo(kept);
        assertThat(result.summary().getTruncated()).isEqualTo(truncated);
        if (kept > 0) {
            assertThat(result.errors().get(0).getErrorMessage()).isEqualTo("error 0");
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    void truncateRejectsNonPositiveDenominator(int denominator) {
        assertThatThrownBy(() -> StatusErrors.truncate(errors(1), denominator))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("The denominator must be a positive number");
    }

    @Test
    void statusFormRoundTripsCodeAndMessage() {
        // Given
        var error = ReconcilerError.of(ErrorKind.MANAGEMENT_CONFLICT, "conflict");

        // When
        RSyncError rsyncError = StatusErrors.toRSyncError(error);

        // Then
        assertThat(rsyncError.getCode()).isEqualTo("1060");
        assertThat(StatusErrors.fromRSyncError(rsyncError)).isEqualTo(error);
    }

    @Test
    void fromNullListIsEmpty() {
        assertThat(StatusErrors.fromRSyncErrors(null)).isEmpty();
    }

    @Test
    void sameErrorsComparesCodeAndMessageInOrder() {
        var a = ReconcilerError.of(ErrorKind.FETCH, "a");
        var b = ReconcilerError.of(ErrorKind.PARSE, "b");
        var aWithResource = new ReconcilerError(ErrorKind.FETCH, "a", "ConfigMap ns/cm", null);
        assertThat(StatusErrors.sameErrors(List.of(a, b), List.of(aWithResource, b))).isTrue();
        assertThat(StatusErrors.sameErrors(List.of(a, b), List.of(b, a))).isFalse();
        assertThat(StatusErrors.sameErrors(List.of(a), List.of(a, b))).isFalse();
    }
}
