/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.management;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnsupportedHttpMethodFilterTest {

    @Mock
    private HttpExchange exchange;

    @Mock
    private Headers responseHeaders;

    @Mock
    private Filter.Chain chain;

    @ParameterizedTest
    @ValueSource(strings = { "GET", "get" })
    void passesReadsDownTheChain(String method) throws IOException {
        // Given
        when(exchange.getRequestMethod()).thenReturn(method);

        // When
        UnsupportedHttpMethodFilter.INSTANCE.doFilter(exchange, chain);

        // Then
        verify(chain).doFilter(exchange);
        verify(exchange, never()).sendResponseHeaders(any(int.class), any(long.class));
    }

    @ParameterizedTest
    @ValueSource(strings = { "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS", "TRACE", "CONNECT" })
    void answersOtherMethodsWithMethodNotAllowed(String method) throws IOException {
        // Given
        when(exchange.getRequestMethod()).thenReturn(method);
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        UnsupportedHttpMethodFilter.INSTANCE.doFilter(exchange, chain);

        // Then
        InOrder order = inOrder(responseHeaders, exchange);
        order.verify(responseHeaders).add("Allow", "GET");
        order.verify(exchange).sendResponseHeaders(405, -1);
        order.verify(exchange).close();
        verify(chain, never()).doFilter(any(HttpExchange.class));
    }

    @Test
    void describesItself() {
        assertThat(UnsupportedHttpMethodFilter.INSTANCE.description()).isEqualTo("Rejects methods other than GET");
    }
}
