/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.management;

import java.io.IOException;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Rejects every request to the management server that is not a {@code GET} with
 * <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>. The
 * management endpoints are read only.
 */
public class UnsupportedHttpMethodFilter extends Filter {

    public static final Filter INSTANCE = new UnsupportedHttpMethodFilter();

    private static final String ALLOWED_METHOD = "GET";

    private UnsupportedHttpMethodFilter() {
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (ALLOWED_METHOD.equalsIgnoreCase(exchange.getRequestMethod())) {
            chain.doFilter(exchange);
            return;
        }
        try (exchange) {
            // the request body is never read: only bodiless GETs are expected
            exchange.getResponseHeaders().add("Allow", ALLOWED_METHOD);
            exchange.sendResponseHeaders(405, -1);
        }
    }

    @Override
    public String description() {
        return "Rejects methods other than " + ALLOWED_METHOD;
    }
}
