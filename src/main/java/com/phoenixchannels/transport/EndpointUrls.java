/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Endpoint URI helpers.
 */
public final class EndpointUrls {

    private EndpointUrls() {}

    /**
     * Appends URL-encoded query parameters to an endpoint, keeping any query it already has.
     *
     * @param endpoint ws:// or wss:// endpoint
     * @param params   parameters to append (may be null or empty)
     * @return endpoint URI
     * @throws IllegalArgumentException if the endpoint is not a valid WebSocket URI
     */
    public static URI build(String endpoint, Map<String, String> params) {
        URI base = URI.create(endpoint);
        String scheme = base.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported endpoint scheme: " + endpoint);
        }
        if (base.getHost() == null) {
            throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
        }
        if (params == null || params.isEmpty()) {
            return base;
        }

        StringBuilder url = new StringBuilder(endpoint);
        boolean first = base.getRawQuery() == null || base.getRawQuery().isEmpty();
        if (first && endpoint.endsWith("?")) {
            url.setLength(url.length() - 1);
        }
        for (Map.Entry<String, String> param : params.entrySet()) {
            url.append(first ? '?' : '&');
            first = false;
            url.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8));
            url.append('=');
            url.append(URLEncoder.encode(param.getValue() == null ? "" : param.getValue(), StandardCharsets.UTF_8));
        }
        return URI.create(url.toString());
    }

    /** Effective port, defaulting to 443 for wss and 80 for ws. */
    public static int port(URI uri) {
        if (uri.getPort() != -1) return uri.getPort();
        return isSecure(uri) ? 443 : 80;
    }

    public static boolean isSecure(URI uri) {
        return "wss".equalsIgnoreCase(uri.getScheme());
    }
}
