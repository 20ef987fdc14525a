/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.unit.transport;

import com.phoenixchannels.transport.EndpointUrls;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Endpoint URLs")
class EndpointUrlsTest {

    @Test
    @DisplayName("Should return the endpoint unchanged without params")
    void shouldKeepEndpointWithoutParams() {
        URI uri = EndpointUrls.build("ws://localhost:4000/socket/websocket", Map.of());

        assertEquals("ws://localhost:4000/socket/websocket", uri.toString());
        assertEquals(4000, EndpointUrls.port(uri));
        assertFalse(EndpointUrls.isSecure(uri));
    }

    @Test
    @DisplayName("Should append encoded params in order")
    void shouldAppendEncodedParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("token", "a b&c");
        params.put("vsn", "2.0.0");

        URI uri = EndpointUrls.build("wss://example.com/socket/websocket", params);

        assertEquals("wss://example.com/socket/websocket?token=a+b%26c&vsn=2.0.0", uri.toString());
        assertEquals(443, EndpointUrls.port(uri));
        assertTrue(EndpointUrls.isSecure(uri));
    }

    @Test
    @DisplayName("Should extend an existing query")
    void shouldExtendExistingQuery() {
        URI uri = EndpointUrls.build("ws://example.com/socket/websocket?vsn=2.0.0", Map.of("token", "t"));

        assertEquals("ws://example.com/socket/websocket?vsn=2.0.0&token=t", uri.toString());
        assertEquals(80, EndpointUrls.port(uri));
    }

    @Test
    @DisplayName("Should reject non-WebSocket endpoints")
    void shouldRejectBadEndpoints() {
        assertThrows(IllegalArgumentException.class,
                () -> EndpointUrls.build("http://example.com/socket", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> EndpointUrls.build("ws:///socket", Map.of()));
    }
}
