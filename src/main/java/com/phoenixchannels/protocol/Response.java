/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable decoded inbound message.
 *
 * @param joinRef join session the message belongs to, or null for broadcasts
 * @param ref     correlation ref, empty when the server sent none
 * @param topic   channel topic
 * @param event   event name
 * @param payload message body
 */
public record Response(String joinRef, Ref ref, String topic, String event, Map<String, Object> payload) {

    public Response {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(event, "event");
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Reply status carried by {@code phx_reply} payloads.
     *
     * @return status string, or null when absent or not a string
     */
    public String status() {
        Object status = payload.get("status");
        return status instanceof String ? (String) status : null;
    }
}
