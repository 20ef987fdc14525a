/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

/**
 * Thrown when a push payload cannot be serialized to the wire format.
 */
public class InvalidPayloadException extends Exception {
    private final String topic;
    private final String event;

    public InvalidPayloadException(String topic, String event, Throwable cause) {
        super("Cannot encode payload for " + topic + "/" + event + ": " + cause.getMessage(), cause);
        this.topic = topic;
        this.event = event;
    }

    public String getTopic() {
        return topic;
    }

    public String getEvent() {
        return event;
    }
}
