/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

/**
 * Thrown when an inbound frame is not a well-formed channel message.
 * The frame is dropped; the connection stays up.
 */
public class MessageDecodingException extends Exception {
    private final String frame;

    public MessageDecodingException(String message, String frame) {
        super(message);
        this.frame = frame;
    }

    public MessageDecodingException(String message, String frame, Throwable cause) {
        super(message, cause);
        this.frame = frame;
    }

    /**
     * Gets the raw text that failed to decode.
     *
     * @return offending frame text
     */
    public String getFrame() {
        return frame;
    }
}
