/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

/**
 * Local failures delivered through a push's "error" callbacks instead of being thrown.
 */
public enum PushError {
    INVALID_PAYLOAD("Invalid payload request."),
    NOT_CONNECTED("Not connected to socket.");

    private final String reason;

    PushError(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
