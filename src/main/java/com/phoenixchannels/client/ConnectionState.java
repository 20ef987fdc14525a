/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

/**
 * Lifecycle of the socket's underlying connection.
 */
public enum ConnectionState {
    INITIAL,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    DISCONNECTED
}
