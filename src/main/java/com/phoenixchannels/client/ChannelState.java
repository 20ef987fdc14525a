/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

/**
 * Join state of a single channel.
 */
public enum ChannelState {
    CLOSED,
    ERRORED,
    JOINED,
    JOINING,
    LEAVING;

    /** True while the channel holds, or is acquiring or releasing, a server-side membership. */
    public boolean isActive() {
        return this == JOINING || this == JOINED || this == LEAVING;
    }
}
