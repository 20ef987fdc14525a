/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import java.util.Set;

/**
 * Reserved event names, statuses and topics of the Phoenix channel protocol.
 */
public final class Events {

    public static final String HEARTBEAT = "heartbeat";
    public static final String JOIN = "phx_join";
    public static final String LEAVE = "phx_leave";
    public static final String REPLY = "phx_reply";
    public static final String ERROR = "phx_error";
    public static final String CLOSE = "phx_close";

    public static final String PRESENCE_STATE = "presence_state";
    public static final String PRESENCE_DIFF = "presence_diff";

    /** Topic used for socket-level messages such as heartbeats. */
    public static final String PHOENIX_TOPIC = "phoenix";

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    private static final Set<String> LIFECYCLE = Set.of(CLOSE, ERROR, JOIN, REPLY, LEAVE);

    private Events() {}

    /**
     * Lifecycle events are bound to a specific join session of a channel.
     */
    public static boolean isLifecycleEvent(String event) {
        return event != null && LIFECYCLE.contains(event);
    }
}
