/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.transport;

/**
 * Message connection underneath a socket. Implementations own framing, TLS and raw I/O;
 * the socket only sees whole text messages and open/close notifications.
 *
 * <p>Listener notifications must be delivered on the event loop the socket runs on.
 */
public interface Transport {

    /** Starts connecting. Completion is reported through {@link TransportListener#onOpen()}. */
    void connect();

    /** Starts closing. Completion is reported through {@link TransportListener#onClose(Throwable)}. */
    void disconnect();

    boolean isConnected();

    /**
     * Writes one text message. Failures are reported by closing the connection.
     */
    void write(String text);

    void setListener(TransportListener listener);
}
