/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.transport;

/**
 * Connection events raised by a {@link Transport}.
 */
public interface TransportListener {

    void onOpen();

    /**
     * @param error cause of an abnormal close, or null for a clean close
     */
    void onClose(Throwable error);

    void onText(String text);
}
