/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

import com.phoenixchannels.utils.LoggerUtil;
import io.netty.util.concurrent.EventExecutor;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether a disconnect should be followed by reconnect attempts.
 *
 * <p>A caller-initiated disconnect is marked as expected beforehand and never triggers
 * reconnection. Any other disconnect starts a repeating attempt at the configured
 * interval, which runs until a connect succeeds or the caller disconnects.
 *
 * <p>Must be driven from the socket's event loop.
 */
public class ReconnectPolicy {
    private final EventExecutor executor;
    private final boolean enabled;
    private final long intervalMs;
    private final Runnable attempt;
    private final String logPrefix;

    private boolean expectedDisconnect = false;
    private ScheduledFuture<?> reconnectFuture;
    private int attempts = 0;

    public ReconnectPolicy(EventExecutor executor, boolean enabled, long intervalMs,
                           Runnable attempt, String logPrefix) {
        this.executor = executor;
        this.enabled = enabled;
        this.intervalMs = intervalMs;
        this.attempt = attempt;
        this.logPrefix = logPrefix;
    }

    /** Called before a caller-initiated disconnect. Cancels any pending attempts. */
    public void markExpectedDisconnect() {
        expectedDisconnect = true;
        cancel();
    }

    /** Called on every successful connect. */
    public void onConnected() {
        if (attempts > 0) {
            LoggerUtil.info(logPrefix + "Reconnected after " + attempts + " attempt(s)");
        }
        expectedDisconnect = false;
        cancel();
    }

    /** Called on every disconnect, expected or not. */
    public void onDisconnected() {
        if (expectedDisconnect) {
            LoggerUtil.debug(logPrefix + "Disconnect was requested; not reconnecting");
            return;
        }
        if (!enabled || intervalMs <= 0) {
            return;
        }
        if (isScheduled()) {
            return;
        }
        LoggerUtil.info(logPrefix + "Unexpected disconnect; reconnecting every " + intervalMs + " ms");
        reconnectFuture = executor.scheduleAtFixedRate(this::runAttempt, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public boolean isScheduled() {
        return reconnectFuture != null && !reconnectFuture.isDone();
    }

    public boolean isExpectedDisconnect() {
        return expectedDisconnect;
    }

    public int getAttempts() {
        return attempts;
    }

    private void runAttempt() {
        attempts++;
        try {
            attempt.run();
        } catch (RuntimeException e) {
            LoggerUtil.error(logPrefix + "Reconnect attempt " + attempts + " failed", e);
        }
    }

    private void cancel() {
        if (reconnectFuture != null) {
            reconnectFuture.cancel(false);
            reconnectFuture = null;
        }
        attempts = 0;
    }
}
