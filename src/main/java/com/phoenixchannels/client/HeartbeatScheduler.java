/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

import com.phoenixchannels.utils.LoggerUtil;
import io.netty.util.concurrent.EventExecutor;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Periodic heartbeat loop. Each beat sends one heartbeat and schedules the next one
 * after the same interval, whatever became of the previous heartbeat. A beat that fires
 * after the connection dropped does nothing and ends the loop.
 *
 * <p>Must be driven from the socket's event loop.
 */
public class HeartbeatScheduler {
    private final EventExecutor executor;
    private final long intervalMs;
    private final BooleanSupplier connected;
    private final Runnable sendHeartbeat;
    private final String logPrefix;

    private ScheduledFuture<?> heartbeatFuture;
    private long beatsSent = 0;

    public HeartbeatScheduler(EventExecutor executor, long intervalMs, BooleanSupplier connected,
                              Runnable sendHeartbeat, String logPrefix) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + intervalMs);
        }
        this.executor = executor;
        this.intervalMs = intervalMs;
        this.connected = connected;
        this.sendHeartbeat = sendHeartbeat;
        this.logPrefix = logPrefix;
    }

    /** (Re)starts the loop; the first heartbeat goes out one interval from now. */
    public void start() {
        stop();
        schedule();
    }

    public void stop() {
        if (heartbeatFuture != null) {
            heartbeatFuture.cancel(false);
            heartbeatFuture = null;
        }
    }

    public boolean isRunning() {
        return heartbeatFuture != null && !heartbeatFuture.isDone();
    }

    public long getBeatsSent() {
        return beatsSent;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void schedule() {
        heartbeatFuture = executor.schedule(this::beat, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void beat() {
        heartbeatFuture = null;
        if (!connected.getAsBoolean()) {
            LoggerUtil.debug(logPrefix + "Heartbeat timer fired while disconnected; loop stopped");
            return;
        }
        try {
            sendHeartbeat.run();
            beatsSent++;
        } catch (RuntimeException e) {
            LoggerUtil.error(logPrefix + "Heartbeat send failed", e);
        }
        schedule();
    }
}
