/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.unit.client;

import com.phoenixchannels.client.ReconnectPolicy;
import com.phoenixchannels.test.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reconnect policy")
class ReconnectPolicyTest {

    private static final long INTERVAL_MS = 5_000;

    private ManualEventLoop loop;
    private AtomicInteger attempts;
    private ReconnectPolicy policy;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        attempts = new AtomicInteger();
        policy = new ReconnectPolicy(loop.executor(), true, INTERVAL_MS, attempts::incrementAndGet, "[Test] ");
    }

    @Test
    @DisplayName("Should retry at a fixed interval after an unexpected disconnect")
    void shouldRetryAfterUnexpectedDisconnect() {
        policy.onDisconnected();

        assertTrue(policy.isScheduled());
        loop.advance(INTERVAL_MS - 1);
        assertEquals(0, attempts.get());

        loop.advance(1);
        assertEquals(1, attempts.get());

        loop.advance(INTERVAL_MS * 2);
        assertEquals(3, attempts.get());
        assertEquals(3, policy.getAttempts());
    }

    @Test
    @DisplayName("Should stop retrying once connected")
    void shouldStopOnConnect() {
        policy.onDisconnected();
        loop.advance(INTERVAL_MS);

        policy.onConnected();
        loop.advance(INTERVAL_MS * 5);

        assertEquals(1, attempts.get());
        assertFalse(policy.isScheduled());
        assertEquals(0, policy.getAttempts());
    }

    @Test
    @DisplayName("Should not retry after a requested disconnect")
    void shouldNotRetryAfterRequestedDisconnect() {
        policy.markExpectedDisconnect();
        policy.onDisconnected();

        loop.advance(INTERVAL_MS * 3);

        assertEquals(0, attempts.get());
        assertFalse(policy.isScheduled());
        assertTrue(policy.isExpectedDisconnect());
    }

    @Test
    @DisplayName("Should cancel pending retries when a disconnect is requested")
    void shouldCancelOnRequestedDisconnect() {
        policy.onDisconnected();
        loop.advance(INTERVAL_MS);

        policy.markExpectedDisconnect();
        loop.advance(INTERVAL_MS * 3);

        assertEquals(1, attempts.get());
        assertFalse(policy.isScheduled());
    }

    @Test
    @DisplayName("Should clear the requested flag on the next connect")
    void shouldClearFlagOnConnect() {
        policy.markExpectedDisconnect();
        policy.onConnected();
        policy.onDisconnected();

        assertFalse(policy.isExpectedDisconnect());
        assertTrue(policy.isScheduled());
    }

    @Test
    @DisplayName("Should schedule only one retry loop")
    void shouldScheduleOnce() {
        policy.onDisconnected();
        policy.onDisconnected();

        loop.advance(INTERVAL_MS);

        assertEquals(1, attempts.get());
        assertEquals(1, loop.pendingTasks());
    }

    @Test
    @DisplayName("Should never retry when disabled")
    void shouldNotRetryWhenDisabled() {
        ReconnectPolicy disabled = new ReconnectPolicy(loop.executor(), false, INTERVAL_MS,
                attempts::incrementAndGet, "[Test] ");

        disabled.onDisconnected();
        loop.advance(INTERVAL_MS * 3);

        assertEquals(0, attempts.get());
        assertFalse(disabled.isScheduled());
    }
}
