/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.unit.protocol;

import com.phoenixchannels.protocol.Push;
import com.phoenixchannels.protocol.PushError;
import com.phoenixchannels.protocol.Ref;
import com.phoenixchannels.protocol.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Push reply correlation")
class PushTest {

    private Push push;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        push = new Push("new_msg", "room:lobby", Map.of("body", "hi"), Ref.of("2"), Ref.of("1"));
        fired = new ArrayList<>();
    }

    private static Response reply(String status) {
        return new Response("1", Ref.of("2"), "room:lobby", "phx_reply", Map.of("status", status, "response", Map.of()));
    }

    @Nested
    @DisplayName("Before resolution")
    class BeforeResolution {

        @Test
        @DisplayName("Should fire only the callbacks of the received status")
        void shouldFireMatchingStatusOnly() {
            push.receive("ok", (p, r) -> fired.add("ok"))
                    .receive("error", (p, r) -> fired.add("error"));

            push.resolve(reply("ok"));

            assertEquals(List.of("ok"), fired);
            assertTrue(push.isResolved());
            assertEquals("ok", push.getReceivedStatus());
            assertNull(push.getLastError());
        }

        @Test
        @DisplayName("Should fire always callbacks before status callbacks")
        void shouldFireAlwaysFirst() {
            push.receive("ok", (p, r) -> fired.add("ok-1"))
                    .always(p -> fired.add("always"))
                    .receive("ok", (p, r) -> fired.add("ok-2"));

            push.resolve(reply("ok"));

            assertEquals(List.of("always", "ok-1", "ok-2"), fired);
        }

        @Test
        @DisplayName("Should pass the full reply payload to status callbacks")
        void shouldPassReplyPayload() {
            List<Map<String, Object>> received = new ArrayList<>();
            push.receive("ok", (p, r) -> received.add(r));

            push.resolve(reply("ok"));

            assertEquals(1, received.size());
            assertEquals("ok", received.get(0).get("status"));
            assertEquals(Map.of(), received.get(0).get("response"));
        }

        @Test
        @DisplayName("Should fire every callback at most once")
        void shouldFireOnce() {
            push.receive("ok", (p, r) -> fired.add("ok")).always(p -> fired.add("always"));

            push.resolve(reply("ok"));
            push.resolve(reply("ok"));
            push.resolveWithError(PushError.NOT_CONNECTED);

            assertEquals(List.of("always", "ok"), fired);
            assertEquals("ok", push.getReceivedStatus());
            assertNull(push.getLastError());
        }

        @Test
        @DisplayName("Should keep firing later callbacks when one throws")
        void shouldIsolateFailingCallback() {
            push.receive("ok", (p, r) -> { throw new IllegalStateException("boom"); })
                    .receive("ok", (p, r) -> fired.add("second"));

            push.resolve(reply("ok"));

            assertEquals(List.of("second"), fired);
        }
    }

    @Nested
    @DisplayName("Local errors")
    class LocalErrors {

        @Test
        @DisplayName("Should resolve as error with the reason string")
        void shouldResolveWithReason() {
            List<Object> reasons = new ArrayList<>();
            push.receive("error", (p, r) -> reasons.add(r.get("reason")));

            push.resolveWithError(PushError.NOT_CONNECTED);

            assertEquals(List.of("Not connected to socket."), reasons);
            assertEquals(PushError.NOT_CONNECTED, push.getLastError());
            assertEquals("error", push.getReceivedStatus());
        }

        @Test
        @DisplayName("Should carry the invalid payload reason")
        void shouldCarryInvalidPayloadReason() {
            push.resolveWithError(PushError.INVALID_PAYLOAD);

            assertEquals("Invalid payload request.", push.getReceivedResponse().get("reason"));
        }
    }

    @Nested
    @DisplayName("After resolution")
    class AfterResolution {

        @Test
        @DisplayName("Should fire a late receive for the stored status immediately")
        void shouldFireLateMatchingReceive() {
            push.resolve(reply("ok"));

            push.receive("ok", (p, r) -> fired.add("late-ok"))
                    .receive("error", (p, r) -> fired.add("late-error"));

            assertEquals(List.of("late-ok"), fired);
        }

        @Test
        @DisplayName("Should fire a late always immediately")
        void shouldFireLateAlways() {
            push.resolveWithError(PushError.NOT_CONNECTED);

            push.always(p -> fired.add("always:" + p.getLastError()));

            assertEquals(List.of("always:NOT_CONNECTED"), fired);
        }
    }

    @Test
    @DisplayName("Should render the wire tuple")
    void shouldRenderWireTuple() {
        assertEquals("[1, 2, room:lobby, new_msg, {body=hi}]", push.toString());
    }
}
