/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import com.phoenixchannels.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A single outbound message awaiting at most one correlated reply.
 *
 * <p>A push is resolved exactly once: by the server's reply, or locally with a
 * {@link PushError}. Resolution fires every {@link #always(Consumer)} callback,
 * then every {@link #receive(String, ReplyHandler)} callback registered for the
 * received status, and then drops all registrations. Callback registries are guarded
 * by the push's monitor so callers may chain registrations from any thread; the
 * callbacks themselves run outside the lock.
 */
public class Push {

    /**
     * Callback fired with the reply payload when a push resolves with a given status.
     */
    @FunctionalInterface
    public interface ReplyHandler {
        void onReply(Push push, Map<String, Object> response);
    }

    private final String topic;
    private final String event;
    private final Map<String, Object> payload;
    private final Ref ref;
    private final Ref joinRef;

    private boolean resolved = false;
    private String receivedStatus;
    private Map<String, Object> receivedResponse;
    private PushError lastError;

    private final Map<String, List<ReplyHandler>> callbacks = new LinkedHashMap<>();
    private final List<Consumer<Push>> alwaysCallbacks = new ArrayList<>();

    public Push(String event, String topic, Map<String, Object> payload, Ref ref, Ref joinRef) {
        this.event = event;
        this.topic = topic;
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.ref = ref;
        this.joinRef = joinRef;
    }

    public String getTopic() { return topic; }
    public String getEvent() { return event; }
    public Map<String, Object> getPayload() { return payload; }
    public Ref getRef() { return ref; }
    public Ref getJoinRef() { return joinRef; }

    public synchronized boolean isResolved() { return resolved; }
    public synchronized String getReceivedStatus() { return receivedStatus; }
    public synchronized Map<String, Object> getReceivedResponse() { return receivedResponse; }

    /**
     * Local failure that resolved this push, or null when it resolved with a server reply
     * or is still pending.
     */
    public synchronized PushError getLastError() { return lastError; }

    // ======== Callback registration ========

    /**
     * Registers a callback for a reply status such as "ok" or "error".
     * If the push already resolved with that status the callback runs immediately.
     *
     * @return this push, for chaining
     */
    public Push receive(String status, ReplyHandler callback) {
        Map<String, Object> stored;
        synchronized (this) {
            if (!resolved) {
                callbacks.computeIfAbsent(status, k -> new ArrayList<>()).add(callback);
                return this;
            }
            if (!status.equals(receivedStatus) || receivedResponse == null) {
                return this;
            }
            stored = receivedResponse;
        }
        invokeReply(callback, stored);
        return this;
    }

    /**
     * Registers a callback fired once on resolution whatever the status.
     * If the push already resolved the callback runs immediately.
     *
     * @return this push, for chaining
     */
    public Push always(Consumer<Push> callback) {
        synchronized (this) {
            if (!resolved) {
                alwaysCallbacks.add(callback);
                return this;
            }
        }
        invokeAlways(callback);
        return this;
    }

    // ======== Resolution ========

    /**
     * Resolves the push with the server's reply. Ignored if already resolved.
     */
    public void resolve(Response response) {
        Object status = response.payload().get("status");
        resolve(status instanceof String ? (String) status : null, response.payload(), null);
    }

    /**
     * Resolves the push locally with a synthetic "error" reply carrying the reason.
     */
    public void resolveWithError(PushError error) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("reason", error.getReason());
        resolve(Events.STATUS_ERROR, Collections.unmodifiableMap(reply), error);
    }

    private void resolve(String status, Map<String, Object> response, PushError error) {
        List<Consumer<Push>> always;
        List<ReplyHandler> matching;
        synchronized (this) {
            if (resolved) {
                LoggerUtil.debug(() -> "[Push] Ignoring second resolution of " + ref + " (" + topic + "/" + event + ")");
                return;
            }
            resolved = true;
            receivedStatus = status;
            receivedResponse = response;
            lastError = error;

            always = new ArrayList<>(alwaysCallbacks);
            List<ReplyHandler> forStatus = status != null ? callbacks.get(status) : null;
            matching = forStatus != null ? new ArrayList<>(forStatus) : Collections.emptyList();

            callbacks.clear();
            alwaysCallbacks.clear();
        }
        fireCallbacks(always, matching, response);
    }

    private void fireCallbacks(List<Consumer<Push>> always, List<ReplyHandler> matching, Map<String, Object> response) {
        for (Consumer<Push> callback : always) {
            invokeAlways(callback);
        }
        for (ReplyHandler callback : matching) {
            invokeReply(callback, response);
        }
    }

    private void invokeReply(ReplyHandler callback, Map<String, Object> response) {
        try {
            callback.onReply(this, response);
        } catch (RuntimeException e) {
            LoggerUtil.error("[Push] Reply callback failed for " + topic + "/" + event, e);
        }
    }

    private void invokeAlways(Consumer<Push> callback) {
        try {
            callback.accept(this);
        } catch (RuntimeException e) {
            LoggerUtil.error("[Push] Always callback failed for " + topic + "/" + event, e);
        }
    }

    @Override
    public String toString() {
        return "[" + joinRef + ", " + ref + ", " + topic + ", " + event + ", " + payload + "]";
    }
}
