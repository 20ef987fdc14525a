/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

import com.phoenixchannels.presence.Presence;
import com.phoenixchannels.protocol.Events;
import com.phoenixchannels.protocol.Push;
import com.phoenixchannels.protocol.PushError;
import com.phoenixchannels.protocol.Ref;
import com.phoenixchannels.protocol.RefGenerator;
import com.phoenixchannels.protocol.Response;
import com.phoenixchannels.utils.LoggerUtil;

import java.lang.ref.WeakReference;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A topic session multiplexed over a {@link Socket}.
 *
 * <p>State machine:
 * <pre>
 *   CLOSED --join()--> JOINING --"ok"--> JOINED
 *   JOINING/JOINED --leave()--> LEAVING --"ok"--> CLOSED
 *   any active state --connection loss / join "error" / phx_error--> ERRORED
 * </pre>
 *
 * <p>Each join starts a new join session whose ref is carried as the joinRef of every
 * later push. Lifecycle messages tagged with an older joinRef are dropped.
 *
 * <p>The channel only holds a weak reference to its socket; the socket's registry owns
 * the channel. Pushes made after the socket was collected resolve with
 * {@link PushError#NOT_CONNECTED}.
 */
public class Channel {

    @FunctionalInterface
    public interface EventHandler {
        void onEvent(Channel channel, Response response);
    }

    @FunctionalInterface
    public interface PresenceHandler {
        void onPresence(Channel channel, Presence presence);
    }

    @FunctionalInterface
    public interface JoinCallback {
        /**
         * @param error local failure of the join push, or null
         */
        void onComplete(PushError error, Channel channel);
    }

    private final String topic;
    private final Map<String, Object> params;
    private final WeakReference<Socket> socket;
    private final RefGenerator refGenerator;
    private final Presence presence = new Presence();
    private final Map<String, EventHandler> callbacks = new ConcurrentHashMap<>();
    private final String logPrefix;

    private volatile ChannelState state = ChannelState.CLOSED;
    private volatile Ref joinRef;
    private volatile PresenceHandler presenceStateCallback;

    Channel(Socket socket, RefGenerator refGenerator, String topic, Map<String, Object> params) {
        this.socket = new WeakReference<>(socket);
        this.refGenerator = refGenerator;
        this.topic = topic;
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.logPrefix = "[Channel " + topic + "] ";
        installPresenceHandlers();
    }

    private void installPresenceHandlers() {
        callbacks.put(Events.PRESENCE_STATE, (channel, response) -> {
            presence.sync(response);
            PresenceHandler handler = presenceStateCallback;
            if (handler != null) {
                handler.onPresence(channel, presence);
            }
        });
        callbacks.put(Events.PRESENCE_DIFF, (channel, response) -> presence.sync(response));
    }

    // ======== Control ========

    /**
     * Sends a join with the channel params. The channel is (re)registered with its socket
     * for its topic, so a channel that left or was dropped on disconnect receives events
     * again. The state is JOINING on return and becomes JOINED once the server replies "ok".
     *
     * @return the join push, for further status handling
     */
    public Push join() {
        state = ChannelState.JOINING;
        Ref ref = refGenerator.next();
        joinRef = ref;

        Socket owner = socket.get();
        if (owner != null) {
            owner.register(this);
        }

        Push push = new Push(Events.JOIN, topic, params, ref, ref);
        push.receive(Events.STATUS_OK, (p, response) -> {
            if (ref.equals(joinRef)) {
                LoggerUtil.debug(logPrefix + "Joined");
                state = ChannelState.JOINED;
            }
        }).receive(Events.STATUS_ERROR, (p, response) -> {
            if (ref.equals(joinRef)) {
                LoggerUtil.warn(logPrefix + "Join failed: " + response);
                state = ChannelState.ERRORED;
            }
        });
        return dispatch(push);
    }

    /**
     * Sends a leave. On "ok" every user event handler and presence callback is dropped,
     * the channel is CLOSED and removed from its socket.
     *
     * @return the leave push
     */
    public Push leave() {
        state = ChannelState.LEAVING;
        Push push = new Push(Events.LEAVE, topic, Collections.emptyMap(), refGenerator.next(), sessionRef());
        push.receive(Events.STATUS_OK, (p, response) -> {
            callbacks.clear();
            installPresenceHandlers();
            presence.clearCallbacks();
            presenceStateCallback = null;
            state = ChannelState.CLOSED;
            LoggerUtil.debug(logPrefix + "Left");

            Socket owner = socket.get();
            if (owner != null) {
                owner.unregister(this);
            }
        });
        return dispatch(push);
    }

    /**
     * Runs the callback once the channel is joined: immediately when it already is,
     * otherwise after a new join push resolves (successfully or not).
     */
    public void joinIfNeeded(JoinCallback callback) {
        if (state == ChannelState.JOINED) {
            callback.onComplete(null, this);
            return;
        }
        join().always(push -> callback.onComplete(push.getLastError(), this));
    }

    /**
     * Sends an event on this channel's topic.
     *
     * @return the push, for reply handling
     */
    public Push send(String event, Map<String, Object> payload) {
        return dispatch(new Push(event, topic, payload, refGenerator.next(), sessionRef()));
    }

    private Ref sessionRef() {
        Ref current = joinRef;
        return current != null ? current : refGenerator.next();
    }

    private Push dispatch(Push push) {
        Socket owner = socket.get();
        if (owner == null) {
            LoggerUtil.warn(logPrefix + "Socket is gone; cannot send " + push.getEvent());
            push.resolveWithError(PushError.NOT_CONNECTED);
            return push;
        }
        return owner.send(push);
    }

    // ======== Callbacks ========

    /**
     * Registers the handler for an event, replacing any previous one.
     *
     * @return this channel, for chaining
     */
    public Channel on(String event, EventHandler handler) {
        callbacks.put(event, handler);
        return this;
    }

    public Channel off(String event) {
        callbacks.remove(event);
        return this;
    }

    /**
     * Registers the handler called after each full presence sync.
     *
     * @return this channel, for chaining
     */
    public Channel onPresenceUpdate(PresenceHandler handler) {
        presenceStateCallback = handler;
        return this;
    }

    // ======== Inbound ========

    void received(Response response) {
        String event = response.event();
        if (isStale(response)) {
            LoggerUtil.debug(() -> logPrefix + "Dropping " + event + " from stale join " + response.joinRef());
            return;
        }

        if (Events.ERROR.equals(event)) {
            if (state.isActive()) {
                LoggerUtil.warn(logPrefix + "Server reported channel error: " + response.payload());
                state = ChannelState.ERRORED;
            }
        } else if (Events.CLOSE.equals(event)) {
            LoggerUtil.debug(logPrefix + "Closed by server");
            state = ChannelState.CLOSED;
        }

        EventHandler handler = callbacks.get(event);
        if (handler == null) {
            return;
        }
        try {
            handler.onEvent(this, response);
        } catch (RuntimeException e) {
            LoggerUtil.error(logPrefix + "Handler for " + event + " failed", e);
        }
    }

    private boolean isStale(Response response) {
        String inbound = response.joinRef();
        Ref current = joinRef;
        return inbound != null && !inbound.isEmpty()
                && current != null && !inbound.equals(current.asString())
                && Events.isLifecycleEvent(response.event());
    }

    void onConnectionLost() {
        if (state.isActive()) {
            state = ChannelState.ERRORED;
        }
    }

    // ======== Accessors ========

    public String getTopic() { return topic; }
    public Map<String, Object> getParams() { return params; }
    public ChannelState getState() { return state; }
    public boolean isJoined() { return state == ChannelState.JOINED; }
    public Presence getPresence() { return presence; }

    /** Ref of the current join session, or null before the first join. */
    public Ref getJoinRef() { return joinRef; }

    @Override
    public String toString() {
        return "Channel{topic=" + topic + ", state=" + state + "}";
    }
}
