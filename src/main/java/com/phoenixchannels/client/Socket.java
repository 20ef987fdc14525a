/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.client;

import com.phoenixchannels.config.SocketConfig;
import com.phoenixchannels.protocol.Events;
import com.phoenixchannels.protocol.InvalidPayloadException;
import com.phoenixchannels.protocol.MessageCodec;
import com.phoenixchannels.protocol.MessageDecodingException;
import com.phoenixchannels.protocol.Push;
import com.phoenixchannels.protocol.PushError;
import com.phoenixchannels.protocol.Ref;
import com.phoenixchannels.protocol.RefGenerator;
import com.phoenixchannels.protocol.Response;
import com.phoenixchannels.transport.NettyWebSocketTransport;
import com.phoenixchannels.transport.Transport;
import com.phoenixchannels.transport.TransportListener;
import com.phoenixchannels.utils.LoggerUtil;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Top-level client: one connection, many channels.
 *
 * <p>The socket owns the transport, the table of pushes awaiting a reply (keyed by ref),
 * the channel registry, the heartbeat loop and the reconnect policy. All of that state
 * lives on a single event loop: transport events and timers arrive there, and public
 * operations called from other threads are handed to it. No operation blocks; outcomes
 * are observed through callbacks.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Encode and write pushes, resolving them locally when they cannot be sent</li>
 *   <li>Resolve pending pushes from replies and route every message to its channel</li>
 *   <li>Heartbeat while connected, reconnect after unexpected disconnects</li>
 *   <li>On disconnect, resolve stranded pushes and drop all channels</li>
 * </ul>
 */
public class Socket implements TransportListener {

    @FunctionalInterface
    public interface StateChangeHandler {
        void onStateChange(ConnectionState oldState, ConnectionState newState);
    }

    private final Transport transport;
    private final EventExecutor executor;
    private final EventLoopGroup ownedGroup;
    private final MessageCodec codec;
    private final RefGenerator refGenerator = new RefGenerator();
    private final HeartbeatScheduler heartbeat;
    private final ReconnectPolicy reconnect;
    private final boolean verbose;
    private final String endpointDescription;
    private final String logPrefix = "[Socket] ";

    private final Map<Ref, Push> awaitingResponses = new HashMap<>();
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    private volatile ConnectionState state = ConnectionState.INITIAL;

    private volatile Runnable onConnect;
    private volatile Consumer<Throwable> onDisconnect;
    private volatile Consumer<Response> onMessage;
    private volatile StateChangeHandler onStateChange;

    public Socket(Transport transport, EventExecutor executor, SocketConfig config) {
        this(transport, executor, config, new MessageCodec(), null);
    }

    Socket(Transport transport, EventExecutor executor, SocketConfig config,
           MessageCodec codec, EventLoopGroup ownedGroup) {
        this.transport = transport;
        this.executor = executor;
        this.codec = codec;
        this.ownedGroup = ownedGroup;
        this.verbose = config.isVerbose();
        this.endpointDescription = config.getEndpoint();
        this.heartbeat = new HeartbeatScheduler(executor, config.getHeartbeatIntervalMs(),
                transport::isConnected, this::sendHeartbeat, logPrefix);
        this.reconnect = new ReconnectPolicy(executor, config.isReconnectEnabled(),
                config.getReconnectIntervalMs(), this::attemptReconnect, logPrefix);
        transport.setListener(this);
    }

    /**
     * Creates a socket backed by a Netty WebSocket transport on its own single-threaded
     * event loop. Call {@link #shutdown()} to release the loop.
     */
    public static Socket create(SocketConfig config) {
        NioEventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("phoenix-socket", true));
        NettyWebSocketTransport transport = new NettyWebSocketTransport(config, group);
        return new Socket(transport, group.next(), config, new MessageCodec(), group);
    }

    /**
     * Creates a socket for an endpoint with query parameters and default settings.
     */
    public static Socket create(String endpoint, Map<String, String> params) {
        return create(SocketConfig.load().withEndpoint(endpoint, params));
    }

    // ======== Connection ========

    public void connect() {
        inLoop(() -> {
            if (transport.isConnected()) {
                return;
            }
            LoggerUtil.info(logPrefix + "Connecting to " + endpointDescription);
            setState(ConnectionState.CONNECTING);
            transport.connect();
        });
    }

    /**
     * Closes the connection on purpose; no reconnect follows.
     */
    public void disconnect() {
        inLoop(() -> {
            reconnect.markExpectedDisconnect();
            heartbeat.stop();
            if (!transport.isConnected() && state != ConnectionState.CONNECTING) {
                return;
            }
            LoggerUtil.info(logPrefix + "Disconnecting from " + endpointDescription);
            setState(ConnectionState.DISCONNECTING);
            transport.disconnect();
        });
    }

    /**
     * Disconnects and, for sockets made by {@link #create(SocketConfig)}, releases the
     * event loop.
     */
    public void shutdown() {
        disconnect();
        if (ownedGroup != null) {
            ownedGroup.shutdownGracefully();
        }
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public ConnectionState getState() {
        return state;
    }

    private void attemptReconnect() {
        if (transport.isConnected()) {
            return;
        }
        LoggerUtil.info(logPrefix + "Reconnect attempt " + reconnect.getAttempts() + " to " + endpointDescription);
        setState(ConnectionState.CONNECTING);
        transport.connect();
    }

    // ======== Channels ========

    public Channel channel(String topic) {
        return channel(topic, Collections.emptyMap());
    }

    /**
     * Creates a channel for the topic and registers it, replacing any channel previously
     * registered for the same topic.
     */
    public Channel channel(String topic, Map<String, Object> params) {
        Channel channel = new Channel(this, refGenerator, topic, params);
        register(channel);
        return channel;
    }

    /**
     * Leaves the channel; it is unregistered once the server acknowledges.
     *
     * @return the leave push
     */
    public Push remove(Channel channel) {
        return channel.leave();
    }

    void register(Channel channel) {
        Channel previous = channels.put(channel.getTopic(), channel);
        if (previous != null && previous != channel) {
            LoggerUtil.debug(logPrefix + "Replaced channel for " + channel.getTopic());
        }
    }

    void unregister(Channel channel) {
        channels.remove(channel.getTopic(), channel);
    }

    public Map<String, Channel> getChannels() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    // ======== Sending ========

    /**
     * Sends an event on a topic outside of any channel.
     */
    public Push send(String event, String topic, Map<String, Object> payload) {
        return send(new Push(event, topic, payload, refGenerator.next(), refGenerator.next()));
    }

    /**
     * Sends a push. If the transport is down the push resolves at once with
     * {@link PushError#NOT_CONNECTED}; if its payload cannot be encoded it resolves with
     * {@link PushError#INVALID_PAYLOAD}. Otherwise it waits in the pending table for a
     * reply with the same ref.
     *
     * @return the same push, for chaining
     */
    public Push send(Push push) {
        if (!transport.isConnected()) {
            failNotConnected(push);
            return push;
        }
        inLoop(() -> write(push));
        return push;
    }

    private void write(Push push) {
        if (!transport.isConnected()) {
            failNotConnected(push);
            return;
        }

        String text;
        try {
            text = codec.encode(push);
        } catch (InvalidPayloadException e) {
            LoggerUtil.warn(logPrefix + "Failed to send message: " + e.getMessage());
            push.resolveWithError(PushError.INVALID_PAYLOAD);
            return;
        }

        if (verbose) {
            LoggerUtil.info(logPrefix + "Sending: " + text);
        }
        awaitingResponses.put(push.getRef(), push);
        transport.write(text);
    }

    private void failNotConnected(Push push) {
        LoggerUtil.debug(() -> logPrefix + "Not connected; failing " + push.getTopic() + "/" + push.getEvent());
        push.resolveWithError(PushError.NOT_CONNECTED);
    }

    void sendHeartbeat() {
        Ref ref = refGenerator.next(RefGenerator.HEARTBEAT_PREFIX);
        write(new Push(Events.HEARTBEAT, Events.PHOENIX_TOPIC, Collections.emptyMap(), ref, refGenerator.next()));
    }

    /**
     * Number of pushes written and still waiting for their reply. The pending table is
     * confined to the event loop, so call this from the loop (for example inside a
     * callback).
     */
    public int getPendingCount() {
        return awaitingResponses.size();
    }

    // ======== TransportListener ========

    @Override
    public void onOpen() {
        LoggerUtil.info(logPrefix + "Connected to " + endpointDescription);
        setState(ConnectionState.CONNECTED);
        reconnect.onConnected();
        Runnable callback = onConnect;
        if (callback != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LoggerUtil.error(logPrefix + "onConnect callback failed", e);
            }
        }
        heartbeat.start();
    }

    @Override
    public void onClose(Throwable error) {
        if (error != null) {
            LoggerUtil.warn(logPrefix + "Disconnected from " + endpointDescription + ": " + error);
        } else {
            LoggerUtil.info(logPrefix + "Disconnected from " + endpointDescription);
        }
        heartbeat.stop();
        setState(ConnectionState.DISCONNECTED);

        Consumer<Throwable> callback = onDisconnect;
        if (callback != null) {
            try {
                callback.accept(error);
            } catch (RuntimeException e) {
                LoggerUtil.error(logPrefix + "onDisconnect callback failed", e);
            }
        }

        failPendingPushes();
        dropChannels();
        reconnect.onDisconnected();
    }

    @Override
    public void onText(String text) {
        Response response;
        try {
            response = codec.decode(text);
        } catch (MessageDecodingException e) {
            LoggerUtil.warn(logPrefix + "Dropping malformed frame: " + e.getMessage());
            return;
        }
        handleResponse(response);
    }

    private void handleResponse(Response response) {
        if (verbose) {
            LoggerUtil.info(logPrefix + "Received " + response.topic() + "/" + response.event() + ": " + response.payload());
        }

        Push push = awaitingResponses.remove(response.ref());
        if (push != null) {
            push.resolve(response);
        }

        Channel channel = channels.get(response.topic());
        if (channel != null) {
            channel.received(response);
        }

        Consumer<Response> callback = onMessage;
        if (callback != null) {
            try {
                callback.accept(response);
            } catch (RuntimeException e) {
                LoggerUtil.error(logPrefix + "onMessage callback failed", e);
            }
        }
    }

    private void failPendingPushes() {
        if (awaitingResponses.isEmpty()) {
            return;
        }
        List<Push> stranded = new ArrayList<>(awaitingResponses.values());
        awaitingResponses.clear();
        LoggerUtil.debug(logPrefix + "Failing " + stranded.size() + " push(es) left without reply");
        for (Push push : stranded) {
            push.resolveWithError(PushError.NOT_CONNECTED);
        }
    }

    private void dropChannels() {
        for (Channel channel : channels.values()) {
            channel.onConnectionLost();
        }
        channels.clear();
    }

    // ======== Callbacks ========

    public Socket onConnect(Runnable callback) {
        this.onConnect = callback;
        return this;
    }

    /**
     * @param callback receives the transport error, or null for a clean close
     */
    public Socket onDisconnect(Consumer<Throwable> callback) {
        this.onDisconnect = callback;
        return this;
    }

    /** Called for every decoded inbound message, after channel routing. */
    public Socket onMessage(Consumer<Response> callback) {
        this.onMessage = callback;
        return this;
    }

    public Socket onStateChange(StateChangeHandler callback) {
        this.onStateChange = callback;
        return this;
    }

    private void setState(ConnectionState newState) {
        ConnectionState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        StateChangeHandler callback = onStateChange;
        if (callback != null) {
            try {
                callback.onStateChange(oldState, newState);
            } catch (RuntimeException e) {
                LoggerUtil.error(logPrefix + "onStateChange callback failed", e);
            }
        }
    }

    private void inLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }
}
