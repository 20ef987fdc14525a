/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phoenixchannels.client.Channel;
import com.phoenixchannels.client.ConnectionState;
import com.phoenixchannels.client.Socket;
import com.phoenixchannels.config.SocketConfig;
import com.phoenixchannels.utils.JacksonConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a socket over the real Netty transport against a minimal in-process Phoenix
 * endpoint that acknowledges every push and greets joins with a presence_state.
 */
@DisplayName("Socket over loopback WebSocket")
class SocketIntegrationTest {

    private static final String PATH = "/socket/websocket";

    private EventLoopGroup serverGroup;
    private io.netty.channel.Channel serverChannel;
    private Socket socket;

    @BeforeEach
    void startServer() throws Exception {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65_536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler(PATH));
                        ch.pipeline().addLast(new PhoenixEndpoint());
                    }
                })
                .bind("127.0.0.1", 0).sync().channel();
    }

    @AfterEach
    void stopServer() {
        if (socket != null) {
            socket.shutdown();
        }
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private SocketConfig configFor(int port) {
        return SocketConfig.defaults()
                .withEndpoint("ws://127.0.0.1:" + port + PATH, Map.of())
                .withReconnect(false, 0);
    }

    private int serverPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Test
    @DisplayName("Should connect, join and receive presence")
    void shouldJoinAndReceivePresence() throws Exception {
        CountDownLatch joined = new CountDownLatch(1);
        CountDownLatch presenceSynced = new CountDownLatch(1);
        AtomicReference<Channel> lobby = new AtomicReference<>();

        socket = Socket.create(configFor(serverPort()));
        socket.onConnect(() -> {
            Channel channel = socket.channel("room:lobby");
            channel.onPresenceUpdate((c, presence) -> presenceSynced.countDown());
            lobby.set(channel);
            channel.join().receive("ok", (push, reply) -> joined.countDown());
        });
        socket.connect();

        assertTrue(joined.await(5, TimeUnit.SECONDS), "join was not acknowledged");
        assertTrue(presenceSynced.await(5, TimeUnit.SECONDS), "presence_state not received");
        assertEquals("Alice", lobby.get().getPresence().firstMetaValue("u1", "name", String.class));
        assertTrue(lobby.get().isJoined());
    }

    @Test
    @DisplayName("Should report a clean close on disconnect")
    void shouldCloseCleanly() throws Exception {
        CountDownLatch connected = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);
        List<Throwable> errors = new CopyOnWriteArrayList<>();

        socket = Socket.create(configFor(serverPort()));
        socket.onConnect(connected::countDown).onDisconnect(error -> {
            if (error != null) {
                errors.add(error);
            }
            closed.countDown();
        });
        socket.connect();
        assertTrue(connected.await(5, TimeUnit.SECONDS));

        socket.disconnect();

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertTrue(errors.isEmpty());
        assertEquals(ConnectionState.DISCONNECTED, socket.getState());
    }

    @Test
    @DisplayName("Should report a refused connection as an error")
    void shouldReportRefusedConnection() throws Exception {
        int unusedPort;
        try (ServerSocket probe = new ServerSocket(0)) {
            unusedPort = probe.getLocalPort();
        }
        CountDownLatch closed = new CountDownLatch(1);
        AtomicReference<Throwable> error = new AtomicReference<>();

        socket = Socket.create(configFor(unusedPort));
        socket.onDisconnect(cause -> {
            error.set(cause);
            closed.countDown();
        });
        socket.connect();

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertNotNull(error.get());
        assertFalse(socket.isConnected());
    }

    /**
     * Acknowledges every push with an "ok" reply and follows each join with a
     * presence_state broadcast.
     */
    private static final class PhoenixEndpoint extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        private final ObjectMapper mapper = JacksonConfig.mapper();

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
            JsonNode message = mapper.readTree(frame.text());
            JsonNode joinRef = message.get(0);
            String topic = message.get(2).asText();

            ArrayNode reply = mapper.createArrayNode();
            reply.add(joinRef);
            reply.add(message.get(1));
            reply.add(topic);
            reply.add("phx_reply");
            ObjectNode payload = reply.addObject();
            payload.put("status", "ok");
            payload.putObject("response");
            ctx.writeAndFlush(new TextWebSocketFrame(mapper.writeValueAsString(reply)));

            if ("phx_join".equals(message.get(3).asText())) {
                ArrayNode state = mapper.createArrayNode();
                state.add(joinRef);
                state.addNull();
                state.add(topic);
                state.add("presence_state");
                ObjectNode user = state.addObject().putObject("u1");
                user.putArray("metas").addObject().put("phx_ref", "F1");
                user.put("name", "Alice");
                ctx.writeAndFlush(new TextWebSocketFrame(mapper.writeValueAsString(state)));
            }
        }
    }
}
