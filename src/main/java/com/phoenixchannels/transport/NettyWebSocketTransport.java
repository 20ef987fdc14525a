/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.transport;

import com.phoenixchannels.config.SocketConfig;
import com.phoenixchannels.utils.LoggerUtil;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;

/**
 * {@link Transport} over a Netty WebSocket client connection (ws:// or wss://).
 *
 * <p>The pipeline is {@code [ssl] -> HttpClientCodec -> HttpObjectAggregator ->
 * [logger] -> WebSocketClientHandler}. All listener events are delivered on the
 * connection's event loop, which must be the loop the socket runs on.
 */
public class NettyWebSocketTransport implements Transport {

    private final URI uri;
    private final EventLoopGroup group;
    private final int connectTimeoutMs;
    private final int maxFrameBytes;
    private final boolean wireLogging;
    private final String logPrefix = "[Transport] ";

    private volatile TransportListener listener;
    private volatile Channel channel;
    private volatile boolean connected = false;
    private volatile boolean connecting = false;
    private volatile boolean closeRequested = false;
    private SslContext sslContext;

    public NettyWebSocketTransport(SocketConfig config, EventLoopGroup group) {
        this(config.endpointUri(), group, config.getConnectTimeoutMs(), config.getMaxFrameBytes(),
                config.isWireLogging());
    }

    public NettyWebSocketTransport(URI uri, EventLoopGroup group, int connectTimeoutMs,
                                   int maxFrameBytes, boolean wireLogging) {
        this.uri = uri;
        this.group = group;
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxFrameBytes = maxFrameBytes;
        this.wireLogging = wireLogging;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public URI getUri() {
        return uri;
    }

    @Override
    public void connect() {
        if (connected || connecting) {
            LoggerUtil.debug(logPrefix + "Connect ignored; connection already " + (connected ? "open" : "in progress"));
            return;
        }
        connecting = true;
        closeRequested = false;

        final SslContext ssl;
        try {
            ssl = sslContext();
        } catch (SSLException e) {
            connecting = false;
            LoggerUtil.error(logPrefix + "Cannot build TLS context for " + uri + ": " + e.getMessage());
            dispatchClose(e);
            return;
        }

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), maxFrameBytes);
        WebSocketClientHandler handler = new WebSocketClientHandler(
                handshaker, new ConnectionEvents(), connectTimeoutMs, logPrefix);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast("ssl", ssl.newHandler(ch.alloc(), uri.getHost(), EndpointUrls.port(uri)));
                        }
                        p.addLast("http-codec", new HttpClientCodec());
                        p.addLast("http-aggregator", new HttpObjectAggregator(maxFrameBytes));
                        if (wireLogging) {
                            p.addLast("logger", new LoggingHandler("WIRE", LogLevel.DEBUG));
                        }
                        p.addLast("websocket", handler);
                    }
                });

        LoggerUtil.debug(logPrefix + "Connecting to " + uri.getHost() + ":" + EndpointUrls.port(uri));
        ChannelFuture connectFuture = bootstrap.connect(uri.getHost(), EndpointUrls.port(uri));
        channel = connectFuture.channel();
        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                connecting = false;
                channel = null;
                LoggerUtil.warn(logPrefix + "Connect to " + uri + " failed: " + future.cause());
                dispatchClose(future.cause());
            }
        });
    }

    @Override
    public void disconnect() {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        closeRequested = true;
        if (connected) {
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    @Override
    public void write(String text) {
        Channel ch = channel;
        if (ch == null || !connected) {
            LoggerUtil.warn(logPrefix + "Write dropped; not connected");
            return;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LoggerUtil.error(logPrefix + "Write FAILED | cause=" + future.cause());
                future.channel().close();
            }
        });
    }

    private SslContext sslContext() throws SSLException {
        if (!EndpointUrls.isSecure(uri)) {
            return null;
        }
        if (sslContext == null) {
            sslContext = SslContextBuilder.forClient().build();
        }
        return sslContext;
    }

    private void dispatchClose(Throwable error) {
        TransportListener target = listener;
        if (target != null) {
            target.onClose(error);
        }
    }

    /**
     * Tracks connection flags before forwarding handler events to the listener.
     */
    private final class ConnectionEvents implements TransportListener {
        @Override
        public void onOpen() {
            connecting = false;
            connected = true;
            TransportListener target = listener;
            if (target != null) {
                target.onOpen();
            }
        }

        @Override
        public void onClose(Throwable error) {
            boolean requested = closeRequested;
            connecting = false;
            connected = false;
            channel = null;
            closeRequested = false;
            dispatchClose(requested ? null : error);
        }

        @Override
        public void onText(String text) {
            TransportListener target = listener;
            if (target != null) {
                target.onText(text);
            }
        }
    }
}
