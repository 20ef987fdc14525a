/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.transport;

import com.phoenixchannels.utils.LoggerUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;

import java.io.IOException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pipeline end of one WebSocket connection: drives the opening handshake, then turns
 * frames into {@link TransportListener} events.
 *
 * <p>One instance per connection. Exactly one {@code onClose} follows an
 * {@code onOpen}; a connection that never completes its handshake also reports
 * {@code onClose} with the handshake failure.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private final WebSocketClientHandshaker handshaker;
    private final TransportListener events;
    private final long handshakeTimeoutMs;
    private final String logPrefix;

    private ScheduledFuture<?> handshakeTimeout;
    private Throwable failure;
    private boolean closeNotified = false;

    public WebSocketClientHandler(WebSocketClientHandshaker handshaker, TransportListener events,
                                  long handshakeTimeoutMs, String logPrefix) {
        this.handshaker = handshaker;
        this.events = events;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.logPrefix = logPrefix;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        LoggerUtil.debug(logPrefix + "TCP connected to " + ctx.channel().remoteAddress() + ", starting handshake");
        handshaker.handshake(ctx.channel()).addListener(future -> {
            if (!future.isSuccess()) {
                fail(ctx, future.cause());
            }
        });
        if (handshakeTimeoutMs > 0) {
            handshakeTimeout = ctx.executor().schedule(() -> {
                if (!handshaker.isHandshakeComplete()) {
                    fail(ctx, new WebSocketHandshakeException(
                            "Handshake timed out after " + handshakeTimeoutMs + " ms"));
                }
            }, handshakeTimeoutMs, TimeUnit.MILLISECONDS);
        }
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            if (!(msg instanceof FullHttpResponse)) {
                fail(ctx, new WebSocketHandshakeException("Unexpected message before handshake: " + msg));
                return;
            }
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
            } catch (WebSocketHandshakeException e) {
                fail(ctx, e);
                return;
            }
            cancelHandshakeTimeout();
            LoggerUtil.debug(logPrefix + "Handshake complete");
            events.onOpen();
            return;
        }

        if (msg instanceof FullHttpResponse) {
            FullHttpResponse response = (FullHttpResponse) msg;
            fail(ctx, new IllegalStateException("Unexpected HTTP response (status=" + response.status() + ")"));
            return;
        }

        if (!(msg instanceof WebSocketFrame)) {
            LoggerUtil.warn(logPrefix + "Ignoring unexpected message type " + msg.getClass().getSimpleName());
            return;
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame) {
            events.onText(((TextWebSocketFrame) frame).text());
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof PongWebSocketFrame) {
            LoggerUtil.debug(logPrefix + "Pong received");
        } else if (frame instanceof BinaryWebSocketFrame) {
            LoggerUtil.debug(logPrefix + "Ignoring binary frame of " + frame.content().readableBytes() + " bytes");
        } else if (frame instanceof CloseWebSocketFrame) {
            CloseWebSocketFrame close = (CloseWebSocketFrame) frame;
            int code = close.statusCode();
            LoggerUtil.debug(logPrefix + "Close frame received: " + code + " " + close.reasonText());
            if (code != -1
                    && code != WebSocketCloseStatus.NORMAL_CLOSURE.code()
                    && code != WebSocketCloseStatus.ENDPOINT_UNAVAILABLE.code()) {
                failure = new IOException("Closed by server: " + code + " " + close.reasonText());
            }
            ctx.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelHandshakeTimeout();
        Throwable cause = failure;
        if (cause == null && !handshaker.isHandshakeComplete()) {
            cause = new WebSocketHandshakeException("Connection closed before handshake completed");
        }
        notifyClose(cause);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LoggerUtil.error(logPrefix + "Pipeline error: " + cause);
        fail(ctx, cause);
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
        cancelHandshakeTimeout();
        ctx.close();
    }

    private void notifyClose(Throwable cause) {
        if (closeNotified) return;
        closeNotified = true;
        events.onClose(cause);
    }

    private void cancelHandshakeTimeout() {
        if (handshakeTimeout != null) {
            handshakeTimeout.cancel(false);
            handshakeTimeout = null;
        }
    }
}
