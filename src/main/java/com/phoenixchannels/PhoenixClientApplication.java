/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.phoenixchannels.client.Channel;
import com.phoenixchannels.client.Socket;
import com.phoenixchannels.config.SocketConfig;
import com.phoenixchannels.presence.Presence;
import com.phoenixchannels.protocol.Events;
import com.phoenixchannels.protocol.Response;
import com.phoenixchannels.utils.JacksonConfig;
import com.phoenixchannels.utils.LoggerUtil;

import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line client that joins one topic and prints everything it receives.
 *
 * <pre>
 *   java -jar phoenix-channels-client.jar &lt;topic&gt; [endpoint]
 * </pre>
 *
 * Settings come from {@code phoenix-client.properties}; the optional endpoint argument
 * overrides {@code phoenix.endpoint}. Runs until interrupted.
 */
public class PhoenixClientApplication {

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        if (args.length < 1 || args[0].trim().isEmpty()) {
            System.err.println("Usage: PhoenixClientApplication <topic> [endpoint]");
            System.exit(2);
        }
        String topic = args[0].trim();

        try {
            SocketConfig config = SocketConfig.load();
            if (args.length > 1) {
                config = config.withEndpoint(args[1].trim(), config.getParams());
            }
            LoggerUtil.setDebugEnabled(config.isDebugLogging());
            LoggerUtil.info("Endpoint: " + config.endpointUri());

            Socket socket = Socket.create(config);
            socket.onConnect(() -> joinTopic(socket, topic))
                    .onDisconnect(error -> LoggerUtil.info("Connection closed"
                            + (error != null ? " (" + error.getMessage() + ")" : "")));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down Phoenix client...");
                socket.shutdown();
                shutdownLatch.countDown();
            }));

            socket.connect();
            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LoggerUtil.error("Failed to start Phoenix client: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void joinTopic(Socket socket, String topic) {
        Channel channel = socket.channel(topic);
        channel.onPresenceUpdate(PhoenixClientApplication::printPresence);
        channel.getPresence().setOnJoin((id, meta) -> LoggerUtil.info("[" + topic + "] + " + id));
        channel.getPresence().setOnLeave((id, meta) -> LoggerUtil.info("[" + topic + "] - " + id));
        socket.onMessage(response -> {
            if (topic.equals(response.topic()) && !isQuiet(response.event())) {
                LoggerUtil.info("[" + topic + "] " + response.event() + " " + describe(response.payload()));
            }
        });

        channel.join()
                .receive(Events.STATUS_OK, (push, payload) -> LoggerUtil.info("Joined " + topic))
                .receive(Events.STATUS_ERROR, (push, payload) ->
                        LoggerUtil.warn("Join of " + topic + " failed: " + describe(payload)));
    }

    private static boolean isQuiet(String event) {
        return Events.REPLY.equals(event)
                || Events.PRESENCE_STATE.equals(event)
                || Events.PRESENCE_DIFF.equals(event);
    }

    private static void printPresence(Channel channel, Presence presence) {
        LoggerUtil.info("[" + channel.getTopic() + "] " + presence.size() + " present: "
                + presence.getState().keySet());
    }

    private static String describe(Map<String, Object> payload) {
        try {
            return JacksonConfig.prettyMapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }
}
