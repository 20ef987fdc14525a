/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.config;

import com.phoenixchannels.transport.EndpointUrls;
import com.phoenixchannels.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable socket settings read from {@link Properties}.
 *
 * <p>{@link #load()} reads the classpath {@code phoenix-client.properties} as defaults,
 * then lets {@code config/phoenix-client.properties} in the working directory override
 * them. Invalid numbers fall back to their defaults with a warning.
 */
public final class SocketConfig {

    public static final String RESOURCE_NAME = "phoenix-client.properties";
    public static final Path EXTERNAL_PATH = Paths.get("config", RESOURCE_NAME);

    public static final String KEY_ENDPOINT = "phoenix.endpoint";
    public static final String KEY_HEARTBEAT_INTERVAL_MS = "phoenix.heartbeat.interval.ms";
    public static final String KEY_RECONNECT_ENABLED = "phoenix.reconnect.enabled";
    public static final String KEY_RECONNECT_INTERVAL_MS = "phoenix.reconnect.interval.ms";
    public static final String KEY_CONNECT_TIMEOUT_MS = "phoenix.connect.timeout.ms";
    public static final String KEY_MAX_FRAME_BYTES = "phoenix.max.frame.bytes";
    public static final String KEY_VERBOSE = "phoenix.verbose";
    public static final String KEY_DEBUG = "phoenix.logging.debug";
    public static final String KEY_WIRE_LOGGING = "phoenix.wire.logging";
    public static final String PARAM_PREFIX = "phoenix.params.";

    public static final String DEFAULT_ENDPOINT = "ws://localhost:4000/socket/websocket";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000;
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 5_000;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_MAX_FRAME_BYTES = 65_536;

    private final String endpoint;
    private final Map<String, String> params;
    private final long heartbeatIntervalMs;
    private final boolean reconnectEnabled;
    private final long reconnectIntervalMs;
    private final int connectTimeoutMs;
    private final int maxFrameBytes;
    private final boolean verbose;
    private final boolean debugLogging;
    private final boolean wireLogging;

    private SocketConfig(String endpoint, Map<String, String> params, long heartbeatIntervalMs,
                         boolean reconnectEnabled, long reconnectIntervalMs, int connectTimeoutMs,
                         int maxFrameBytes, boolean verbose, boolean debugLogging, boolean wireLogging) {
        this.endpoint = endpoint;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.reconnectEnabled = reconnectEnabled;
        this.reconnectIntervalMs = reconnectIntervalMs;
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxFrameBytes = maxFrameBytes;
        this.verbose = verbose;
        this.debugLogging = debugLogging;
        this.wireLogging = wireLogging;
    }

    /** Built-in defaults, without reading any file. */
    public static SocketConfig defaults() {
        return fromProperties(new Properties());
    }

    /**
     * Reads configuration from the classpath resource and the optional external file.
     */
    public static SocketConfig load() {
        Properties config = new Properties();

        try (InputStream inputStream = SocketConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (inputStream != null) {
                config.load(inputStream);
                LoggerUtil.debug("[Config] Loaded classpath " + RESOURCE_NAME);
            } else {
                LoggerUtil.debug("[Config] No classpath " + RESOURCE_NAME + ", using built-in defaults");
            }
        } catch (IOException e) {
            LoggerUtil.warn("[Config] Failed to read classpath " + RESOURCE_NAME + ": " + e.getMessage());
        }

        if (Files.exists(EXTERNAL_PATH)) {
            try (InputStream inputStream = Files.newInputStream(EXTERNAL_PATH)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                LoggerUtil.info("[Config] Loaded " + externalConfig.size() + " override(s) from "
                        + EXTERNAL_PATH.toAbsolutePath());
            } catch (IOException e) {
                LoggerUtil.warn("[Config] Failed to load overrides from " + EXTERNAL_PATH + ": " + e.getMessage());
            }
        }

        return fromProperties(config);
    }

    public static SocketConfig fromProperties(Properties props) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(PARAM_PREFIX) && key.length() > PARAM_PREFIX.length()) {
                params.put(key.substring(PARAM_PREFIX.length()), props.getProperty(key));
            }
        }

        long reconnectInterval = getLong(props, KEY_RECONNECT_INTERVAL_MS, DEFAULT_RECONNECT_INTERVAL_MS);
        long heartbeatInterval = getLong(props, KEY_HEARTBEAT_INTERVAL_MS, DEFAULT_HEARTBEAT_INTERVAL_MS);
        if (heartbeatInterval <= 0) {
            LoggerUtil.warn("[Config] " + KEY_HEARTBEAT_INTERVAL_MS + " must be positive, using default");
            heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL_MS;
        }

        return new SocketConfig(
                props.getProperty(KEY_ENDPOINT, DEFAULT_ENDPOINT).trim(),
                params,
                heartbeatInterval,
                Boolean.parseBoolean(props.getProperty(KEY_RECONNECT_ENABLED, "true").trim()),
                reconnectInterval,
                (int) getLong(props, KEY_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS),
                (int) getLong(props, KEY_MAX_FRAME_BYTES, DEFAULT_MAX_FRAME_BYTES),
                Boolean.parseBoolean(props.getProperty(KEY_VERBOSE, "false").trim()),
                Boolean.parseBoolean(props.getProperty(KEY_DEBUG, "false").trim()),
                Boolean.parseBoolean(props.getProperty(KEY_WIRE_LOGGING, "false").trim()));
    }

    private static long getLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.warn("[Config] Invalid number for " + key + ": '" + value + "', using default " + defaultValue);
            return defaultValue;
        }
    }

    // ======== Copies ========

    public SocketConfig withEndpoint(String newEndpoint, Map<String, String> newParams) {
        return new SocketConfig(newEndpoint, newParams == null ? Collections.emptyMap() : newParams,
                heartbeatIntervalMs, reconnectEnabled, reconnectIntervalMs, connectTimeoutMs,
                maxFrameBytes, verbose, debugLogging, wireLogging);
    }

    public SocketConfig withHeartbeatIntervalMs(long intervalMs) {
        return new SocketConfig(endpoint, params, intervalMs, reconnectEnabled, reconnectIntervalMs,
                connectTimeoutMs, maxFrameBytes, verbose, debugLogging, wireLogging);
    }

    public SocketConfig withReconnect(boolean enabled, long intervalMs) {
        return new SocketConfig(endpoint, params, heartbeatIntervalMs, enabled, intervalMs,
                connectTimeoutMs, maxFrameBytes, verbose, debugLogging, wireLogging);
    }

    // ======== Accessors ========

    /** Endpoint with the configured params appended as query parameters. */
    public URI endpointUri() {
        return EndpointUrls.build(endpoint, params);
    }

    public String getEndpoint() { return endpoint; }
    public Map<String, String> getParams() { return params; }
    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public boolean isReconnectEnabled() { return reconnectEnabled; }
    public long getReconnectIntervalMs() { return reconnectIntervalMs; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public boolean isVerbose() { return verbose; }
    public boolean isDebugLogging() { return debugLogging; }
    public boolean isWireLogging() { return wireLogging; }
}
