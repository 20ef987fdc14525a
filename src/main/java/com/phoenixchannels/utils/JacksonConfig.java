/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared ObjectMapper instances. ObjectMapper is thread-safe after configuration,
 * so a single instance can be reused by every socket in the process.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper();

    private static final ObjectMapper PRETTY_INSTANCE = new ObjectMapper();

    static {
        // Payloads that carry objects Jackson cannot describe must fail encoding
        INSTANCE.enable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        PRETTY_INSTANCE.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private JacksonConfig() {}

    /** Wire ObjectMapper used to encode and decode channel messages. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }

    /** ObjectMapper with pretty-printing, used for debug descriptions. */
    public static ObjectMapper prettyMapper() {
        return PRETTY_INSTANCE;
    }
}
