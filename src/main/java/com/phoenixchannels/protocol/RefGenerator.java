/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import java.util.Locale;
import java.util.UUID;

/**
 * Produces fresh correlation refs. Refs are random UUIDs, so two generators never
 * hand out the same value in practice and no coordination is needed between them.
 */
public final class RefGenerator {

    /** Prefix marking refs of socket-internal heartbeat pushes. */
    public static final String HEARTBEAT_PREFIX = "hb-";

    public Ref next() {
        return next(null);
    }

    public Ref next(String prefix) {
        String uuid = UUID.randomUUID().toString().toLowerCase(Locale.ROOT);
        return new Ref(prefix == null || prefix.isEmpty() ? null : prefix, uuid);
    }
}
