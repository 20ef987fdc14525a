/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import java.util.Objects;

/**
 * Opaque correlation token carried in the ref and joinRef slots of a wire message.
 *
 * <p>Equality is by the full string form, so a prefixed ref created locally equals
 * the unprefixed ref decoded from the server's reply.
 */
public final class Ref {

    private final String prefix;
    private final String value;

    Ref(String prefix, String value) {
        this.prefix = prefix;
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Wraps a ref string received from the wire.
     *
     * @param value full ref string (null is treated as empty)
     * @return ref with no prefix
     */
    public static Ref of(String value) {
        return new Ref(null, value == null ? "" : value);
    }

    public String getPrefix() { return prefix; }

    public boolean isEmpty() { return prefix == null && value.isEmpty(); }

    /**
     * Checks whether this ref was generated with (or its wire form starts with) the prefix.
     */
    public boolean hasPrefix(String candidate) {
        return candidate != null && asString().startsWith(candidate);
    }

    public String asString() {
        return prefix == null ? value : prefix + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ref)) return false;
        return asString().equals(((Ref) o).asString());
    }

    @Override
    public int hashCode() {
        return asString().hashCode();
    }

    @Override
    public String toString() {
        return asString();
    }
}
