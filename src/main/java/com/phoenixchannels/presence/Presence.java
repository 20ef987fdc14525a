/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.presence;

import com.phoenixchannels.protocol.Events;
import com.phoenixchannels.protocol.Response;
import com.phoenixchannels.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Replicated presence state of one channel: identity id mapped to the ordered list of
 * meta records (one per connected device or session of that identity).
 *
 * <p>The state is only mutated through {@link #sync(Response)}, which understands the
 * two presence broadcasts:
 * <ul>
 *   <li>{@code presence_state}: full state, each id overwritten with its metas</li>
 *   <li>{@code presence_diff}: {@code leaves} applied first, then {@code joins}</li>
 * </ul>
 *
 * <p>The server sends per-id fields next to the {@code metas} array rather than inside
 * it. Those sibling fields are copied into every meta record so each record is
 * self-describing. A key the meta already has keeps the meta's value.
 *
 * <p>Not thread-safe: mutated on the socket's event loop.
 */
public final class Presence {

    private static final String METAS = "metas";
    private static final String JOINS = "joins";
    private static final String LEAVES = "leaves";

    private final Map<String, List<Map<String, Object>>> state = new LinkedHashMap<>();

    private BiConsumer<String, Map<String, Object>> onJoin;
    private BiConsumer<String, Map<String, Object>> onLeave;
    private Consumer<Map<String, List<Map<String, Object>>>> onStateChange;

    // ======== Callbacks ========

    public void setOnJoin(BiConsumer<String, Map<String, Object>> onJoin) { this.onJoin = onJoin; }
    public void setOnLeave(BiConsumer<String, Map<String, Object>> onLeave) { this.onLeave = onLeave; }
    public void setOnStateChange(Consumer<Map<String, List<Map<String, Object>>>> onStateChange) {
        this.onStateChange = onStateChange;
    }

    /** Drops the join, leave and state-change callbacks. State is kept. */
    public void clearCallbacks() {
        onJoin = null;
        onLeave = null;
        onStateChange = null;
    }

    // ======== Syncing ========

    /**
     * Applies a presence broadcast. Responses carrying any other event are ignored.
     */
    public void sync(Response response) {
        String event = response.event();
        if (Events.PRESENCE_STATE.equals(event)) {
            syncState(response.payload());
        } else if (Events.PRESENCE_DIFF.equals(event)) {
            syncDiff(response.payload());
        } else {
            LoggerUtil.debug(() -> "[Presence] Ignoring non-presence event " + event + " on " + response.topic());
            return;
        }
        fireStateChange();
    }

    private void syncState(Map<String, Object> payload) {
        payload.forEach((id, entry) -> {
            List<Map<String, Object>> metas = mergedMetas(id, entry);
            if (metas != null) {
                state.put(id, metas);
            }
        });
    }

    private void syncDiff(Map<String, Object> payload) {
        Map<String, Object> leaves = section(payload, LEAVES);
        Map<String, Object> joins = section(payload, JOINS);

        leaves.forEach((id, entry) -> {
            state.remove(id);
            List<Map<String, Object>> metas = mergedMetas(id, entry);
            if (metas == null) return;
            for (Map<String, Object> meta : metas) {
                fire(onLeave, id, meta);
            }
        });

        joins.forEach((id, entry) -> {
            List<Map<String, Object>> metas = mergedMetas(id, entry);
            if (metas == null) return;
            state.put(id, metas);
            for (Map<String, Object> meta : metas) {
                fire(onJoin, id, meta);
            }
        });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        if (value != null) {
            LoggerUtil.warn("[Presence] Diff section '" + key + "' is not an object, ignoring it");
        }
        return Collections.emptyMap();
    }

    /**
     * Builds the self-describing meta list of one id entry, or null when the entry has no
     * {@code metas} array.
     */
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> mergedMetas(String id, Object entry) {
        if (!(entry instanceof Map)) {
            LoggerUtil.warn("[Presence] Entry for " + id + " is not an object, skipping");
            return null;
        }
        Map<String, Object> fields = (Map<String, Object>) entry;
        Object rawMetas = fields.get(METAS);
        if (!(rawMetas instanceof List)) {
            LoggerUtil.warn("[Presence] Entry for " + id + " has no metas list, skipping");
            return null;
        }

        List<Map<String, Object>> merged = new ArrayList<>();
        for (Object rawMeta : (List<Object>) rawMetas) {
            if (!(rawMeta instanceof Map)) continue;
            Map<String, Object> meta = new LinkedHashMap<>((Map<String, Object>) rawMeta);
            fields.forEach((key, value) -> {
                if (!METAS.equals(key)) {
                    meta.putIfAbsent(key, value);
                }
            });
            merged.add(Collections.unmodifiableMap(meta));
        }
        return Collections.unmodifiableList(merged);
    }

    private static void fire(BiConsumer<String, Map<String, Object>> callback, String id, Map<String, Object> meta) {
        if (callback == null) return;
        try {
            callback.accept(id, meta);
        } catch (RuntimeException e) {
            LoggerUtil.error("[Presence] Callback failed for " + id, e);
        }
    }

    private void fireStateChange() {
        Consumer<Map<String, List<Map<String, Object>>>> callback = onStateChange;
        if (callback == null) return;
        try {
            callback.accept(getState());
        } catch (RuntimeException e) {
            LoggerUtil.error("[Presence] State change callback failed", e);
        }
    }

    // ======== Access ========

    /** Read-only view of the whole state. */
    public Map<String, List<Map<String, Object>>> getState() {
        return Collections.unmodifiableMap(state);
    }

    public int size() {
        return state.size();
    }

    /**
     * All metas of an id.
     *
     * @return metas in server order, or null if the id is not present
     */
    public List<Map<String, Object>> metas(String id) {
        return state.get(id);
    }

    /**
     * First meta of an id, the "primary" record.
     *
     * @return meta, or null if the id is not present or has no metas
     */
    public Map<String, Object> firstMeta(String id) {
        List<Map<String, Object>> metas = state.get(id);
        return metas == null || metas.isEmpty() ? null : metas.get(0);
    }

    /** First meta of every id that has one. */
    public Map<String, Map<String, Object>> firstMetas() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        state.forEach((id, metas) -> {
            if (!metas.isEmpty()) {
                result.put(id, metas.get(0));
            }
        });
        return result;
    }

    /**
     * Typed value from the first meta of an id.
     *
     * @return value, or null if absent or not of the requested type
     */
    public <T> T firstMetaValue(String id, String key, Class<T> type) {
        Map<String, Object> meta = firstMeta(id);
        if (meta == null) return null;
        Object value = meta.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    /**
     * Typed value from the first meta of every id, skipping ids where it is absent or
     * of another type.
     */
    public <T> List<T> firstMetaValues(String key, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (List<Map<String, Object>> metas : state.values()) {
            if (metas.isEmpty()) continue;
            Object value = metas.get(0).get(key);
            if (type.isInstance(value)) {
                result.add(type.cast(value));
            }
        }
        return result;
    }
}
