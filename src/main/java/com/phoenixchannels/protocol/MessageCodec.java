/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.phoenixchannels.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.phoenixchannels.utils.JacksonConfig;

import java.util.Map;

/**
 * Encodes pushes into, and decodes inbound frames from, the five-element wire array
 * {@code [joinRef, ref, topic, event, payload]}. The element order is fixed by the
 * protocol. Stateless and safe to share.
 */
public final class MessageCodec {

    public static final int IDX_JOIN_REF = 0;
    public static final int IDX_REF = 1;
    public static final int IDX_TOPIC = 2;
    public static final int IDX_EVENT = 3;
    public static final int IDX_PAYLOAD = 4;
    public static final int MESSAGE_ARITY = 5;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(JacksonConfig.mapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serializes a push into its wire text.
     *
     * @throws InvalidPayloadException if the payload cannot be serialized
     */
    public String encode(Push push) throws InvalidPayloadException {
        ArrayNode message = mapper.createArrayNode();
        message.add(push.getJoinRef() != null ? push.getJoinRef().asString() : null);
        message.add(push.getRef().asString());
        message.add(push.getTopic());
        message.add(push.getEvent());
        try {
            JsonNode body = mapper.valueToTree(push.getPayload());
            message.add(body);
            return mapper.writeValueAsString(message);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new InvalidPayloadException(push.getTopic(), push.getEvent(), e);
        }
    }

    /**
     * Parses an inbound frame.
     *
     * @throws MessageDecodingException if the text is not a five-element array of
     *                                  the expected shape
     */
    public Response decode(String text) throws MessageDecodingException {
        if (text == null || text.isEmpty()) {
            throw new MessageDecodingException("Empty frame", text);
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageDecodingException("Malformed JSON: " + e.getOriginalMessage(), text, e);
        }

        if (root == null || !root.isArray()) {
            throw new MessageDecodingException("Frame is not a JSON array", text);
        }
        if (root.size() != MESSAGE_ARITY) {
            throw new MessageDecodingException(
                    "Expected " + MESSAGE_ARITY + " elements, got " + root.size(), text);
        }

        JsonNode topic = root.get(IDX_TOPIC);
        JsonNode event = root.get(IDX_EVENT);
        JsonNode payload = root.get(IDX_PAYLOAD);
        if (!topic.isTextual()) {
            throw new MessageDecodingException("Topic is not a string", text);
        }
        if (!event.isTextual()) {
            throw new MessageDecodingException("Event is not a string", text);
        }
        if (!payload.isObject()) {
            throw new MessageDecodingException("Payload is not an object", text);
        }

        JsonNode refNode = root.get(IDX_REF);
        JsonNode joinRefNode = root.get(IDX_JOIN_REF);
        String ref = refNode.isTextual() ? refNode.asText() : "";
        String joinRef = joinRefNode.isTextual() ? joinRefNode.asText() : null;

        Map<String, Object> body;
        try {
            body = mapper.convertValue(payload, PAYLOAD_TYPE);
        } catch (IllegalArgumentException e) {
            throw new MessageDecodingException("Payload could not be converted: " + e.getMessage(), text, e);
        }

        return new Response(joinRef, Ref.of(ref), topic.asText(), event.asText(), body);
    }
}
