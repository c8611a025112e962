package com.qqsuccubus.delivery.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for wire frames.
 * <p>
 * Timestamps are written as ISO-8601 strings and unknown properties are ignored,
 * so peers may add fields without breaking older nodes.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + clazz.getSimpleName() + " JSON", e);
        }
    }

    public static JsonNode readTree(String json) {
        try {
            return mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON frame", e);
        }
    }

    public static <T> T treeToValue(JsonNode node, Class<T> clazz) {
        try {
            return mapper().treeToValue(node, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + clazz.getSimpleName() + " frame", e);
        }
    }

    /**
     * Converts an arbitrary payload into a JSON tree; {@code null} becomes an empty object.
     */
    public static JsonNode toTree(Object value) {
        if (value == null) {
            return MAPPER.createObjectNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }
}
