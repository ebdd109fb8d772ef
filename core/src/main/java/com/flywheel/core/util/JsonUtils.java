package com.flywheel.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for stored rows, wire messages and ops endpoints.
 * <p>
 * Serialization failures surface as {@link IllegalStateException}.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize " + clazz.getSimpleName(), e);
        }
    }

    /**
     * Parses JSON text into a tree; null text yields a JSON null node.
     */
    public static JsonNode readTree(String json) {
        if (json == null) {
            return mapper().nullNode();
        }
        try {
            return mapper().readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse JSON payload", e);
        }
    }

    public static JsonNode valueToTree(Object value) {
        return mapper().valueToTree(value);
    }
}
