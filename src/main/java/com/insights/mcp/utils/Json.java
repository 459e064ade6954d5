package com.insights.mcp.utils;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared ObjectMapper singleton for JSON serialization.
 * Configured with NON_NULL inclusion and snake_case naming to match MCP conventions.
 * Parsing rejects anything after the first JSON value.
 */
public final class Json {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
        (PropertyNamingStrategies.SnakeCaseStrategy) PropertyNamingStrategies.SNAKE_CASE;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setPropertyNamingStrategy(SNAKE_CASE);

    private Json() {}

    /**
     * Convert a camelCase string to snake_case.
     * Single source of truth for naming conversion across the codebase.
     */
    public static String toSnakeCase(final String camel) {
        return SNAKE_CASE.translate(camel);
    }

    /**
     * Serialize an object to a JSON string.
     *
     * @param value the object to serialize
     * @return JSON string representation
     * @throws RuntimeException if serialization fails
     */
    public static String serialize(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    /**
     * Size in bytes of the UTF-8 encoded JSON form of a value.
     * Strings are measured as-is rather than re-quoted.
     */
    public static long utf8Size(final Object value) {
        if (value == null) return 0;
        final String text = value instanceof String s ? s : serialize(value);
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Parse a JSON string into a JsonNode tree.
     *
     * @throws JsonProcessingException if the text is not exactly one JSON value
     */
    public static JsonNode parse(final String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    /**
     * Convert an arbitrary value (maps, lists, records) into a JsonNode tree.
     */
    public static JsonNode toTree(final Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Convert a JsonNode into plain Java values (Map, List, String, Number, Boolean).
     */
    public static Object toPlain(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return MAPPER.convertValue(node, Object.class);
    }

    public static ObjectNode createObject() {
        return MAPPER.createObjectNode();
    }
}
