package com.insights.mcp.params;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.utils.Json;

/**
 * Drops every request key that is not on the tool's allow-list.
 * This is the only place unknown client fields are neutralized before they could reach the gateway.
 */
public class AllowListSanitizer {
    private static final Logger LOG = LogManager.getLogger(AllowListSanitizer.class);

    /**
     * Parse the raw query text and sanitize it.
     *
     * @param rawJson the JSON text supplied by the caller
     * @param allowList keys the tool accepts
     * @throws InvalidInputException if the text is not valid JSON or not a JSON object
     */
    public SanitizedRequest sanitize(String rawJson, Set<String> allowList) throws InvalidInputException {
        if (rawJson == null) {
            throw new InvalidInputException("query must be valid JSON: no input");
        }
        final JsonNode raw;
        try {
            raw = Json.parse(rawJson);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("query must be valid JSON: " + e.getOriginalMessage(), e);
        }
        return sanitize(raw, allowList);
    }

    /**
     * Sanitize an already parsed request.
     *
     * @throws InvalidInputException if the value is not a JSON object
     */
    public SanitizedRequest sanitize(JsonNode raw, Set<String> allowList) throws InvalidInputException {
        if (raw == null || !raw.isObject()) {
            throw new InvalidInputException("query JSON must be an object (dictionary)");
        }

        final Map<String, JsonNode> kept = new LinkedHashMap<>();
        final List<String> dropped = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = raw.fields(); it.hasNext(); ) {
            final Map.Entry<String, JsonNode> field = it.next();
            if (allowList.contains(field.getKey())) {
                kept.put(field.getKey(), field.getValue());
            } else {
                dropped.add(field.getKey());
            }
        }

        if (!dropped.isEmpty()) {
            LOG.debug("Dropped unsupported params: {}", dropped);
        }
        return new SanitizedRequest(kept, dropped);
    }
}
