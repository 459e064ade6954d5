package com.insights.mcp.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request parameters restricted to a tool's allow-list, plus the keys that were removed.
 */
public record SanitizedRequest(Map<String, JsonNode> params, List<String> droppedKeys) {

    public SanitizedRequest {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        droppedKeys = List.copyOf(droppedKeys);
    }

    /** Present and not JSON null. */
    public boolean has(String key) {
        final JsonNode node = params.get(key);
        return node != null && !node.isNull();
    }

    public JsonNode get(String key) {
        return params.get(key);
    }
}
