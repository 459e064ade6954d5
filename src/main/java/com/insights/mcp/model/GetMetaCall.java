package com.insights.mcp.model;

import java.util.Map;
import java.util.Optional;

/**
 * Normalized get_meta request: which meta section to return, optionally narrowed to one table.
 */
public record GetMetaCall(MetaKey key, Optional<String> table) implements CallDescriptor {

    public static final String TOOL_NAME = "insights_get_meta";

    @Override
    public String toolName() {
        return TOOL_NAME;
    }

    /** getMeta takes no arguments; key and table are applied to the response. */
    @Override
    public Map<String, Object> toUpstreamParams() {
        return Map.of();
    }
}
