package com.insights.mcp.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized count-by request, forwarded to the gateway's countBy aggregation.
 */
public record CountByCall(
        String table,
        List<String> byCols,
        String startTS,
        String endTS,
        OneOrMany<Integer> limit) implements CallDescriptor {

    public static final String TOOL_NAME = "insights_get_countby";

    public CountByCall {
        byCols = List.copyOf(byCols);
    }

    @Override
    public String toolName() {
        return TOOL_NAME;
    }

    @Override
    public Map<String, Object> toUpstreamParams() {
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("table", table);
        params.put("byCols", byCols);
        params.put("startTS", startTS);
        params.put("endTS", endTS);
        params.put("limit", limit.toUpstream());
        return params;
    }
}
