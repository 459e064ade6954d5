package com.insights.mcp.services;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.insights.mcp.api.McpTool;
import com.insights.mcp.api.Param;
import com.insights.mcp.model.ToolResponse;
import com.insights.mcp.params.ToolSchemas;
import com.insights.mcp.utils.Json;

/**
 * The query tools exposed over MCP. Each one hands its raw arguments to the {@link QueryPipeline}
 * and never throws.
 */
public class InsightsTools {
    private final QueryPipeline pipeline;

    public InsightsTools(QueryPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @McpTool(post = true, responseType = ToolResponse.class, guidance = "insights-get-data", description = """
        Fetch rows from a data-engine table with the get_data API. The query is a JSON object; \
        'table' is required, unknown keys are dropped and reported back in dropped_params. \
        start_time and end_time default to the last 15 minutes.""")
    public ToolResponse insightsGetData(
            @Param("JSON object with table, start_time, end_time, input_timezone, output_timezone, filter, "
                + "group_by, aggregations, fill, temporality, slice, sort_columns, labels and limit") String query) {
        return pipeline.run(ToolSchemas.GET_DATA, query);
    }

    @McpTool(responseType = ToolResponse.class, guidance = "insights-get-meta", description = """
        Read the data-engine metadata. Returns the rows of one section: rc, dap, api, agg, assembly \
        or schema. For schema and assembly the rows can be restricted to one table.""")
    public ToolResponse insightsGetMeta(
            @Param(value = "Metadata section: rc, dap, api, agg, assembly or schema", defaultValue = "assembly") String key,
            @Param(value = "Only rows for this table (schema and assembly sections only)", defaultValue = "") String tbl) {
        final ObjectNode raw = Json.createObject();
        raw.put("key", key);
        if (tbl != null && !tbl.isEmpty()) {
            raw.put("tbl", tbl);
        }
        return pipeline.run(ToolSchemas.GET_META, raw);
    }

    @McpTool(post = true, responseType = ToolResponse.class, guidance = "insights-get-countby", description = """
        Count rows of a table grouped by one or more columns between two timestamps. The query is a \
        JSON object with table, byCols, startTS and endTS (all required) and an optional limit.""")
    public ToolResponse insightsGetCountby(
            @Param("JSON object with table, byCols, startTS, endTS and limit") String query) {
        return pipeline.run(ToolSchemas.COUNT_BY, query);
    }
}
