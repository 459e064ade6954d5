package com.insights.mcp.client;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Connection to the analytical data engine. Calls block until the engine answers;
 * reconnection policy belongs to the implementation.
 */
public interface InsightsClient {

    /**
     * Run get_data against a table.
     *
     * @param table  table name
     * @param params normalized keyword parameters
     * @return the returned records
     */
    List<JsonNode> getData(String table, Map<String, Object> params) throws UpstreamException;

    /**
     * Fetch the engine's metadata object, keyed by {@code rc, dap, api, agg, assembly, schema}.
     */
    JsonNode getMeta() throws UpstreamException;

    /**
     * Invoke a user-defined aggregation by name.
     */
    AggregationResult invokeCustomAggregation(String name, Map<String, Object> params) throws UpstreamException;
}
