package com.insights.mcp.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw gateway answer: the response header and its payload.
 */
public record AggregationResult(JsonNode header, JsonNode payload) {}
