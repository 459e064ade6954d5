package com.insights.mcp.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rows returned by the gateway, before the row cap is applied.
 */
public record QueryResult(int rowCount, List<JsonNode> rows) {

    public QueryResult {
        rows = List.copyOf(rows);
        if (rowCount != rows.size()) {
            throw new IllegalArgumentException("rowCount " + rowCount + " does not match " + rows.size() + " rows");
        }
    }

    public static QueryResult of(List<JsonNode> rows) {
        return new QueryResult(rows.size(), rows);
    }
}
