package com.insights.mcp.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The only shape a tool ever returns to its caller.
 * Serialized with null fields omitted, so an error carries just status and message.
 */
public record ToolResponse(
        @JsonProperty(required = true) String status,
        List<JsonNode> data,
        String message,
        List<String> droppedParams) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    /** Hard ceiling on rows surfaced to a caller, and the bound every limit is clamped into. */
    public static final int MAX_ROWS_RETURNED = 1000;

    public static ToolResponse success(List<JsonNode> data, String message) {
        return new ToolResponse(SUCCESS, data, message, null);
    }

    public static ToolResponse successWithDropped(List<JsonNode> data, List<String> droppedParams) {
        return new ToolResponse(SUCCESS, data, null, droppedParams);
    }

    public static ToolResponse error(String message) {
        return new ToolResponse(ERROR, null, message, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
