package com.insights.mcp.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.InsightsException;
import com.insights.mcp.model.CallDescriptor;
import com.insights.mcp.model.QueryResult;
import com.insights.mcp.model.ToolResponse;
import com.insights.mcp.params.AllowListSanitizer;
import com.insights.mcp.params.ParamNormalizer;
import com.insights.mcp.params.SanitizedRequest;
import com.insights.mcp.params.ToolSchema;

/**
 * Sanitize, normalize, execute, govern. Input and validation failures stop the chain before any
 * upstream call; every failure comes back as an error response.
 */
public class QueryPipeline {
    private final AllowListSanitizer sanitizer;
    private final ParamNormalizer normalizer;
    private final CallExecutor executor;
    private final ResponseGovernor governor;

    public QueryPipeline(AllowListSanitizer sanitizer, ParamNormalizer normalizer,
                         CallExecutor executor, ResponseGovernor governor) {
        this.sanitizer = sanitizer;
        this.normalizer = normalizer;
        this.executor = executor;
        this.governor = governor;
    }

    /** Run a tool whose parameters arrive as one JSON text. */
    public ToolResponse run(ToolSchema schema, String rawQuery) {
        try {
            return process(schema, sanitizer.sanitize(rawQuery, schema.allowList()));
        } catch (InsightsException | RuntimeException e) {
            return governor.fail(e);
        }
    }

    /** Run a tool whose parameters were already assembled into a JSON object. */
    public ToolResponse run(ToolSchema schema, JsonNode rawRequest) {
        try {
            return process(schema, sanitizer.sanitize(rawRequest, schema.allowList()));
        } catch (InsightsException | RuntimeException e) {
            return governor.fail(e);
        }
    }

    private ToolResponse process(ToolSchema schema, SanitizedRequest request) throws InsightsException {
        final CallDescriptor call = normalizer.normalize(schema, request);
        final QueryResult result = executor.execute(call);
        return governor.govern(result, request.droppedKeys());
    }
}
