package com.insights.mcp.services;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.insights.mcp.client.AggregationResult;
import com.insights.mcp.client.InsightsClient;
import com.insights.mcp.client.UpstreamException;
import com.insights.mcp.model.CallDescriptor;
import com.insights.mcp.model.CountByCall;
import com.insights.mcp.model.GetDataCall;
import com.insights.mcp.model.GetMetaCall;
import com.insights.mcp.model.MetaKey;
import com.insights.mcp.model.QueryResult;

/**
 * Sends a call descriptor to the data engine. The only class that talks to the {@link InsightsClient}.
 * Never retries.
 */
public class CallExecutor {
    private static final Logger LOG = LogManager.getLogger(CallExecutor.class);

    private final InsightsClient client;
    private final String countByAggregation;

    /**
     * @param client             connection to the data engine
     * @param countByAggregation name of the aggregation that serves count-by calls
     */
    public CallExecutor(InsightsClient client, String countByAggregation) {
        this.client = client;
        this.countByAggregation = countByAggregation;
    }

    /**
     * @throws UpstreamException if the engine call fails or answers with an unexpected shape
     */
    public QueryResult execute(CallDescriptor call) throws UpstreamException {
        LOG.debug("Executing {}", call.toolName());
        try {
            if (call instanceof GetDataCall data) {
                return QueryResult.of(client.getData(data.table(), data.toUpstreamParams()));
            }
            if (call instanceof CountByCall countBy) {
                return countBy(countBy);
            }
            if (call instanceof GetMetaCall meta) {
                return QueryResult.of(selectMeta(client.getMeta(), meta));
            }
        } catch (RuntimeException e) {
            throw new UpstreamException("Data engine call failed: " + e.getMessage(), e);
        }
        throw new IllegalArgumentException("Unsupported call: " + call.getClass().getSimpleName());
    }

    private QueryResult countBy(CountByCall call) throws UpstreamException {
        final AggregationResult result = client.invokeCustomAggregation(countByAggregation, call.toUpstreamParams());
        final JsonNode payload = result.payload();
        if (payload == null || !payload.isArray()) {
            throw new UpstreamException("Unexpected " + countByAggregation + " payload: expected a list of records");
        }
        final List<JsonNode> rows = new ArrayList<>(payload.size());
        payload.forEach(rows::add);
        return QueryResult.of(rows);
    }

    /**
     * Rows of one meta section. An object section is a single row.
     */
    static List<JsonNode> selectMeta(JsonNode meta, GetMetaCall call) throws UpstreamException {
        final MetaKey key = call.key();
        final JsonNode section = meta == null ? null : meta.get(key.wireName());
        if (section == null || section.isNull()) {
            throw new UpstreamException("getMeta response has no '" + key.wireName() + "' section");
        }

        final List<JsonNode> rows = new ArrayList<>();
        if (section.isArray()) {
            section.forEach(rows::add);
        } else {
            rows.add(section);
        }

        if (call.table().isEmpty()) {
            return rows;
        }
        final String table = call.table().get();
        return rows.stream().filter(row -> mentionsTable(key, row, table)).toList();
    }

    private static boolean mentionsTable(MetaKey key, JsonNode row, String table) {
        if (key == MetaKey.SCHEMA) {
            return table.equals(row.path("table").asText(null));
        }
        for (JsonNode name : row.path("tbls")) {
            if (table.equals(name.asText())) {
                return true;
            }
        }
        return false;
    }
}
