package com.insights.mcp.services;

import static com.insights.mcp.model.ToolResponse.MAX_ROWS_RETURNED;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.insights.mcp.model.QueryResult;
import com.insights.mcp.model.ToolResponse;

/**
 * Applies the row cap to query results and turns failures into error responses.
 *
 * <p>The cap is a local safety net that is independent of the {@code limit} forwarded upstream.
 * When the upstream answers with more rows than the cap, the condition is reported in the message
 * but the payload is passed through as returned.
 */
public class ResponseGovernor {
    private static final Logger LOG = LogManager.getLogger(ResponseGovernor.class);

    public static final String NO_ROWS_MESSAGE = "No rows returned";

    /**
     * @param result        rows returned by the executor
     * @param droppedParams keys removed by the sanitizer; reported only on the untruncated path
     */
    public ToolResponse govern(QueryResult result, List<String> droppedParams) {
        final int total = result.rowCount();
        if (total == 0) {
            return ToolResponse.success(List.of(), NO_ROWS_MESSAGE);
        }

        if (total > MAX_ROWS_RETURNED) {
            LOG.info("Table has {} rows. Query returned truncated data to {} rows.", total, MAX_ROWS_RETURNED);
            return ToolResponse.success(result.rows(), truncationMessage(total));
        }

        LOG.info("Query returned {} rows.", total);
        return ToolResponse.successWithDropped(result.rows(), droppedParams);
    }

    /**
     * The single place a failure becomes a response. Nothing thrown by a pipeline stage reaches a caller.
     */
    public ToolResponse fail(Throwable cause) {
        final String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        LOG.error("Query failed: {}", message);
        return ToolResponse.error(message);
    }

    static String truncationMessage(int total) {
        return "Showing first " + MAX_ROWS_RETURNED + " of " + total + " rows";
    }
}
