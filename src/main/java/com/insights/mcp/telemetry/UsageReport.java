package com.insights.mcp.telemetry;

import java.util.Map;
import java.util.Optional;

/**
 * Totals over a set of log entries.
 *
 * @param byTool     per-tool usage, ordered by tool name
 * @param firstTimestamp timestamp of the first entry in log order
 * @param lastTimestamp  timestamp of the last entry in log order
 */
public record UsageReport(
    int totalCalls,
    double totalQueryMb,
    double totalResponseMb,
    Map<String, ToolUsage> byTool,
    Optional<String> firstTimestamp,
    Optional<String> lastTimestamp
) {
    public double combinedMb() {
        return totalQueryMb + totalResponseMb;
    }
}
