package com.insights.mcp.telemetry;

/**
 * Per-tool totals. Sizes in MiB.
 *
 * @param avgDurationMs mean over the calls that recorded a duration, 0 when none did
 */
public record ToolUsage(
    String tool,
    int calls,
    double totalQueryMb,
    double totalResponseMb,
    double avgResponseMb,
    double maxResponseMb,
    double avgDurationMs
) {}
