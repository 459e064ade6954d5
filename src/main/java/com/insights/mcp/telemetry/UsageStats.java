package com.insights.mcp.telemetry;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregates telemetry entries into a {@link UsageReport}.
 */
public final class UsageStats {

    private UsageStats() {}

    public static UsageReport aggregate(List<TelemetryEntry> entries) {
        final Map<String, Accumulator> perTool = new TreeMap<>();
        double totalQuery = 0;
        double totalResponse = 0;
        for (TelemetryEntry entry : entries) {
            totalQuery += entry.querySizeMb();
            totalResponse += entry.responseSizeMb();
            perTool.computeIfAbsent(String.valueOf(entry.tool()), k -> new Accumulator()).add(entry);
        }

        final Map<String, ToolUsage> byTool = new TreeMap<>();
        perTool.forEach((tool, acc) -> byTool.put(tool, acc.toUsage(tool)));

        return new UsageReport(
            entries.size(),
            totalQuery,
            totalResponse,
            Collections.unmodifiableMap(byTool),
            entries.isEmpty() ? Optional.empty() : Optional.ofNullable(entries.get(0).timestamp()),
            entries.isEmpty() ? Optional.empty() : Optional.ofNullable(entries.get(entries.size() - 1).timestamp()));
    }

    private static final class Accumulator {
        int calls;
        double totalQuery;
        double totalResponse;
        double maxResponse;
        double totalDuration;
        int timedCalls;

        void add(TelemetryEntry entry) {
            calls++;
            totalQuery += entry.querySizeMb();
            totalResponse += entry.responseSizeMb();
            maxResponse = Math.max(maxResponse, entry.responseSizeMb());
            if (entry.durationMs() != null) {
                totalDuration += entry.durationMs();
                timedCalls++;
            }
        }

        ToolUsage toUsage(String tool) {
            return new ToolUsage(tool, calls, totalQuery, totalResponse,
                totalResponse / calls, maxResponse,
                timedCalls == 0 ? 0 : totalDuration / timedCalls);
        }
    }
}
