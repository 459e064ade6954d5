package com.insights.mcp.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class UsageStatsTest {

    private static TelemetryEntry entry(String timestamp, String tool, double responseMb, Double durationMs) {
        return new TelemetryEntry(timestamp, tool, 0.5, responseMb, durationMs, Map.of());
    }

    @Test
    void testAggregate_TotalsMatchPerToolCounts() {
        final List<TelemetryEntry> entries = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            entries.add(entry("2026-02-0" + (i % 9 + 1) + "T00:00:00Z", i % 3 == 0 ? "insights_get_meta" : "insights_get_data", 1.0, 10.0));
        }

        final UsageReport report = UsageStats.aggregate(entries);

        assertEquals(7, report.totalCalls());
        assertEquals(7, report.byTool().values().stream().mapToInt(ToolUsage::calls).sum());
        assertEquals(2, report.byTool().size());
        assertEquals(3.5, report.totalQueryMb(), 1e-9);
        assertEquals(7.0, report.totalResponseMb(), 1e-9);
        assertEquals(10.5, report.combinedMb(), 1e-9);
    }

    @Test
    void testAggregate_PerToolFigures() {
        final UsageReport report = UsageStats.aggregate(List.of(
            entry("2026-02-01T00:00:00Z", "insights_get_data", 1.0, 100.0),
            entry("2026-02-02T00:00:00Z", "insights_get_data", 3.0, null),
            entry("2026-02-03T00:00:00Z", "insights_get_meta", 0.25, 40.0)));

        final ToolUsage data = report.byTool().get("insights_get_data");
        assertEquals(2, data.calls());
        assertEquals(4.0, data.totalResponseMb(), 1e-9);
        assertEquals(2.0, data.avgResponseMb(), 1e-9);
        assertEquals(3.0, data.maxResponseMb(), 1e-9);
        assertEquals(100.0, data.avgDurationMs(), 1e-9);
        assertEquals(List.of("insights_get_data", "insights_get_meta"), List.copyOf(report.byTool().keySet()));
        assertEquals(Optional.of("2026-02-01T00:00:00Z"), report.firstTimestamp());
        assertEquals(Optional.of("2026-02-03T00:00:00Z"), report.lastTimestamp());
    }

    @Test
    void testAggregate_Empty() {
        final UsageReport report = UsageStats.aggregate(List.of());

        assertEquals(0, report.totalCalls());
        assertTrue(report.byTool().isEmpty());
        assertEquals(Optional.empty(), report.firstTimestamp());
    }

    @Test
    void testFilter_SinceAndTool() {
        final List<TelemetryEntry> entries = List.of(
            entry("2026-01-31T23:59:59Z", "insights_get_data", 1, 1.0),
            entry("2026-02-01T00:00:00Z", "insights_get_data", 1, 1.0),
            entry("2026-02-01T08:00:00", "insights_get_meta", 1, 1.0),
            entry("not a date", "insights_get_data", 1, 1.0));

        final UsageFilter since = new UsageFilter(Optional.of(Instant.parse("2026-02-01T00:00:00Z")), Optional.empty());
        assertEquals(2, since.apply(entries).size());

        final UsageFilter tool = new UsageFilter(Optional.empty(), Optional.of("insights_get_data"));
        assertEquals(3, tool.apply(entries).size());

        assertEquals(4, UsageFilter.all().apply(entries).size());
    }
}
