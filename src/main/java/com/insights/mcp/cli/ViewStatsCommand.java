package com.insights.mcp.cli;

import static com.insights.mcp.cli.SizeFormat.formatMb;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.insights.mcp.telemetry.TelemetryEntry;
import com.insights.mcp.telemetry.TelemetryException;
import com.insights.mcp.telemetry.TelemetryLog;
import com.insights.mcp.telemetry.ToolUsage;
import com.insights.mcp.telemetry.UsageFilter;
import com.insights.mcp.telemetry.UsageReport;
import com.insights.mcp.telemetry.UsageStats;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Prints call counts and payload sizes from the telemetry log, per tool and overall.
 *
 * <pre>
 * insights-stats view-stats --since 2024-05-01 --tool insights_get_data --detail
 * </pre>
 */
@Command(name = "view-stats", description = "Summarize tool call sizes from the log")
public class ViewStatsCommand implements Runnable {
    static final int DETAIL_ENTRIES = 20;
    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    @Spec
    CommandSpec spec;

    @Option(names = "--log-file", defaultValue = InsightsStatsCli.DEFAULT_LOG_FILE,
            description = "Log file path (default: ${DEFAULT-VALUE})")
    Path logFile;

    @Option(names = "--since", converter = SinceConverter.class,
            description = "Only entries at or after this date (YYYY-MM-DD, UTC) or ISO-8601 timestamp")
    Instant since;

    @Option(names = "--tool", description = "Only entries for this tool")
    String tool;

    @Option(names = "--detail", description = "Also print the last " + DETAIL_ENTRIES + " entries")
    boolean detail;

    @Override
    public void run() {
        final PrintWriter out = spec.commandLine().getOut();
        final TelemetryLog log = new TelemetryLog(logFile);
        if (!log.exists()) {
            out.println("No log file found at " + logFile);
            return;
        }

        final List<TelemetryEntry> entries;
        try {
            entries = new UsageFilter(Optional.ofNullable(since), Optional.ofNullable(tool)).apply(log.read());
        } catch (TelemetryException e) {
            spec.commandLine().getErr().println("Cannot read log: " + e.getMessage());
            return;
        }
        if (entries.isEmpty()) {
            out.println("No matching logs found");
            return;
        }

        printSummary(out, UsageStats.aggregate(entries));
        if (detail) {
            printDetail(out, entries.subList(Math.max(0, entries.size() - DETAIL_ENTRIES), entries.size()));
        }
    }

    private static void printSummary(PrintWriter out, UsageReport report) {
        out.println(RULE);
        out.println("MCP API CALL SIZE SUMMARY");
        out.println(RULE);
        out.println("Total calls: " + report.totalCalls());
        out.println("Date range: " + day(report.firstTimestamp()) + " to " + day(report.lastTimestamp()));
        out.println();

        out.println("BY TOOL:");
        out.println(THIN_RULE);
        for (ToolUsage usage : report.byTool().values()) {
            out.println();
            out.println(usage.tool() + ":");
            out.println("  Calls:            " + usage.calls());
            out.println("  Total Query:      " + formatMb(usage.totalQueryMb()));
            out.println("  Total Response:   " + formatMb(usage.totalResponseMb()));
            out.println("  Avg Response:     " + formatMb(usage.avgResponseMb()));
            out.println("  Max Response:     " + formatMb(usage.maxResponseMb()));
            if (usage.avgDurationMs() > 0) {
                out.println(String.format(Locale.ROOT, "  Avg Duration:     %.0f ms", usage.avgDurationMs()));
            }
        }

        out.println();
        out.println(RULE);
        out.println("OVERALL TOTALS:");
        out.println("  Total Query Data:    " + formatMb(report.totalQueryMb()));
        out.println("  Total Response Data: " + formatMb(report.totalResponseMb()));
        out.println("  Combined:            " + formatMb(report.combinedMb()));
        out.println(RULE);
    }

    private static void printDetail(PrintWriter out, List<TelemetryEntry> entries) {
        out.println();
        out.println("DETAILED LOGS:");
        out.println(THIN_RULE);
        for (TelemetryEntry entry : entries) {
            out.println();
            out.println(entry.timestamp());
            out.println("  Tool:     " + entry.tool());
            out.println("  Query:    " + formatMb(entry.querySizeMb()));
            out.println("  Response: " + formatMb(entry.responseSizeMb()));
            if (entry.querySummary() != null && !entry.querySummary().isEmpty()) {
                out.println("  Summary:  " + entry.querySummary());
            }
            if (entry.durationMs() != null && entry.durationMs() > 0) {
                out.println(String.format(Locale.ROOT, "  Duration: %.0f ms", entry.durationMs()));
            }
        }
    }

    private static String day(Optional<String> timestamp) {
        return timestamp.map(t -> t.length() >= 10 ? t.substring(0, 10) : t).orElse("?");
    }
}
