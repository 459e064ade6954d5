package com.insights.mcp.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.insights.mcp.telemetry.TelemetryEntry;
import com.insights.mcp.telemetry.TelemetryLog;

import picocli.CommandLine;

class InsightsStatsCliTest {

    @TempDir
    Path tempDir;

    private Path logFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        logFile = tempDir.resolve("insights_size_log.json");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        final CommandLine cli = InsightsStatsCli.commandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    private void writeLog(TelemetryEntry... entries) throws Exception {
        new TelemetryLog(logFile).write(List.of(entries));
    }

    private static TelemetryEntry entry(Instant at, String tool, double responseMb) {
        return new TelemetryEntry(at.toString(), tool, 0.0001, responseMb, 42.0, Map.of("query", "<dict len=1>"));
    }

    // =========================================================================
    // rotate
    // =========================================================================

    @Test
    void testRotate_MissingLog() {
        assertEquals(0, run("rotate", "--log-file", logFile.toString()));
        assertEquals("No log file found at " + logFile, out.toString().lines().findFirst().orElse(""));
    }

    @Test
    void testRotate_ReportsArchivedCount() throws Exception {
        final Instant now = Instant.now();
        writeLog(entry(now.minus(Duration.ofDays(10)), "insights_get_data", 0.1),
            entry(now.minus(Duration.ofDays(3)), "insights_get_data", 0.1));

        assertEquals(0, run("rotate", "--log-file", logFile.toString(), "--keep-days", "7"));

        assertTrue(out.toString().contains("Archived 1 old entries"));
        assertEquals(1, new TelemetryLog(logFile).read().size());
        try (var files = Files.list(tempDir)) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().matches("insights_size_log_\\d{8}_\\d{6}\\.json")));
        }
    }

    @Test
    void testRotate_CorruptLogStillExitsZero() throws Exception {
        Files.writeString(logFile, "nope");

        assertEquals(0, run("rotate", "--log-file", logFile.toString()));
        assertTrue(err.toString().startsWith("Rotation failed"));
    }

    // =========================================================================
    // view-stats
    // =========================================================================

    @Test
    void testViewStats_MissingLog() {
        assertEquals(0, run("view-stats", "--log-file", logFile.toString()));
        assertTrue(out.toString().startsWith("No log file found at "));
    }

    @Test
    void testViewStats_Summary() throws Exception {
        writeLog(entry(Instant.parse("2026-02-01T10:00:00Z"), "insights_get_data", 2.0),
            entry(Instant.parse("2026-02-03T10:00:00Z"), "insights_get_meta", 0.5));

        assertEquals(0, run("view-stats", "--log-file", logFile.toString()));

        final String text = out.toString();
        assertTrue(text.contains("MCP API CALL SIZE SUMMARY"));
        assertTrue(text.contains("Total calls: 2"));
        assertTrue(text.contains("Date range: 2026-02-01 to 2026-02-03"));
        assertTrue(text.contains("insights_get_data:"));
        assertTrue(text.contains("Max Response:     2.00 MB"));
        assertTrue(text.contains("Max Response:     512.00 KB"));
        assertTrue(text.contains("Avg Duration:     42 ms"));
        assertFalse(text.contains("DETAILED LOGS"));
    }

    @Test
    void testViewStats_SinceDateAndToolFilters() throws Exception {
        writeLog(entry(Instant.parse("2026-01-31T23:00:00Z"), "insights_get_data", 1),
            entry(Instant.parse("2026-02-01T00:00:00Z"), "insights_get_data", 1),
            entry(Instant.parse("2026-02-02T00:00:00Z"), "insights_get_meta", 1));

        run("view-stats", "--log-file", logFile.toString(), "--since", "2026-02-01", "--tool", "insights_get_data");

        assertTrue(out.toString().contains("Total calls: 1"));
    }

    @Test
    void testViewStats_NoMatches() throws Exception {
        writeLog(entry(Instant.parse("2026-01-01T00:00:00Z"), "insights_get_data", 1));

        assertEquals(0, run("view-stats", "--log-file", logFile.toString(), "--tool", "insights_get_countby"));
        assertEquals("No matching logs found", out.toString().strip());
    }

    @Test
    void testViewStats_DetailShowsLastTwentyEntries() throws Exception {
        final List<TelemetryEntry> entries = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            entries.add(entry(Instant.parse("2026-02-01T00:00:00Z").plusSeconds(i), "insights_get_data", 0.01));
        }
        writeLog(entries.toArray(TelemetryEntry[]::new));

        run("view-stats", "--log-file", logFile.toString(), "--detail");

        final String text = out.toString();
        assertTrue(text.contains("DETAILED LOGS:"));
        assertEquals(20, text.lines().filter(l -> l.startsWith("  Tool:     ")).count());
        assertFalse(text.contains("2026-02-01T00:00:04Z"));
        assertTrue(text.contains("2026-02-01T00:00:05Z"));
        assertTrue(text.contains("  Duration: 42 ms"));
    }

    @Test
    void testViewStats_CorruptLog() throws Exception {
        Files.writeString(logFile, "[{");

        assertEquals(0, run("view-stats", "--log-file", logFile.toString()));
        assertTrue(err.toString().startsWith("Cannot read log"));
    }

    // =========================================================================
    // helpers
    // =========================================================================

    @Test
    void testSinceConverter() {
        final SinceConverter converter = new SinceConverter();

        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), converter.convert("2026-02-01"));
        assertEquals(Instant.parse("2026-02-01T08:30:00Z"), converter.convert("2026-02-01T08:30:00Z"));
        assertEquals(Instant.parse("2026-02-01T08:30:00Z"), converter.convert("2026-02-01T08:30:00"));
    }

    @Test
    void testFormatMb() {
        assertEquals("512.00 KB", SizeFormat.formatMb(0.5));
        assertEquals("1.00 MB", SizeFormat.formatMb(1));
        assertEquals("0.00 KB", SizeFormat.formatMb(0));
    }
}
