package com.insights.mcp.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;

import com.insights.mcp.telemetry.LogRotator;
import com.insights.mcp.telemetry.RotationResult;
import com.insights.mcp.telemetry.TelemetryException;
import com.insights.mcp.telemetry.TelemetryLog;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Archives the telemetry log to {@code <stem>_<yyyyMMdd_HHmmss>.json} and keeps only recent
 * entries in the live file.
 *
 * <pre>
 * insights-stats rotate --log-file insights_size_log.json --keep-days 7
 * </pre>
 */
@Command(name = "rotate", description = "Archive the log and drop entries older than --keep-days")
public class RotateCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = "--log-file", defaultValue = InsightsStatsCli.DEFAULT_LOG_FILE,
            description = "Log file path (default: ${DEFAULT-VALUE})")
    Path logFile;

    @Option(names = "--keep-days", defaultValue = "30",
            description = "Number of days to keep (default: ${DEFAULT-VALUE})")
    int keepDays;

    LogRotator rotator = new LogRotator();

    @Override
    public void run() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        if (keepDays < 0) {
            err.println("--keep-days must not be negative");
            return;
        }
        try {
            final Optional<RotationResult> result = rotator.rotate(new TelemetryLog(logFile), keepDays);
            if (result.isEmpty()) {
                out.println("No log file found at " + logFile);
                return;
            }
            out.println("Archived " + result.get().archivedEntries() + " old entries");
            out.println("Archive written to " + result.get().archive());
        } catch (TelemetryException e) {
            err.println("Rotation failed: " + e.getMessage());
        }
    }
}
