package com.insights.mcp.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Maintenance commands for the telemetry log.
 *
 * <ul>
 *   <li>{@code rotate} archives the log and keeps recent entries</li>
 *   <li>{@code view-stats} prints a size and duration summary</li>
 * </ul>
 */
@Command(
        name = "insights-stats",
        description = "Inspect and trim the Insights MCP telemetry log",
        mixinStandardHelpOptions = true,
        subcommands = {RotateCommand.class, ViewStatsCommand.class})
public class InsightsStatsCli {

    public static final String DEFAULT_LOG_FILE = "insights_size_log.json";

    public static CommandLine commandLine() {
        return new CommandLine(new InsightsStatsCli());
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
