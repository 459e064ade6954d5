package com.insights.mcp.telemetry;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.insights.mcp.utils.Json;

/**
 * Records the payload size and duration of each tool call in a {@link TelemetryLog}.
 * Recording is best-effort: a failure is logged and never reaches the tool caller.
 */
public class TelemetryLogger {
    private static final Logger LOG = LogManager.getLogger(TelemetryLogger.class);

    static final double BYTES_PER_MB = 1024.0 * 1024.0;
    static final int SUMMARY_MAX_CHARS = 100;

    private final TelemetryLog log;
    private final Clock clock;

    public TelemetryLogger(Path logFile) {
        this(new TelemetryLog(logFile), Clock.systemUTC());
    }

    public TelemetryLogger(TelemetryLog log, Clock clock) {
        this.log = log;
        this.clock = clock;
    }

    public TelemetryLog getLog() {
        return log;
    }

    /**
     * Append one entry for a finished call.
     *
     * @param query      the arguments the tool was called with
     * @param response   the value the tool returned
     * @param durationMs wall-clock duration of the call
     * @return the entry, whether or not it could be written
     */
    public TelemetryEntry logCall(String tool, Map<String, ?> query, Object response, double durationMs) {
        final TelemetryEntry entry = new TelemetryEntry(
            Instant.now(clock).toString(),
            tool,
            sizeMb(query),
            sizeMb(response),
            durationMs,
            summarize(query));
        try {
            log.append(entry);
        } catch (TelemetryException | RuntimeException e) {
            LOG.error("Failed to log size for {}: {}", tool, e.getMessage());
        }
        return entry;
    }

    /**
     * Aggregates over the whole log.
     */
    public UsageReport getStats(UsageFilter filter) throws TelemetryException {
        return UsageStats.aggregate(filter.apply(log.read()));
    }

    /** Size of the UTF-8 JSON form of {@code value}, in MiB. */
    public static double sizeMb(Object value) {
        return Json.utf8Size(value) / BYTES_PER_MB;
    }

    /**
     * Compact rendering of call arguments: long strings are cut, collections become their length.
     */
    public static Map<String, Object> summarize(Map<String, ?> query) {
        final Map<String, Object> summary = new LinkedHashMap<>();
        if (query == null) return summary;
        query.forEach((key, value) -> summary.put(key, summarizeValue(value)));
        return summary;
    }

    private static Object summarizeValue(Object value) {
        if (value instanceof String s && s.codePointCount(0, s.length()) > SUMMARY_MAX_CHARS) {
            return s.substring(0, s.offsetByCodePoints(0, SUMMARY_MAX_CHARS)) + "...";
        }
        if (value instanceof Collection<?> c) {
            return "<list len=" + c.size() + ">";
        }
        if (value instanceof Map<?, ?> m) {
            return "<dict len=" + m.size() + ">";
        }
        return value;
    }
}
