package com.insights.mcp.telemetry;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * One recorded tool call. Field names map to the log's snake_case keys.
 *
 * @param timestamp      ISO-8601 instant of the call, UTC
 * @param querySummary   compact rendering of the call arguments
 */
public record TelemetryEntry(
    String timestamp,
    String tool,
    double querySizeMb,
    double responseSizeMb,
    Double durationMs,
    Map<String, Object> querySummary
) {
    /**
     * Parsed timestamp. Entries written without a zone are read as UTC.
     */
    public Optional<Instant> instant() {
        if (timestamp == null) return Optional.empty();
        try {
            return Optional.of(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(timestamp).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
