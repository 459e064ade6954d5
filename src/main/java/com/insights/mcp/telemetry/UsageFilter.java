package com.insights.mcp.telemetry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Selects log entries for reporting. Entries without a readable timestamp never match a since bound.
 */
public record UsageFilter(Optional<Instant> since, Optional<String> tool) {

    public static UsageFilter all() {
        return new UsageFilter(Optional.empty(), Optional.empty());
    }

    public List<TelemetryEntry> apply(List<TelemetryEntry> entries) {
        return entries.stream()
            .filter(e -> since.isEmpty() || e.instant().map(t -> !t.isBefore(since.get())).orElse(false))
            .filter(e -> tool.isEmpty() || tool.get().equals(e.tool()))
            .toList();
    }
}
