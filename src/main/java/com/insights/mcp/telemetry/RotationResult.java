package com.insights.mcp.telemetry;

import java.nio.file.Path;

/**
 * Outcome of one rotation.
 *
 * @param archive      byte-for-byte copy of the log taken before filtering
 * @param totalEntries entries in the log before filtering
 * @param keptEntries  entries left in the live log
 */
public record RotationResult(Path archive, int totalEntries, int keptEntries) {

    public int archivedEntries() {
        return totalEntries - keptEntries;
    }
}
