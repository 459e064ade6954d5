package com.insights.mcp.telemetry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Archives the live telemetry log and trims it to recent entries.
 * The archive is copied first; the live log is only rewritten once the copy exists.
 * An existing archive is never overwritten: a second rotation within the same second gets a
 * numbered name such as {@code insights_size_log_20260211_123045_1.json}.
 */
public class LogRotator {
    private static final Logger LOG = LogManager.getLogger(LogRotator.class);

    public static final int DEFAULT_KEEP_DAYS = 30;
    static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public LogRotator() {
        this(Clock.systemDefaultZone());
    }

    public LogRotator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param keepDays entries older than this many days are dropped from the live log
     * @return empty if there is no log to rotate
     * @throws TelemetryException if the archive cannot be written or the log cannot be parsed
     */
    public Optional<RotationResult> rotate(TelemetryLog log, int keepDays) throws TelemetryException {
        if (keepDays < 0) {
            throw new IllegalArgumentException("keepDays must not be negative: " + keepDays);
        }
        return log.withLock(() -> {
            if (!log.exists()) {
                return Optional.empty();
            }
            final Path archive = archivePath(log.getPath());
            try {
                Files.copy(log.getPath(), archive);
            } catch (IOException e) {
                throw new TelemetryException("Cannot archive telemetry log to " + archive + ": " + e.getMessage(), e);
            }

            final List<TelemetryEntry> entries = log.read();
            final Instant cutoff = clock.instant().minus(Duration.ofDays(keepDays));
            // entries with an unreadable timestamp are kept
            final List<TelemetryEntry> recent = entries.stream()
                .filter(e -> e.instant().map(t -> !t.isBefore(cutoff)).orElse(true))
                .toList();
            log.write(recent);

            LOG.info("Rotated {} into {}: kept {} of {} entries", log.getPath(), archive, recent.size(), entries.size());
            return Optional.of(new RotationResult(archive, entries.size(), recent.size()));
        });
    }

    /**
     * First free name of the form {@code <stem>_<stamp>.json}, then {@code <stem>_<stamp>_1.json} and so on.
     * Callers hold the log's lock, so no other rotation can claim the name in between.
     */
    Path archivePath(Path logPath) {
        final String fileName = logPath.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        final String base = stem + "_" + ARCHIVE_STAMP.format(clock.instant().atZone(clock.getZone()));
        Path archive = logPath.resolveSibling(base + ".json");
        for (int n = 1; Files.exists(archive); n++) {
            archive = logPath.resolveSibling(base + "_" + n + ".json");
        }
        return archive;
    }
}
