package com.insights.mcp.telemetry;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

/**
 * The telemetry log file: a pretty-printed JSON array of {@link TelemetryEntry}.
 *
 * <p>Every read-modify-write runs under an in-process lock for the path and an OS lock on a
 * {@code <log>.lock} sidecar, so a server and a CLI process never interleave. Writes go to a
 * sibling temp file that is then moved over the log.
 */
public class TelemetryLog {
    private static final Logger LOG = LogManager.getLogger(TelemetryLog.class);
    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();
    private static final Type ENTRY_LIST = new TypeToken<List<TelemetryEntry>>() {}.getType();

    static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        // summary numbers are written back exactly as read
        .setObjectToNumberStrategy(ToNumberPolicy.LAZILY_PARSED_NUMBER)
        .create();

    private final Path path;

    public TelemetryLog(Path path) {
        this.path = path.toAbsolutePath().normalize();
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Work done while holding the log's locks.
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws TelemetryException;
    }

    /**
     * Run {@code action} inside the log's critical section.
     */
    public <T> T withLock(LockedAction<T> action) throws TelemetryException {
        final ReentrantLock lock = LOCKS.computeIfAbsent(path, p -> new ReentrantLock());
        lock.lock();
        try {
            final Path lockFile = path.resolveSibling(path.getFileName() + ".lock");
            createParentDirectories();
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            } catch (IOException e) {
                throw new TelemetryException("Cannot lock telemetry log " + lockFile + ": " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * All entries in file order. A missing or empty file has none.
     *
     * @throws TelemetryException if the file cannot be read or is not a JSON array of entries
     */
    public List<TelemetryEntry> read() throws TelemetryException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        final String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TelemetryException("Cannot read telemetry log " + path + ": " + e.getMessage(), e);
        }
        if (text.isBlank()) {
            return new ArrayList<>();
        }
        try {
            final List<TelemetryEntry> entries = GSON.fromJson(text, ENTRY_LIST);
            return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
        } catch (JsonParseException e) {
            throw new TelemetryException("Telemetry log " + path + " is corrupt: " + e.getMessage(), e);
        }
    }

    /**
     * Replace the log's contents. Callers hold the lock.
     */
    public void write(List<TelemetryEntry> entries) throws TelemetryException {
        final Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            createParentDirectories();
            Files.writeString(temp, GSON.toJson(entries, ENTRY_LIST), StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to replace", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TelemetryException("Cannot write telemetry log " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Add one entry. Nothing is written if the existing log cannot be parsed.
     */
    public void append(TelemetryEntry entry) throws TelemetryException {
        withLock(() -> {
            final List<TelemetryEntry> entries = read();
            entries.add(entry);
            write(entries);
            return null;
        });
    }

    private void createParentDirectories() throws TelemetryException {
        final Path parent = path.getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new TelemetryException("Cannot create telemetry directory " + parent + ": " + e.getMessage(), e);
        }
    }
}
