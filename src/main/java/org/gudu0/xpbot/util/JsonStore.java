package org.gudu0.xpbot.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * One JSON file on disk, written atomically (temp file + move) whenever the owner marked it dirty.
 * <p>
 * The value written is pulled from {@code snapshotSupplier} while holding {@link #lock}, so owners
 * that mutate their state under the same lock never get a half-applied update on disk.
 */
public class JsonStore<T> {
    public final Object lock = new Object();

    private final Path path;
    private final ObjectMapper om;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "JsonStore-autoflush");
        t.setDaemon(true);
        return t;
    });

    private final Class<T> type;
    private final Supplier<T> snapshotSupplier;
    private final String nameForLogs;

    private volatile boolean dirty = false;

    public JsonStore(Path path, Class<T> type, Supplier<T> snapshotSupplier, String nameForLogs) {
        this.path = path;
        this.type = type;
        this.snapshotSupplier = snapshotSupplier;
        this.nameForLogs = nameForLogs;

        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void markDirty() {
        dirty = true;
    }

    /**
     * Reads the file. Empty when it does not exist or cannot be parsed; an unreadable file is
     * copied aside first so the next flush does not destroy it.
     */
    public Optional<T> load() {
        try {
            if (!Files.exists(path)) {
                ConsoleLog.warn("JsonStore", nameForLogs + " missing at " + path + ", starting fresh");
                return Optional.empty();
            }
            T value = om.readValue(path.toFile(), type);
            ConsoleLog.info("JsonStore", "Loaded " + nameForLogs + " from " + path);
            return Optional.ofNullable(value);
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", "Failed to load " + nameForLogs + ", starting fresh: " + e.getMessage(), e);
            backupUnreadable();
            return Optional.empty();
        }
    }

    public void startAutoFlush(long periodSeconds) {
        scheduler.scheduleAtFixedRate(this::tryFlush, periodSeconds, periodSeconds, TimeUnit.SECONDS);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            try {
                flushNow();
                ConsoleLog.info("JsonStore", "Final flush of " + nameForLogs + " done");
            } catch (Exception e) {
                ConsoleLog.error("JsonStore", "Final flush of " + nameForLogs + " failed: " + e.getMessage(), e);
            }
        }, "JsonStore-shutdown"));
    }

    public void tryFlush() {
        if (!dirty) return;
        try {
            flushNow();
        } catch (Exception e) {
            // Previous file is untouched; still dirty, so the next cycle retries.
            ConsoleLog.error("JsonStore", nameForLogs + " flush failed: " + e.getMessage(), e);
        }
    }

    public void flushNow() throws IOException {
        synchronized (lock) {
            if (!dirty) return;

            ConsoleLog.debug("JsonStore", "Flushing " + nameForLogs + " -> " + path);

            Files.createDirectories(path.toAbsolutePath().getParent());
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");

            om.writeValue(tmp.toFile(), snapshotSupplier.get());
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                ConsoleLog.warn("JsonStore", "Atomic move unsupported for " + path + ", falling back to replace");
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }

            dirty = false;

            ConsoleLog.debug("JsonStore", "Flushed " + nameForLogs);
        }
    }

    private void backupUnreadable() {
        try {
            Path backup = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            ConsoleLog.warn("JsonStore", "Kept unreadable " + nameForLogs + " as " + backup);
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", "Could not back up unreadable " + nameForLogs + ": " + e.getMessage(), e);
        }
    }
}
