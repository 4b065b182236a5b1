package org.gudu0.xpbot.util;

import java.nio.file.Files;
import java.nio.file.Path;

public final class BotPaths {
    private BotPaths() {}

    public static final Path DATA = Path.of("data");
    public static final Path GLOBAL_DIR = DATA.resolve("global");

    public static final Path CONFIG_FILE = GLOBAL_DIR.resolve("config.json");
    public static final Path SNAPSHOT_FILE = GLOBAL_DIR.resolve("progress.json");

    /**
     * Creates the data directory tree. Without it nothing can be persisted,
     * so a failure here stops startup.
     */
    public static void ensureBaseDirs() {
        try {
            Files.createDirectories(GLOBAL_DIR);
            if (!Files.isWritable(GLOBAL_DIR)) {
                throw new IllegalStateException("Data dir is not writable: " + GLOBAL_DIR.toAbsolutePath());
            }
            ConsoleLog.info("BotPaths", "Ensured data dir: " + GLOBAL_DIR);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create data dir " + GLOBAL_DIR.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
