package io.rolloutkit.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RolloutKitConfig {
    public static final String ENV_PLAYBACK_FILE = "EP_PLAYBACK_FILE";
    public static final String ENV_MAX_RETRY = "EP_MAX_RETRY";
    public static final String ENV_SQLITE_LOG = "EP_SQLITE_LOG";
    public static final String SETTINGS_FILE = "rolloutkit-settings.json";

    public static final int DEFAULT_MAX_CONCURRENCY = 8;
    public static final int DEFAULT_MAX_STEPS = 512;
    public static final int DEFAULT_MAX_RETRY = 0;
    public static final long DEFAULT_CONTROL_PLANE_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_WATCHER_INTERVAL_MS = 1_000L;
    public static final int DEFAULT_WATCHER_MAX_EMPTY_SCANS = 3;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_LOCK_POLL_MS = 100L;
    public static final long DEFAULT_LOCK_MAX_POLL_MS = 1_000L;
    public static final String WATCHER_LOCK_NAME = "eval_watcher";

    private final Path rootDir;

    public RolloutKitConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static RolloutKitConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new RolloutKitConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path datasetsDir() {
        return rootDir.resolve("datasets");
    }

    public Path sqliteFile() {
        return rootDir.resolve("rows.db");
    }

    public Path locksDir() {
        return rootDir.resolve("locks");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path recordingsDir() {
        return rootDir.resolve("recordings");
    }
}
