package io.rolloutkit.config;

import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Engine tunables resolved from {@code rolloutkit-settings.json} under the data root,
 * then from the environment. Missing or out-of-range values fall back to defaults.
 */
public record EngineSettings(
        int maxConcurrency,
        int maxSteps,
        int maxRetry,
        long controlPlaneTimeoutMs,
        long watcherIntervalMs,
        int watcherMaxEmptyScans,
        long lockTimeoutMs,
        RowStoreKind rowStore
) {
    public enum RowStoreKind {
        JSONL,
        SQLITE
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                RolloutKitConfig.DEFAULT_MAX_CONCURRENCY,
                RolloutKitConfig.DEFAULT_MAX_STEPS,
                RolloutKitConfig.DEFAULT_MAX_RETRY,
                RolloutKitConfig.DEFAULT_CONTROL_PLANE_TIMEOUT_MS,
                RolloutKitConfig.DEFAULT_WATCHER_INTERVAL_MS,
                RolloutKitConfig.DEFAULT_WATCHER_MAX_EMPTY_SCANS,
                RolloutKitConfig.DEFAULT_LOCK_TIMEOUT_MS,
                RowStoreKind.JSONL
        );
    }

    public static EngineSettings load(RolloutKitConfig config) {
        return load(config, System.getenv());
    }

    public static EngineSettings load(RolloutKitConfig config, Map<String, String> env) {
        EngineSettings resolved = fromFile(readFile(config.settingsFile()), defaults());
        return resolved.withEnvironment(env);
    }

    static SettingsFile readFile(Path cfg) {
        if (!Files.exists(cfg)) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(cfg.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + cfg, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new EngineSettings(
                sanitizeInt(file.maxConcurrency(), defaults.maxConcurrency(), 1),
                sanitizeInt(file.maxSteps(), defaults.maxSteps(), 1),
                sanitizeInt(file.maxRetry(), defaults.maxRetry(), 0),
                sanitizeLong(file.controlPlaneTimeoutMs(), defaults.controlPlaneTimeoutMs(), 100L),
                sanitizeLong(file.watcherIntervalMs(), defaults.watcherIntervalMs(), 10L),
                sanitizeInt(file.watcherMaxEmptyScans(), defaults.watcherMaxEmptyScans(), 1),
                sanitizeLong(file.lockTimeoutMs(), defaults.lockTimeoutMs(), 0L),
                parseRowStore(file.rowStore(), defaults.rowStore())
        );
    }

    public EngineSettings withEnvironment(Map<String, String> env) {
        int retry = maxRetry;
        String rawRetry = env.get(RolloutKitConfig.ENV_MAX_RETRY);
        if (rawRetry != null && !rawRetry.isBlank()) {
            try {
                retry = Math.max(0, Integer.parseInt(rawRetry.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(RolloutKitConfig.ENV_MAX_RETRY + " must be an integer: " + rawRetry, e);
            }
        }
        RowStoreKind kind = rowStore;
        String sqlite = env.get(RolloutKitConfig.ENV_SQLITE_LOG);
        if (sqlite != null && !sqlite.isBlank() && !"0".equals(sqlite.trim()) && !"false".equalsIgnoreCase(sqlite.trim())) {
            kind = RowStoreKind.SQLITE;
        }
        return new EngineSettings(maxConcurrency, maxSteps, retry, controlPlaneTimeoutMs,
                watcherIntervalMs, watcherMaxEmptyScans, lockTimeoutMs, kind);
    }

    private static RowStoreKind parseRowStore(String raw, RowStoreKind fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return RowStoreKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Integer maxConcurrency,
            Integer maxSteps,
            Integer maxRetry,
            Long controlPlaneTimeoutMs,
            Long watcherIntervalMs,
            Integer watcherMaxEmptyScans,
            Long lockTimeoutMs,
            String rowStore
    ) {
    }
}
