package io.rolloutkit.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void defaultsApplyWithoutFileOrEnvironment() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-settings-");
        try {
            EngineSettings settings = EngineSettings.load(RolloutKitConfig.fromRoot(root.toString()), Map.of());

            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertEquals(0, settings.maxRetry());
            Assertions.assertEquals(2_000L, settings.controlPlaneTimeoutMs());
            Assertions.assertEquals(3, settings.watcherMaxEmptyScans());
            Assertions.assertEquals(EngineSettings.RowStoreKind.JSONL, settings.rowStore());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitizedAndEnvironmentWins() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-settings-file-");
        try {
            RolloutKitConfig config = RolloutKitConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "maxConcurrency": 0,
                      "maxSteps": 12,
                      "maxRetry": 1,
                      "watcherIntervalMs": 250,
                      "rowStore": "sqlite",
                      "somethingElse": true
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(config, Map.of(RolloutKitConfig.ENV_MAX_RETRY, " 4 "));

            Assertions.assertEquals(1, settings.maxConcurrency());
            Assertions.assertEquals(12, settings.maxSteps());
            Assertions.assertEquals(4, settings.maxRetry());
            Assertions.assertEquals(250L, settings.watcherIntervalMs());
            Assertions.assertEquals(EngineSettings.RowStoreKind.SQLITE, settings.rowStore());
            Assertions.assertEquals(RolloutKitConfig.DEFAULT_LOCK_TIMEOUT_MS, settings.lockTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void environmentSwitchesRowStoreAndRejectsBadRetry() {
        EngineSettings defaults = EngineSettings.defaults();

        Assertions.assertEquals(EngineSettings.RowStoreKind.SQLITE,
                defaults.withEnvironment(Map.of(RolloutKitConfig.ENV_SQLITE_LOG, "true")).rowStore());
        Assertions.assertEquals(EngineSettings.RowStoreKind.JSONL,
                defaults.withEnvironment(Map.of(RolloutKitConfig.ENV_SQLITE_LOG, "0")).rowStore());
        Assertions.assertEquals(0, defaults.withEnvironment(Map.of(RolloutKitConfig.ENV_MAX_RETRY, "-3")).maxRetry());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> defaults.withEnvironment(Map.of(RolloutKitConfig.ENV_MAX_RETRY, "lots")));
    }

    @Test
    void pathsHangOffTheRoot() {
        RolloutKitConfig config = RolloutKitConfig.fromRoot("build/tmp-root");

        Assertions.assertTrue(config.rootDir().isAbsolute());
        Assertions.assertEquals(config.rootDir().resolve("datasets"), config.datasetsDir());
        Assertions.assertEquals(config.rootDir().resolve("audit").resolve("audit.log"), config.auditLogFile());
        Assertions.assertEquals(config.rootDir().resolve(RolloutKitConfig.SETTINGS_FILE), config.settingsFile());
        Assertions.assertEquals("data", RolloutKitConfig.fromRoot(null).rootDir().getFileName().toString());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
