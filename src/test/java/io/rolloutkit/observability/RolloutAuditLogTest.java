package io.rolloutkit.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class RolloutAuditLogTest {

    @Test
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            RolloutAuditLog log = new RolloutAuditLog(file);
            log.log(RolloutAuditLog.AuditEvent.of("rollout.start", "r1", "rol_1", "running", Map.of("pid", 10)));
            log.log(RolloutAuditLog.AuditEvent.of("rollout.finish", "r1", "rol_1", "ok", Map.of("attempt", 1)));

            RolloutAuditLog reopened = new RolloutAuditLog(file);
            reopened.log(RolloutAuditLog.AuditEvent.of("watcher.exit", null, null, "ok", Map.of("scans", 3)));

            Assertions.assertEquals(0, reopened.verify());
            Assertions.assertEquals(3, reopened.tail(100).size());
            Assertions.assertEquals("watcher.exit", reopened.tail(1).get(0).path("action").asText());
            Assertions.assertEquals(reopened.tail(2).get(0).path("hash").asText(),
                    reopened.tail(1).get(0).path("prev_hash").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedLineIsDetected() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            RolloutAuditLog log = new RolloutAuditLog(file);
            log.log(RolloutAuditLog.AuditEvent.of("rollout.start", "r1", null, "running", Map.of()));
            log.log(RolloutAuditLog.AuditEvent.of("rollout.exhausted", "r1", null, "error", Map.of("attempts", 3)));
            log.log(RolloutAuditLog.AuditEvent.of("watcher.exit", null, null, "ok", Map.of()));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"attempts\":3", "\"attempts\":1"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            Assertions.assertEquals(2, new RolloutAuditLog(file).verify());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void interleavedWritersKeepOneChain() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-audit-writers-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            RolloutAuditLog runner = new RolloutAuditLog(file);
            RolloutAuditLog watcher = new RolloutAuditLog(file);

            runner.log(RolloutAuditLog.AuditEvent.of("rollout.start", "r1", "rol_1", "running", Map.of()));
            watcher.log(RolloutAuditLog.AuditEvent.of("watcher.cancel", "r2", null, "cancelled", Map.of()));
            runner.log(RolloutAuditLog.AuditEvent.of("rollout.finish", "r1", "rol_1", "ok", Map.of()));

            Assertions.assertEquals(0, runner.verify());
            Assertions.assertEquals(3, runner.tail(10).size());
            try (Stream<Path> files = Files.list(file.getParent())) {
                Assertions.assertEquals(List.of(file), files.toList());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentWritersOnSeparateInstancesKeepOneChain() throws Exception {
        Path root = Files.createTempDirectory("rolloutkit-test-audit-concurrent-");
        try {
            Path file = root.resolve("audit.log");
            int writers = 3;
            int eventsPerWriter = 5;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    RolloutAuditLog log = new RolloutAuditLog(file);
                    String rowId = "row-" + w;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < eventsPerWriter; i++) {
                            log.log(RolloutAuditLog.AuditEvent.of("rollout.retry", rowId, null, "retry", Map.of("attempt", i)));
                        }
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            RolloutAuditLog reader = new RolloutAuditLog(file);
            Assertions.assertEquals(0, reader.verify());
            Assertions.assertEquals(writers * eventsPerWriter, reader.tail(1000).size());
        } finally {
            deleteRecursively(root);
        }
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
