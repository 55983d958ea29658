package io.rolloutkit.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.lock.SingletonLock;
import io.rolloutkit.util.Hashing;
import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of rollout lifecycle events. Each line carries the hash of the
 * previous line so that truncation or edits are detectable with {@link #verify()}.
 *
 * <p>The runner and the watcher process append to the same file. Every append holds the
 * file's {@link SingletonLock} and chains onto the last line on disk, not onto a cached hash.
 */
public final class RolloutAuditLog {
    private static final int TAIL_CHUNK_BYTES = 64 * 1024;

    private final Path auditFile;
    private final Duration lockTimeout;

    public RolloutAuditLog(Path auditFile) {
        this(auditFile, Duration.ofMillis(RolloutKitConfig.DEFAULT_LOCK_TIMEOUT_MS));
    }

    public RolloutAuditLog(Path auditFile, Duration lockTimeout) {
        this.auditFile = auditFile;
        this.lockTimeout = lockTimeout;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        SingletonLock lock = new SingletonLock(auditFile.getParent(), "file_lock_" + auditFile.getFileName());
        lock.acquireOrThrow(lockTimeout);
        try {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Instant.now().toString());
            row.put("action", event.action());
            row.put("row_id", event.rowId());
            row.put("rollout_id", event.rolloutId());
            row.put("result", event.result());
            row.put("details", event.details());
            row.put("prev_hash", lastHash());
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            String line = Jsons.toCompactJson(row) + System.lineSeparator();
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        } finally {
            lock.release();
        }
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> all = new ArrayList<>();
        for (String line : readLines()) {
            if (!line.isBlank()) {
                all.add(Jsons.readTree(line));
            }
        }
        int from = Math.max(0, all.size() - Math.max(1, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    /** Re-computes the chain; returns the 1-based line number of the first broken entry, or 0. */
    public synchronized int verify() {
        String prev = "";
        int lineNo = 0;
        for (String line : readLines()) {
            if (line.isBlank()) {
                continue;
            }
            lineNo++;
            JsonNode node = Jsons.readTree(line);
            Map<String, Object> row = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> row.put(e.getKey(), e.getValue()));
            Object hashNode = row.remove("hash");
            String hash = hashNode == null ? "" : ((JsonNode) hashNode).asText();
            if (!prev.equals(node.path("prev_hash").asText(""))
                    || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                return lineNo;
            }
            prev = hash;
        }
        return 0;
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String lastHash() throws IOException {
        String last = lastLine();
        if (last.isBlank()) {
            return "";
        }
        return Jsons.readTree(last).path("hash").asText("");
    }

    /** Last non-blank line, read from the end of the file. */
    private String lastLine() throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(auditFile.toFile(), "r")) {
            long size = file.length();
            if (size == 0) {
                return "";
            }
            int length = (int) Math.min(size, TAIL_CHUNK_BYTES);
            byte[] buffer = new byte[length];
            file.seek(size - length);
            file.readFully(buffer);
            String chunk = new String(buffer, StandardCharsets.UTF_8).stripTrailing();
            int newline = chunk.lastIndexOf('\n');
            if (newline < 0 && length < size) {
                // One line longer than the chunk; fall back to a full read.
                List<String> lines = readLines();
                for (int i = lines.size() - 1; i >= 0; i--) {
                    if (!lines.get(i).isBlank()) {
                        return lines.get(i);
                    }
                }
                return "";
            }
            return chunk.substring(newline + 1).strip();
        }
    }

    public record AuditEvent(
            String action,
            String rowId,
            String rolloutId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String rowId, String rolloutId, String result, Map<String, Object> details) {
            return new AuditEvent(action, rowId, rolloutId, result, details == null ? Map.of() : details);
        }
    }
}
