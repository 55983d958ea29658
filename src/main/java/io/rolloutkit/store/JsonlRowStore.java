package io.rolloutkit.store;

import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.lock.SingletonLock;
import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Rows as JSON lines in {@code datasets/<yyyy-MM-dd>.jsonl} (UTC). A row is rewritten in
 * whichever file already holds it, otherwise appended to today's file. Each file is guarded
 * by a {@link SingletonLock} named {@code file_lock_<file name>} next to it; threads of this
 * process are serialized before they reach the file lock.
 */
public final class JsonlRowStore implements RowStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonlRowStore.class);

    private final Path datasetsDir;
    private final Duration lockTimeout;
    private final Clock clock;
    private final ReentrantLock localLock = new ReentrantLock();

    public JsonlRowStore(Path datasetsDir) {
        this(datasetsDir, Duration.ofMillis(RolloutKitConfig.DEFAULT_LOCK_TIMEOUT_MS), Clock.systemUTC());
    }

    public JsonlRowStore(Path datasetsDir, Duration lockTimeout, Clock clock) {
        this.datasetsDir = datasetsDir;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(datasetsDir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize datasets directory: " + datasetsDir, e);
        }
    }

    public Path datasetsDir() {
        return datasetsDir;
    }

    public Path currentFile() {
        return datasetsDir.resolve(LocalDate.now(clock.withZone(ZoneOffset.UTC)) + ".jsonl");
    }

    @Override
    public void log(EvaluationRow row) {
        String line = Jsons.toCompactJson(row);
        localLock.lock();
        try {
            for (Path file : listFiles()) {
                boolean updated = withFileLock(file, () -> replaceInFile(file, row.rowId(), line));
                if (updated) {
                    return;
                }
            }
            Path current = currentFile();
            withFileLock(current, () -> {
                append(current, line);
                return true;
            });
        } finally {
            localLock.unlock();
        }
    }

    @Override
    public List<EvaluationRow> read() {
        List<EvaluationRow> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        localLock.lock();
        try {
            for (Path file : listFiles()) {
                List<String> lines = withFileLock(file, () -> readLines(file));
                for (String line : lines) {
                    if (line.isBlank()) {
                        continue;
                    }
                    EvaluationRow row = Jsons.fromJson(line, EvaluationRow.class);
                    if (!seen.add(row.rowId())) {
                        throw new DuplicateRowException(row.rowId());
                    }
                    rows.add(row);
                }
            }
        } finally {
            localLock.unlock();
        }
        return rows;
    }

    private boolean replaceInFile(Path file, String rowId, String line) {
        List<String> lines = readLines(file);
        for (int i = 0; i < lines.size(); i++) {
            String existing = lines.get(i);
            if (existing.isBlank()) {
                continue;
            }
            String existingId;
            try {
                existingId = Jsons.readTree(existing).path("row_id").asText(null);
            } catch (RuntimeException e) {
                LOG.warn("Skipping unparsable line {} in {}", i + 1, file);
                continue;
            }
            if (rowId.equals(existingId)) {
                lines.set(i, line);
                writeLines(file, lines);
                return true;
            }
        }
        return false;
    }

    private <T> T withFileLock(Path file, Supplier<T> body) {
        SingletonLock lock = new SingletonLock(file.getParent(), "file_lock_" + file.getFileName());
        lock.acquireOrThrow(lockTimeout);
        try {
            return body.get();
        } finally {
            lock.release();
        }
    }

    private List<Path> listFiles() {
        if (!Files.isDirectory(datasetsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(datasetsDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".jsonl"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list datasets directory: " + datasetsDir, e);
        }
    }

    private List<String> readLines(Path file) {
        try {
            if (!Files.exists(file)) {
                return new ArrayList<>();
            }
            return new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read row file: " + file, e);
        }
    }

    private void append(Path file, String line) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append row to " + file, e);
        }
    }

    private void writeLines(Path file, List<String> lines) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(temp, lines, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to rewrite row file: " + file, e);
        }
    }
}
