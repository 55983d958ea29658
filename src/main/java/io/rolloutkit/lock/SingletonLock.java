package io.rolloutkit.lock;

import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.util.Processes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Cross-process mutual exclusion backed by {@code <name>.pid} and {@code <name>.lock} in a
 * directory. The pid file is created with create-or-fail semantics from a fully written
 * temp file, so a reader never sees a partial pid. A recorded pid whose process is gone is
 * stale and gets reclaimed by the next acquirer.
 *
 * <p>Ownership is per process: another thread of the holding process is also refused.
 */
public final class SingletonLock {
    private static final Logger LOG = LoggerFactory.getLogger(SingletonLock.class);
    private static final int MAX_STALE_RECLAIMS = 3;

    private final Path baseDir;
    private final String name;
    private final Path lockFile;
    private final Path pidFile;

    public SingletonLock(Path baseDir, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name must not be blank");
        }
        this.baseDir = baseDir;
        this.name = name;
        this.lockFile = baseDir.resolve(name + ".lock");
        this.pidFile = baseDir.resolve(name + ".pid");
    }

    public String name() {
        return name;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Path pidFile() {
        return pidFile;
    }

    public LockOutcome acquire() {
        long self = Processes.currentPid();
        for (int attempt = 0; attempt <= MAX_STALE_RECLAIMS; attempt++) {
            OptionalLong recorded = readPid();
            if (recorded.isPresent()) {
                long holder = recorded.getAsLong();
                if (Processes.isAlive(holder)) {
                    return LockOutcome.heldBy(holder);
                }
                reclaimStale(holder);
                continue;
            }
            if (Files.exists(pidFile)) {
                // Unreadable pid file; nobody can prove ownership of it.
                reclaimStale(-1L);
                continue;
            }
            if (tryCreatePidFile(self)) {
                writeLockMarker(self);
                LOG.debug("Acquired lock {} in {}", name, baseDir);
                return LockOutcome.granted();
            }
        }
        OptionalLong holder = readPid();
        return LockOutcome.heldBy(holder.isPresent() ? holder.getAsLong() : -1L);
    }

    /** Polls with backoff until the lock is granted or the timeout elapses. */
    public LockOutcome acquire(Duration timeout) {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        long pollMs = RolloutKitConfig.DEFAULT_LOCK_POLL_MS;
        LockOutcome outcome = acquire();
        while (!outcome.acquired() && System.nanoTime() < deadline) {
            long remainingMs = Math.max(1L, (deadline - System.nanoTime()) / 1_000_000L);
            try {
                Thread.sleep(Math.min(pollMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException("Interrupted while waiting for lock " + name, e);
            }
            pollMs = Math.min(RolloutKitConfig.DEFAULT_LOCK_MAX_POLL_MS, pollMs + pollMs / 2);
            outcome = acquire();
        }
        return outcome;
    }

    public void acquireOrThrow(Duration timeout) {
        LockOutcome outcome = acquire(timeout);
        if (!outcome.acquired()) {
            throw new LockTimeoutException(
                    "Failed to acquire lock " + pidFile + " within " + timeout.toMillis() + "ms, held by pid " + outcome.holderPid(),
                    outcome.holderPid()
            );
        }
    }

    /**
     * Deletes both files. Safe to call repeatedly. A pid file naming a different live process
     * is left alone and {@code false} is returned.
     */
    public boolean release() {
        OptionalLong recorded = readPid();
        if (recorded.isPresent()
                && recorded.getAsLong() != Processes.currentPid()
                && Processes.isAlive(recorded.getAsLong())) {
            LOG.warn("Not releasing lock {}: held by live pid {}", name, recorded.getAsLong());
            return false;
        }
        deleteBoth();
        return true;
    }

    public boolean isHeld() {
        return holderPid().isPresent();
    }

    public OptionalLong holderPid() {
        OptionalLong recorded = readPid();
        if (recorded.isPresent() && Processes.isAlive(recorded.getAsLong())) {
            return recorded;
        }
        return OptionalLong.empty();
    }

    /** Removes a lock whose recorded process is no longer running. */
    public boolean cleanupStale() {
        OptionalLong recorded = readPid();
        if (recorded.isPresent()) {
            if (Processes.isAlive(recorded.getAsLong())) {
                return false;
            }
            deleteBoth();
            return true;
        }
        if (Files.exists(pidFile)) {
            deleteBoth();
            return true;
        }
        return false;
    }

    private boolean tryCreatePidFile(long self) {
        Path temp = baseDir.resolve(name + ".pid." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(baseDir);
            Files.writeString(temp, Long.toString(self), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            try {
                Files.createLink(pidFile, temp);
            } catch (UnsupportedOperationException e) {
                // No hard links on this file system; a plain move still refuses an existing target.
                Files.move(temp, pidFile);
            }
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock pid file: " + pidFile, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.debug("Failed to delete lock temp file {}", temp, e);
            }
        }
    }

    private void writeLockMarker(long self) {
        try {
            Files.writeString(lockFile, Long.toString(self), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            deleteQuietly(pidFile);
            throw new RuntimeException("Failed to write lock marker: " + lockFile, e);
        }
    }

    private void reclaimStale(long stalePid) {
        OptionalLong again = readPid();
        boolean unchanged = stalePid < 0L ? again.isEmpty() : again.isPresent() && again.getAsLong() == stalePid;
        if (unchanged) {
            LOG.info("Reclaiming stale lock {} left by pid {}", name, stalePid < 0L ? "unknown" : stalePid);
            deleteBoth();
        }
    }

    private OptionalLong readPid() {
        try {
            String content = Files.readString(pidFile, StandardCharsets.UTF_8).trim();
            if (content.isEmpty() || !content.chars().allMatch(Character::isDigit)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Long.parseLong(content));
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException | NumberFormatException e) {
            LOG.debug("Unreadable pid file {}", pidFile, e);
            return OptionalLong.empty();
        }
    }

    private void deleteBoth() {
        deleteQuietly(pidFile);
        deleteQuietly(lockFile);
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete lock file {}", path, e);
        }
    }
}
