package io.rolloutkit.watcher;

import io.rolloutkit.Main;
import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.lock.SingletonLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Starts the watcher as a separate JVM so that it outlives the process whose rollouts it
 * audits. The child takes the watcher lock itself; a second child simply exits.
 */
public final class WatcherLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(WatcherLauncher.class);

    private final RolloutKitConfig config;

    public WatcherLauncher(RolloutKitConfig config) {
        this.config = config;
    }

    public SingletonLock watcherLock() {
        return new SingletonLock(config.rootDir(), RolloutKitConfig.WATCHER_LOCK_NAME);
    }

    public OptionalLong runningWatcherPid() {
        return watcherLock().holderPid();
    }

    /** Returns the pid of the running or newly started watcher. */
    public LaunchOutcome ensureSingletonWatcher(long intervalMs) {
        OptionalLong existing = runningWatcherPid();
        if (existing.isPresent()) {
            return new LaunchOutcome(false, existing.getAsLong(), null);
        }
        List<String> command = command(intervalMs);
        Path logFile = config.rootDir().resolve("logs").resolve("watcher.log");
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        try {
            Files.createDirectories(logFile.getParent());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            Process process = pb.start();
            LOG.info("Started watcher process {} (log {})", process.pid(), logFile);
            return new LaunchOutcome(true, process.pid(), logFile.toString());
        } catch (IOException e) {
            throw new RuntimeException("Failed to start watcher process", e);
        }
    }

    List<String> command(long intervalMs) {
        String javaBin = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        List<String> command = new ArrayList<>();
        command.add(javaBin);
        command.add("-cp");
        command.add(System.getProperty("java.class.path", ""));
        command.add(Main.class.getName());
        command.add("--root");
        command.add(config.rootDir().toString());
        command.add("watch");
        command.add("--interval-ms");
        command.add(Long.toString(intervalMs));
        return command;
    }

    public record LaunchOutcome(boolean started, long pid, String logFile) {
    }
}
