package io.rolloutkit.cli;

import io.rolloutkit.config.EngineSettings;
import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.lock.SingletonLock;
import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.StatusCode;
import io.rolloutkit.observability.RolloutAuditLog;
import io.rolloutkit.recording.RecordPlaybackStore;
import io.rolloutkit.recording.RecordedStep;
import io.rolloutkit.store.RowStore;
import io.rolloutkit.store.RowStores;
import io.rolloutkit.util.Jsons;
import io.rolloutkit.watcher.EvalWatcher;
import io.rolloutkit.watcher.WatcherLauncher;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

@Command(
        name = "rolloutkit",
        mixinStandardHelpOptions = true,
        description = "Rollout row store, recording and liveness watcher CLI",
        subcommands = {
                RolloutKitCommand.InitCommand.class,
                RolloutKitCommand.WatchCommand.class,
                RolloutKitCommand.WatcherStartCommand.class,
                RolloutKitCommand.WatcherStatusCommand.class,
                RolloutKitCommand.RowsCommand.class,
                RolloutKitCommand.RecordingSummaryCommand.class,
                RolloutKitCommand.AuditTailCommand.class,
                RolloutKitCommand.AuditVerifyCommand.class
        }
)
public final class RolloutKitCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | watch | watcher-start | watcher-status | rows | recording-summary | audit-tail | audit-verify");
    }

    RolloutKitConfig config() {
        return RolloutKitConfig.fromRoot(root);
    }

    EngineSettings settings() {
        return EngineSettings.load(config());
    }

    RolloutAuditLog auditLog() {
        return new RolloutAuditLog(config().auditLogFile());
    }

    @Command(name = "init", description = "Create the data root, row store and default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Override
        public Integer call() {
            RolloutKitConfig config = parent.config();
            try {
                Files.createDirectories(config.rootDir());
                Files.createDirectories(config.recordingsDir());
                if (!Files.exists(config.settingsFile())) {
                    Files.writeString(config.settingsFile(), Jsons.toJson(EngineSettings.defaults()));
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to initialize " + config.rootDir(), e);
            }
            EngineSettings settings = parent.settings();
            RowStores.init(config, settings);
            RowStores.shutdown();
            parent.auditLog();
            System.out.println("Initialized RolloutKit at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "watch", description = "Run the liveness watcher in the foreground (one per data root)")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Option(names = {"--interval-ms"}, description = "Scan interval in milliseconds")
        Long intervalMs;

        @Option(names = {"--max-empty-scans"}, description = "Exit after this many consecutive scans without running rows")
        Integer maxEmptyScans;

        @Override
        public Integer call() {
            RolloutKitConfig config = parent.config();
            EngineSettings settings = parent.settings();
            RowStore store = RowStores.init(config, settings);
            try {
                EvalWatcher watcher = new EvalWatcher(
                        store,
                        new SingletonLock(config.rootDir(), RolloutKitConfig.WATCHER_LOCK_NAME),
                        parent.auditLog(),
                        intervalMs == null ? settings.watcherIntervalMs() : intervalMs,
                        maxEmptyScans == null ? settings.watcherMaxEmptyScans() : maxEmptyScans
                );
                Thread hook = new Thread(watcher::stop, "watcher-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                EvalWatcher.RunOutcome outcome = watcher.runSingleton();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException ignored) {
                    // JVM already shutting down.
                }
                System.out.println(Jsons.toJson(outcome));
                return 0;
            } finally {
                RowStores.shutdown();
            }
        }
    }

    @Command(name = "watcher-start", description = "Start the watcher in a background process unless one is running")
    static final class WatcherStartCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Option(names = {"--interval-ms"}, description = "Scan interval in milliseconds", defaultValue = "5000")
        long intervalMs;

        @Override
        public Integer call() {
            WatcherLauncher.LaunchOutcome outcome = new WatcherLauncher(parent.config()).ensureSingletonWatcher(intervalMs);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "watcher-status", description = "Report whether a watcher holds the lock")
    static final class WatcherStatusCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Override
        public Integer call() {
            SingletonLock lock = new WatcherLauncher(parent.config()).watcherLock();
            OptionalLong pid = lock.holderPid();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("running", pid.isPresent());
            out.put("pid", pid.isPresent() ? pid.getAsLong() : null);
            out.put("stale_lock_removed", pid.isEmpty() && lock.cleanupStale());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "rows", description = "List persisted rows")
    static final class RowsCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Option(names = {"--status"}, description = "Filter by status name, e.g. RUNNING, FINISHED, CANCELLED")
        String status;

        @Option(names = {"--limit"}, description = "Max rows to print", defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            RowStore store = RowStores.init(parent.config(), parent.settings());
            try {
                List<EvaluationRow> rows = status == null || status.isBlank()
                        ? store.read()
                        : store.findByStatus(StatusCode.valueOf(status.trim().toUpperCase(Locale.ROOT)));
                List<Map<String, Object>> out = new ArrayList<>();
                for (EvaluationRow row : rows.subList(0, Math.min(rows.size(), Math.max(1, limit)))) {
                    out.add(summary(row));
                }
                System.out.println(Jsons.toJson(out));
                return 0;
            } finally {
                RowStores.shutdown();
            }
        }

        static Map<String, Object> summary(EvaluationRow row) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("row_id", row.rowId());
            out.put("status", row.rolloutStatus() == null ? null : row.rolloutStatus().code().name());
            out.put("message", row.rolloutStatus() == null ? null : row.rolloutStatus().message());
            out.put("owning_pid", row.owningPid());
            out.put("messages", row.messages().size());
            out.put("score", row.evalMetadata() == null ? null : row.evalMetadata().score());
            out.put("passed", row.evalMetadata() == null ? null : row.evalMetadata().passed());
            return out;
        }
    }

    @Command(name = "recording-summary", description = "Summarize a record/playback file")
    static final class RecordingSummaryCommand implements Callable<Integer> {
        @Option(names = {"--file"}, required = true, description = "Recording NDJSON file")
        String file;

        @Override
        public Integer call() {
            Path path = Paths.get(file);
            if (!Files.exists(path)) {
                System.err.println("Recording not found: " + path);
                return 2;
            }
            Map<Integer, List<RecordedStep>> loaded = RecordPlaybackStore.load(path);
            Map<String, Object> rollouts = new LinkedHashMap<>();
            loaded.forEach((env, steps) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("steps", steps.size());
                entry.put("messages", steps.isEmpty() ? 0 : steps.get(steps.size() - 1).messages().size());
                rollouts.put(Integer.toString(env), entry);
            });
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", path.toAbsolutePath().toString());
            out.put("rollouts", loaded.size());
            out.put("by_env_index", rollouts);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the last audit events")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.auditLog().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        RolloutKitCommand parent;

        @Override
        public Integer call() {
            int broken = parent.auditLog().verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", broken == 0);
            out.put("first_broken_line", broken == 0 ? null : broken);
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 1;
        }
    }
}
