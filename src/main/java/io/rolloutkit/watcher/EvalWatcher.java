package io.rolloutkit.watcher;

import io.rolloutkit.lock.LockOutcome;
import io.rolloutkit.lock.SingletonLock;
import io.rolloutkit.model.ErrorInfo;
import io.rolloutkit.model.EvalMetadata;
import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.Status;
import io.rolloutkit.model.StatusCode;
import io.rolloutkit.observability.RolloutAuditLog;
import io.rolloutkit.store.RowStore;
import io.rolloutkit.util.Processes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds rows left {@code RUNNING} by a process that no longer exists and marks them
 * {@code CANCELLED}. Only one watcher per data root runs at a time, serialized by the
 * {@code eval_watcher} lock. It never touches rows whose owner is alive.
 */
public final class EvalWatcher {
    private static final Logger LOG = LoggerFactory.getLogger(EvalWatcher.class);
    public static final String ERROR_DOMAIN = "eval_watcher";

    private final RowStore store;
    private final SingletonLock lock;
    private final RolloutAuditLog auditLog;
    private final long intervalMs;
    private final int maxEmptyScans;
    private volatile boolean stopRequested;

    public EvalWatcher(RowStore store, SingletonLock lock, RolloutAuditLog auditLog, long intervalMs, int maxEmptyScans) {
        this.store = store;
        this.lock = lock;
        this.auditLog = auditLog;
        this.intervalMs = Math.max(0L, intervalMs);
        this.maxEmptyScans = Math.max(1, maxEmptyScans);
    }

    /** One pass over the store. Rows already repaired are no longer RUNNING and are skipped. */
    public ScanOutcome scanOnce() {
        List<EvaluationRow> running = store.findByStatus(StatusCode.RUNNING);
        List<String> cancelled = new ArrayList<>();
        for (EvaluationRow row : running) {
            if (Processes.isAlive(row.owningPid())) {
                continue;
            }
            try {
                EvaluationRow stopped = markStopped(row);
                store.log(stopped);
                cancelled.add(row.rowId());
                LOG.info("Row {} owned by pid {} marked cancelled", row.rowId(), row.owningPid());
                if (auditLog != null) {
                    String rolloutId = row.executionMetadata() == null ? null : row.executionMetadata().rolloutId();
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("pid", row.owningPid());
                    auditLog.log(RolloutAuditLog.AuditEvent.of("watcher.cancel", row.rowId(), rolloutId, "cancelled", details));
                }
            } catch (RuntimeException e) {
                LOG.warn("Failed to update row {}: {}", row.rowId(), e.toString());
            }
        }
        return new ScanOutcome(running.size(), List.copyOf(cancelled));
    }

    static EvaluationRow markStopped(EvaluationRow row) {
        String reason = "Process " + row.owningPid() + " terminated";
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pid", row.owningPid());
        Status status = Status.cancelled(reason, List.of(
                new ErrorInfo(ErrorInfo.REASON_PROCESS_TERMINATED, ERROR_DOMAIN, metadata)
        ));
        EvalMetadata eval = row.evalMetadata() == null
                ? new EvalMetadata(null, null, null, false, reason)
                : row.evalMetadata().withPassed(false);
        return row.withStatus(status).withEvalMetadata(eval);
    }

    /** Scans until {@code maxEmptyScans} consecutive scans find no running row, or until stopped. */
    public RunOutcome run() {
        int scans = 0;
        int empty = 0;
        int cancelled = 0;
        LOG.info("Watcher started (pid {}), interval {}ms", Processes.currentPid(), intervalMs);
        while (!stopRequested) {
            ScanOutcome scan = scanOnce();
            scans++;
            cancelled += scan.cancelledRowIds().size();
            if (scan.running() == 0) {
                empty++;
                if (empty >= maxEmptyScans) {
                    LOG.info("No running rows for {} consecutive scans, exiting", empty);
                    break;
                }
            } else {
                empty = 0;
            }
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Watcher interrupted");
                break;
            }
        }
        if (auditLog != null) {
            auditLog.log(RolloutAuditLog.AuditEvent.of("watcher.exit", null, null, "ok",
                    Map.of("scans", scans, "cancelled", cancelled)));
        }
        return new RunOutcome(true, null, scans, cancelled);
    }

    /** Runs under the watcher lock; if another live watcher holds it, reports that pid instead. */
    public RunOutcome runSingleton() {
        LockOutcome outcome = lock.acquire();
        if (!outcome.acquired()) {
            LOG.info("Watcher already running in process {}", outcome.holderPid());
            return new RunOutcome(false, outcome.holderPid(), 0, 0);
        }
        try {
            return run();
        } finally {
            lock.release();
        }
    }

    public void stop() {
        stopRequested = true;
    }

    public record ScanOutcome(int running, List<String> cancelledRowIds) {
    }

    public record RunOutcome(boolean started, Long holderPid, int scans, int cancelled) {
    }
}
