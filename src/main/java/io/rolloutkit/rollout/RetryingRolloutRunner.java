package io.rolloutkit.rollout;

import io.rolloutkit.model.ErrorInfo;
import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.ExecutionMetadata;
import io.rolloutkit.model.Status;
import io.rolloutkit.observability.RolloutAuditLog;
import io.rolloutkit.store.RowStore;
import io.rolloutkit.util.Ids;
import io.rolloutkit.util.Processes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs rows through a {@link RolloutProcessor} on a shared pool and retries each row on its
 * own: an attempt that does not finish is resubmitted right away, without waiting for the
 * rest of the batch, until {@code maxRetry} retries have been spent.
 *
 * <p>Every attempt is persisted as {@code RUNNING} with this process's pid before the
 * processor is called, so the watcher can repair it if the process dies.
 */
public final class RetryingRolloutRunner {
    private static final Logger LOG = LoggerFactory.getLogger(RetryingRolloutRunner.class);
    static final String ERROR_DOMAIN = "rollout";

    private final RolloutProcessor processor;
    private final RowStore store;
    private final RolloutAuditLog auditLog;
    private final int maxRetry;
    private final int maxConcurrency;

    public RetryingRolloutRunner(RolloutProcessor processor, RowStore store, RolloutAuditLog auditLog,
                                 int maxRetry, int maxConcurrency) {
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry must be >= 0");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        this.processor = processor;
        this.store = store;
        this.auditLog = auditLog;
        this.maxRetry = maxRetry;
        this.maxConcurrency = maxConcurrency;
    }

    public int maxRetry() {
        return maxRetry;
    }

    public BatchOutcome runAll(List<EvaluationRow> rows) {
        int n = rows.size();
        EvaluationRow[] results = new EvaluationRow[n];
        int[] attempts = new int[n];
        List<EvaluationRow> failures = new ArrayList<>();
        if (n == 0) {
            return new BatchOutcome(List.of(), List.of(), 0);
        }
        String invocationId = Ids.newInvocationId();
        String runId = Ids.newRunId();
        EvaluationRow[] prepared = new EvaluationRow[n];
        for (int i = 0; i < n; i++) {
            EvaluationRow row = rows.get(i);
            ExecutionMetadata existing = row.executionMetadata();
            String rolloutId = existing == null || existing.rolloutId() == null ? Ids.newRolloutId() : existing.rolloutId();
            prepared[i] = row.withExecutionMetadata(new ExecutionMetadata(invocationId, rolloutId, runId, 0));
        }

        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrency, ExecutionManager.workerThreads());
        int totalAttempts = 0;
        try {
            CompletionService<AttemptResult> completion = new ExecutorCompletionService<>(pool);
            for (int i = 0; i < n; i++) {
                attempts[i] = 1;
                submit(completion, prepared[i], i, 1, invocationId);
            }
            int pending = n;
            while (pending > 0) {
                AttemptResult result = completion.take().get();
                totalAttempts++;
                int i = result.index();
                EvaluationRow row = result.row();
                if (row.rolloutStatus() != null && row.rolloutStatus().isFinished()) {
                    results[i] = row;
                    pending--;
                    audit("rollout.finish", row, "ok", Map.of("attempt", result.attempt()));
                    continue;
                }
                if (result.attempt() <= maxRetry) {
                    attempts[i] = result.attempt() + 1;
                    LOG.warn("Row {} attempt {} ended with {}; retrying ({} of {} retries)",
                            row.rowId(), result.attempt(), describe(row.rolloutStatus()), result.attempt(), maxRetry);
                    audit("rollout.retry", row, "retry", Map.of(
                            "attempt", result.attempt(),
                            "status", describe(row.rolloutStatus())
                    ));
                    submit(completion, prepared[i], i, attempts[i], invocationId);
                    continue;
                }
                EvaluationRow exhausted = exhaust(row, result.attempt());
                persist(exhausted, result.attempt());
                results[i] = exhausted;
                failures.add(exhausted);
                pending--;
                LOG.error("Row {} failed after {} attempts: {}", row.rowId(), result.attempt(), exhausted.rolloutStatus().message());
                audit("rollout.exhausted", exhausted, "error", Map.of("attempts", result.attempt()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rollouts", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Rollout worker crashed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
        return new BatchOutcome(List.of(results), List.copyOf(failures), totalAttempts);
    }

    /** Runs a single row, throwing when its retry budget is exhausted. */
    public EvaluationRow runOne(EvaluationRow row) {
        BatchOutcome outcome = runAll(List.of(row));
        if (!outcome.failures().isEmpty()) {
            throw new RolloutRetryExhaustedException(outcome.failures().get(0), outcome.totalAttempts());
        }
        return outcome.rows().get(0);
    }

    private void submit(CompletionService<AttemptResult> completion, EvaluationRow row, int index, int attempt,
                        String invocationId) {
        completion.submit(() -> new AttemptResult(index, attempt, attempt(row, index, attempt, invocationId)));
    }

    private EvaluationRow attempt(EvaluationRow input, int index, int attempt, String invocationId) {
        EvaluationRow running = input
                .withExecutionMetadata(input.executionMetadata().withAttempt(attempt))
                .withStatus(Status.running())
                .withOwningPid(Processes.currentPid());
        EvaluationRow outcome;
        try {
            store.log(running);
            if (attempt == 1) {
                audit("rollout.start", running, "running", Map.of("pid", running.owningPid()));
            }
            EvaluationRow processed = processor.process(running, new RolloutContext(index, attempt, invocationId));
            outcome = processed == null
                    ? running.withStatus(Status.error("Processor returned no row", List.of()))
                    : processed;
        } catch (RolloutTerminationException e) {
            outcome = running.withStatus(Status.finished("Rollout stopped: " + e.getMessage()));
        } catch (Exception e) {
            LOG.debug("Row {} attempt {} threw", input.rowId(), attempt, e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("exception", e.getClass().getName());
            metadata.put("attempt", attempt);
            outcome = running.withStatus(Status.error(
                    String.valueOf(e.getMessage()),
                    List.of(new ErrorInfo(ErrorInfo.REASON_ROLLOUT_FAILED, ERROR_DOMAIN, metadata))
            ));
        }
        persist(outcome, attempt);
        return outcome;
    }

    private void persist(EvaluationRow row, int attempt) {
        try {
            store.log(row);
        } catch (RuntimeException e) {
            LOG.error("Failed to persist row {} after attempt {}: {}", row.rowId(), attempt, e.toString());
        }
    }

    private EvaluationRow exhaust(EvaluationRow row, int attempts) {
        Status last = row.rolloutStatus();
        List<ErrorInfo> details = new ArrayList<>(last == null ? List.of() : last.details());
        details.add(new ErrorInfo(ErrorInfo.REASON_RETRIES_EXHAUSTED, ERROR_DOMAIN, Map.of(
                "attempts", attempts,
                "max_retry", maxRetry
        )));
        String message = "Retries exhausted after " + attempts + " attempts"
                + (last == null || last.message().isBlank() ? "" : ": " + last.message());
        return row.withStatus(Status.error(message, details));
    }

    private void audit(String action, EvaluationRow row, String result, Map<String, Object> details) {
        if (auditLog == null) {
            return;
        }
        String rolloutId = row.executionMetadata() == null ? null : row.executionMetadata().rolloutId();
        auditLog.log(RolloutAuditLog.AuditEvent.of(action, row.rowId(), rolloutId, result, details));
    }

    private static String describe(Status status) {
        return status == null ? "no status" : status.code() + " " + status.message();
    }

    private record AttemptResult(int index, int attempt, EvaluationRow row) {
    }

    public record BatchOutcome(List<EvaluationRow> rows, List<EvaluationRow> failures, int totalAttempts) {
    }
}
