package io.rolloutkit.rollout;

import io.rolloutkit.env.RolloutEnvironment;
import io.rolloutkit.mcp.ConnectionManager;
import io.rolloutkit.mcp.ControlPlaneClient;
import io.rolloutkit.model.RolloutRequest;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.TerminationReason;
import io.rolloutkit.model.Trajectory;
import io.rolloutkit.policy.Policy;
import io.rolloutkit.recording.OpenAiFormatLog;
import io.rolloutkit.recording.RecordPlaybackStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of rollouts on a fixed pool of {@code maxConcurrency} workers, one rollout
 * per worker at a time. Results come back in request order whatever order they finish in.
 */
public final class ExecutionManager {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionManager.class);

    private final ConnectionManager connections;
    private final RolloutEnvironment environment;
    private final ControlPlaneClient controlPlane;
    private final RecordPlaybackStore recordings;
    private final OpenAiFormatLog conversationLog;

    public ExecutionManager(
            ConnectionManager connections,
            RolloutEnvironment environment,
            ControlPlaneClient controlPlane,
            RecordPlaybackStore recordings,
            OpenAiFormatLog conversationLog
    ) {
        this.connections = connections;
        this.environment = environment;
        this.controlPlane = controlPlane;
        this.recordings = recordings;
        this.conversationLog = conversationLog;
    }

    public List<Trajectory> execute(List<RolloutRequest> requests, Policy policy, int maxSteps, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        int n = requests.size();
        Trajectory[] results = new Trajectory[n];
        if (n == 0) {
            return List.of();
        }
        RolloutExecutor executor = new RolloutExecutor(environment, controlPlane, policy, recordings, maxSteps);
        List<Session> sessions = new ArrayList<>(n);
        for (RolloutRequest request : requests) {
            sessions.add(request.session());
        }
        long startedNs = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrency, workerThreads());
        try {
            CompletionService<IndexedTrajectory> completion = new ExecutorCompletionService<>(pool);
            for (int i = 0; i < n; i++) {
                int position = i;
                RolloutRequest request = requests.get(i);
                completion.submit(() -> new IndexedTrajectory(position, runOne(executor, request)));
            }
            for (int done = 0; done < n; done++) {
                IndexedTrajectory finished = completion.take().get();
                results[finished.position()] = finished.trajectory();
                logConversation(requests.get(finished.position()).index(), finished.trajectory());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rollouts", e);
        } catch (ExecutionException e) {
            // runOne converts rollout failures into failed trajectories, so this is a bug.
            throw new IllegalStateException("Rollout worker crashed", e.getCause());
        } finally {
            pool.shutdownNow();
            connections.closeAll(sessions, maxConcurrency);
        }

        Duration total = Duration.ofNanos(System.nanoTime() - startedNs);
        List<Trajectory> trajectories = new ArrayList<>(n);
        for (Trajectory trajectory : results) {
            trajectory.stampDuration(total);
            trajectories.add(trajectory);
        }
        report(trajectories, total, maxConcurrency);
        return trajectories;
    }

    private Trajectory runOne(RolloutExecutor executor, RolloutRequest request) {
        try {
            connections.initialize(request.session());
        } catch (RuntimeException e) {
            LOG.error("Rollout {} could not open its session: {}", request.index(), e.toString());
            return RolloutExecutor.failedBeforeStart(request, e);
        }
        return executor.run(request);
    }

    private void logConversation(int envIndex, Trajectory trajectory) {
        if (conversationLog == null) {
            return;
        }
        try {
            conversationLog.log(envIndex, trajectory);
        } catch (RuntimeException e) {
            LOG.warn("Failed to write conversation of rollout {} to {}: {}", envIndex, conversationLog.file(), e.toString());
        }
    }

    private void report(List<Trajectory> trajectories, Duration total, int maxConcurrency) {
        long successful = trajectories.stream().filter(t -> t.totalReward() > 0).count();
        long controlPlane = trajectories.stream()
                .filter(t -> t.terminationReason() == TerminationReason.CONTROL_PLANE_SIGNAL)
                .count();
        long failed = trajectories.stream().filter(Trajectory::failed).count();
        LOG.info("Rollout complete: {}/{} reached goal, {} failed", successful, trajectories.size(), failed);
        LOG.info("Control plane terminations: {}/{}", controlPlane, trajectories.size());
        LOG.info("Total duration: {}ms with {} concurrent workers", total.toMillis(), maxConcurrency);
        if (conversationLog != null) {
            LOG.info("Conversation log: {}", conversationLog.file());
        }
        recordings.file().ifPresent(file -> LOG.info("Recording mode {}: {}", recordings.mode(), file));
    }

    static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "rollout-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record IndexedTrajectory(int position, Trajectory trajectory) {
    }
}
