package io.rolloutkit.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one rollout. Appended to by its executor, then frozen before it is handed out.
 * Keeps {@code observations.size() == actions.size() + 1 == rewards.size() + 1} once reset.
 */
public final class Trajectory {
    private final Session session;
    private final List<JsonNode> observations = new ArrayList<>();
    private final List<ToolCall> actions = new ArrayList<>();
    private final List<Double> rewards = new ArrayList<>();
    private final List<ControlPlaneStep> controlPlaneSteps = new ArrayList<>();
    private final List<Message> conversation = new ArrayList<>();
    private boolean terminated;
    private double totalReward;
    private TerminationReason terminationReason;
    private Map<String, Object> controlPlaneSummary = Map.of();
    private String failure;
    private volatile Duration duration = Duration.ZERO;
    private volatile boolean frozen;

    public Trajectory(Session session) {
        this.session = session;
    }

    public void recordInitialObservation(JsonNode observation) {
        ensureMutable();
        if (!observations.isEmpty()) {
            throw new IllegalStateException("Initial observation already recorded");
        }
        observations.add(observation);
    }

    public void recordStep(ToolCall action, JsonNode observation, double reward, ControlPlaneStep controlPlaneStep) {
        ensureMutable();
        if (observations.isEmpty()) {
            throw new IllegalStateException("Step recorded before reset");
        }
        if (terminated) {
            throw new IllegalStateException("Step recorded after termination");
        }
        actions.add(action);
        observations.add(observation);
        rewards.add(reward);
        totalReward += reward;
        if (controlPlaneStep != null) {
            controlPlaneSteps.add(controlPlaneStep);
        }
    }

    public void replaceConversation(List<Message> messages) {
        ensureMutable();
        conversation.clear();
        conversation.addAll(messages);
    }

    public void terminate(TerminationReason reason) {
        ensureMutable();
        this.terminated = true;
        this.terminationReason = reason;
        if (session != null) {
            session.markTerminated();
        }
    }

    public void endWithoutTermination(TerminationReason reason) {
        ensureMutable();
        this.terminationReason = reason;
    }

    public void summarizeControlPlane(Map<String, Object> summary) {
        ensureMutable();
        this.controlPlaneSummary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }

    /** The rollout ended with an exception; the steps collected before it are kept. */
    public void markFailed(String message) {
        ensureMutable();
        this.failure = message == null ? "unknown failure" : message;
    }

    public void freeze() {
        this.frozen = true;
    }

    /** Wall-clock duration is stamped once the whole batch completes, so it is allowed after freezing. */
    public void stampDuration(Duration value) {
        this.duration = value == null ? Duration.ZERO : value;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Trajectory is frozen");
        }
    }

    public Session session() {
        return session;
    }

    public List<JsonNode> observations() {
        return Collections.unmodifiableList(observations);
    }

    public List<ToolCall> actions() {
        return Collections.unmodifiableList(actions);
    }

    public List<Double> rewards() {
        return Collections.unmodifiableList(rewards);
    }

    public List<ControlPlaneStep> controlPlaneSteps() {
        return Collections.unmodifiableList(controlPlaneSteps);
    }

    public List<Message> conversation() {
        return Collections.unmodifiableList(conversation);
    }

    public boolean terminated() {
        return terminated;
    }

    public double totalReward() {
        return totalReward;
    }

    public int steps() {
        return actions.size();
    }

    public Duration duration() {
        return duration;
    }

    public TerminationReason terminationReason() {
        return terminationReason;
    }

    public Map<String, Object> controlPlaneSummary() {
        return controlPlaneSummary;
    }

    public String failure() {
        return failure;
    }

    public boolean failed() {
        return failure != null;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
