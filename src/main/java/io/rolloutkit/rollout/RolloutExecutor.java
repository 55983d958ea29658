package io.rolloutkit.rollout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.rolloutkit.env.ProtocolException;
import io.rolloutkit.env.RolloutEnvironment;
import io.rolloutkit.mcp.ControlPlaneClient;
import io.rolloutkit.model.ControlPlaneStatus;
import io.rolloutkit.model.ControlPlaneStep;
import io.rolloutkit.model.Message;
import io.rolloutkit.model.ResetResult;
import io.rolloutkit.model.RolloutRequest;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.StepResult;
import io.rolloutkit.model.TerminationReason;
import io.rolloutkit.model.ToolCall;
import io.rolloutkit.model.Trajectory;
import io.rolloutkit.policy.Policy;
import io.rolloutkit.policy.PolicyTurn;
import io.rolloutkit.recording.RecordPlaybackStore;
import io.rolloutkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one conversation between a policy and an environment session until the
 * environment reports done, the control plane reports termination, or the step budget runs
 * out. Stateless between runs; one instance may serve many workers.
 */
public final class RolloutExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RolloutExecutor.class);

    private final RolloutEnvironment environment;
    private final ControlPlaneClient controlPlane;
    private final Policy policy;
    private final RecordPlaybackStore recordings;
    private final int maxSteps;

    public RolloutExecutor(
            RolloutEnvironment environment,
            ControlPlaneClient controlPlane,
            Policy policy,
            RecordPlaybackStore recordings,
            int maxSteps
    ) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1");
        }
        this.environment = environment;
        this.controlPlane = controlPlane;
        this.policy = policy;
        this.recordings = recordings;
        this.maxSteps = maxSteps;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Runs the rollout. A malformed policy reply becomes a no-op step. Any other failure ends
     * the rollout as {@link TerminationReason#ERROR}: the trajectory keeps the steps taken so
     * far and carries the failure message.
     */
    public Trajectory run(RolloutRequest request) {
        Session session = request.session();
        int index = request.index();
        Trajectory trajectory = new Trajectory(session);
        RolloutState state = transition(index, RolloutState.RESET);
        List<Message> conversation = new ArrayList<>();
        Map<String, Object> lastControlPlaneInfo = Map.of();
        int step = 0;
        try {
            ResetResult reset = environment.reset(session);
            trajectory.recordInitialObservation(reset.observation());
            if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
                conversation.add(Message.system(request.systemPrompt()));
            }
            conversation.add(Message.user(environment.formatUserPrompt(request, reset.observation())));
            LOG.debug("Rollout {} reset, session {}, {} tools", index, session.id(), reset.tools().size());

            while (step < maxSteps) {
                if (step > 0) {
                    state = transition(index, RolloutState.CHECKING_CONTROL_PLANE);
                    Optional<ControlPlaneStatus> status = controlPlane.status(session);
                    if (status.isPresent() && status.get().terminated()) {
                        trajectory.terminate(TerminationReason.CONTROL_PLANE_SIGNAL);
                        lastControlPlaneInfo = infoMap(status.get().info());
                        LOG.debug("Rollout {} terminated by control plane after step {}", index, step);
                        break;
                    }
                }

                state = transition(index, RolloutState.AWAITING_POLICY);
                ToolCall call = decide(reset, index, step, conversation);

                state = transition(index, RolloutState.STEPPING);
                if (trajectory.terminated() || session.isTerminated()) {
                    throw new IllegalStateException("Rollout " + index + " issued a tool call after termination");
                }
                StepResult result = environment.step(session, call);
                Map<String, Object> metadata = new LinkedHashMap<>();
                if (result.reward() != 0.0 || result.done() || !result.info().isEmpty()) {
                    metadata.put("reward", result.reward());
                    metadata.put("terminated", result.done());
                    metadata.put("info", result.info());
                }
                conversation.add(Message.tool(call.callId(), environment.formatToolResponse(result.observation()), metadata));

                Map<String, Object> controlInfo = controlPlaneInfo(result);
                trajectory.recordStep(call, result.observation(), result.reward(),
                        new ControlPlaneStep(step, result.reward(), result.done(), controlInfo, call.describe()));
                recordings.record(index, step, conversation);
                step++;

                if (result.done()) {
                    lastControlPlaneInfo = controlInfo;
                    TerminationReason reason = TerminationReason.ENVIRONMENT_DONE;
                    if (Boolean.TRUE.equals(controlInfo.get("terminated"))) {
                        reason = TerminationReason.CONTROL_PLANE_SIGNAL;
                    } else {
                        Optional<ControlPlaneStatus> status = controlPlane.status(session);
                        if (status.isPresent() && status.get().terminated()) {
                            reason = TerminationReason.CONTROL_PLANE_SIGNAL;
                            lastControlPlaneInfo = infoMap(status.get().info());
                        }
                    }
                    trajectory.terminate(reason);
                    break;
                }
            }
        } catch (RolloutTerminationException e) {
            LOG.info("Rollout {} stopped at step {}: {}", index, step, e.getMessage());
            trajectory.terminate(TerminationReason.INTERRUPTED);
        } catch (RuntimeException e) {
            LOG.error("Rollout {} failed at step {}: {}", index, step, e.toString());
            LOG.debug("Rollout {} failure", index, e);
            fail(trajectory, e);
        }

        if (trajectory.terminationReason() == null) {
            trajectory.endWithoutTermination(TerminationReason.MAX_STEPS_REACHED);
        }
        state = transition(index, RolloutState.TERMINATED);
        trajectory.replaceConversation(conversation);
        trajectory.summarizeControlPlane(summary(trajectory, step, lastControlPlaneInfo));
        trajectory.freeze();
        LOG.info("Rollout {} {}: {} steps, reward {}, reason {}",
                index, state.name().toLowerCase(), trajectory.steps(), trajectory.totalReward(),
                trajectory.terminationReason().wireValue());
        return trajectory;
    }

    /** Frozen failed trajectory for a rollout whose session could not even be opened. */
    static Trajectory failedBeforeStart(RolloutRequest request, RuntimeException error) {
        Trajectory trajectory = new Trajectory(request.session());
        fail(trajectory, error);
        trajectory.summarizeControlPlane(summary(trajectory, 0, Map.of()));
        trajectory.freeze();
        return trajectory;
    }

    private static void fail(Trajectory trajectory, RuntimeException error) {
        if (trajectory.observations().isEmpty()) {
            trajectory.recordInitialObservation(NullNode.getInstance());
        }
        trajectory.markFailed(error.toString());
        trajectory.endWithoutTermination(TerminationReason.ERROR);
    }

    private static RolloutState transition(int index, RolloutState next) {
        LOG.trace("Rollout {} -> {}", index, next);
        return next;
    }

    private ToolCall decide(ResetResult reset, int index, int step, List<Message> conversation) {
        PolicyTurn turn;
        try {
            turn = policy.nextAction(reset.tools(), index, List.copyOf(conversation));
        } catch (ProtocolException e) {
            LOG.warn("Rollout {} step {}: unusable policy reply, continuing with no-op: {}", index, step, e.getMessage());
            turn = null;
        }
        ToolCall call = turn == null || turn.toolCall() == null ? ToolCall.NO_OP : turn.toolCall();
        if (call.callId() == null) {
            call = call.withCallId("call_" + index + "_" + step);
        }
        Message assistant = turn == null ? null : turn.assistantMessage();
        if (assistant == null || !Message.ROLE_ASSISTANT.equals(assistant.role())) {
            assistant = Message.assistant(null, call.isNoOp() ? List.of() : List.of(call));
        }
        conversation.add(assistant);
        return call;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> controlPlaneInfo(StepResult result) {
        Object raw = result.info().get("control_plane");
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        if (raw instanceof JsonNode) {
            return infoMap((JsonNode) raw);
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> infoMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(node, Map.class);
    }

    private static Map<String, Object> summary(Trajectory trajectory, int steps, Map<String, Object> source) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_reward", trajectory.totalReward());
        summary.put("termination_reason", trajectory.terminationReason().wireValue());
        summary.put("final_step", Math.max(0, steps - 1));
        summary.put("control_plane_source", source);
        return summary;
    }
}
