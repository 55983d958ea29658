package io.rolloutkit.rollout;

import io.rolloutkit.env.ProtocolException;
import io.rolloutkit.model.Message;
import io.rolloutkit.model.ToolCall;
import io.rolloutkit.model.ToolSchema;
import io.rolloutkit.policy.Policy;
import io.rolloutkit.policy.PolicyTurn;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Always moves right; can be told to misbehave on given (0-based) steps. */
public final class ScriptedPolicy implements Policy {
    private final Set<Integer> malformedSteps;
    private final Set<Integer> silentSteps;
    private final int stopAtStep;

    public ScriptedPolicy() {
        this(Set.of(), Set.of(), -1);
    }

    public ScriptedPolicy(Set<Integer> malformedSteps, Set<Integer> silentSteps, int stopAtStep) {
        this.malformedSteps = malformedSteps;
        this.silentSteps = silentSteps;
        this.stopAtStep = stopAtStep;
    }

    @Override
    public PolicyTurn nextAction(List<ToolSchema> tools, int rolloutIndex, List<Message> conversation) {
        int step = stepOf(conversation);
        if (step == stopAtStep) {
            throw new RolloutTerminationException("scripted stop");
        }
        if (malformedSteps.contains(step)) {
            throw new ProtocolException("unparsable tool call at step " + step);
        }
        if (silentSteps.contains(step)) {
            return new PolicyTurn(null, Message.assistant("I am thinking.", List.of()));
        }
        return PolicyTurn.of(ToolCall.of("move", Map.of("direction", "right", "step", step)));
    }

    static int stepOf(List<Message> conversation) {
        return (int) conversation.stream().filter(m -> Message.ROLE_TOOL.equals(m.role())).count();
    }
}
