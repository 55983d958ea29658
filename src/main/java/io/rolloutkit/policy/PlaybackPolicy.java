package io.rolloutkit.policy;

import io.rolloutkit.env.ProtocolException;
import io.rolloutkit.model.Message;
import io.rolloutkit.model.ToolCall;
import io.rolloutkit.model.ToolSchema;
import io.rolloutkit.recording.RecordPlaybackStore;
import io.rolloutkit.recording.RecordedStep;
import io.rolloutkit.rollout.RolloutTerminationException;

import java.util.List;
import java.util.Optional;

/**
 * Base for model-backed policies. In playback mode the assistant turns are taken from the
 * recording instead of the model, so a replay against the same environment reproduces the
 * recorded conversation exactly.
 */
public abstract class PlaybackPolicy implements Policy {
    private final RecordPlaybackStore recordings;

    protected PlaybackPolicy(RecordPlaybackStore recordings) {
        this.recordings = recordings;
    }

    public boolean isPlaybackMode() {
        return recordings.isPlayback();
    }

    @Override
    public final PolicyTurn nextAction(List<ToolSchema> tools, int rolloutIndex, List<Message> conversation) {
        if (recordings.isPlayback()) {
            return replay(rolloutIndex, conversation);
        }
        return generateLive(tools, rolloutIndex, conversation);
    }

    protected abstract PolicyTurn generateLive(List<ToolSchema> tools, int rolloutIndex, List<Message> conversation);

    private PolicyTurn replay(int rolloutIndex, List<Message> conversation) {
        int step = (int) conversation.stream().filter(m -> Message.ROLE_TOOL.equals(m.role())).count();
        Optional<RecordedStep> entry = recordings.lookup(rolloutIndex, step);
        if (entry.isEmpty()) {
            throw new RolloutTerminationException(
                    "Recording has no step " + step + " for rollout " + rolloutIndex);
        }
        List<Message> recorded = entry.get().messages();
        for (int i = conversation.size(); i < recorded.size(); i++) {
            Message candidate = recorded.get(i);
            if (Message.ROLE_ASSISTANT.equals(candidate.role())) {
                List<ToolCall> calls = candidate.toolCalls();
                ToolCall call = calls == null || calls.isEmpty() ? null : calls.get(0);
                return new PolicyTurn(call, candidate);
            }
        }
        throw new ProtocolException("Recorded step " + step + " of rollout " + rolloutIndex + " has no assistant turn");
    }
}
