package io.rolloutkit.recording;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.rolloutkit.model.Message;

import java.util.List;

/** Conversation snapshot taken after step {@code step} of rollout {@code envIndex}. */
public record RecordedStep(
        @JsonProperty("env_index") int envIndex,
        @JsonProperty("step") int step,
        @JsonProperty("messages") List<Message> messages
) {
    public RecordedStep {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
