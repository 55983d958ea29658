package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ControlPlaneStep(
        @JsonProperty("step") int step,
        @JsonProperty("reward") double reward,
        @JsonProperty("terminated") boolean terminated,
        @JsonProperty("info") Map<String, Object> info,
        @JsonProperty("tool_call") String toolCall
) {
}
