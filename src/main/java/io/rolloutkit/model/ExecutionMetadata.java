package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionMetadata(
        @JsonProperty("invocation_id") String invocationId,
        @JsonProperty("rollout_id") String rolloutId,
        @JsonProperty("run_id") String runId,
        @JsonProperty("attempt") int attempt
) {
    public ExecutionMetadata withAttempt(int value) {
        return new ExecutionMetadata(invocationId, rolloutId, runId, value);
    }
}
