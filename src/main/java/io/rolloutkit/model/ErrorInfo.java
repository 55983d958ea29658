package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** AIP-193 error detail attached to a {@link Status}. */
public record ErrorInfo(
        @JsonProperty("reason") String reason,
        @JsonProperty("domain") String domain,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String REASON_PROCESS_TERMINATED = "process_terminated";
    public static final String REASON_RETRIES_EXHAUSTED = "retries_exhausted";
    public static final String REASON_ROLLOUT_FAILED = "rollout_failed";

    public ErrorInfo {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
