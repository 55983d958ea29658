package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvalMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("score") Double score,
        @JsonProperty("passed") Boolean passed,
        @JsonProperty("reason") String reason
) {
    public static EvalMetadata named(String name) {
        return new EvalMetadata(name, null, null, null, null);
    }

    public EvalMetadata withScore(double value, boolean pass) {
        return new EvalMetadata(name, description, value, pass, reason);
    }

    public EvalMetadata withPassed(boolean value) {
        return new EvalMetadata(name, description, score, value, reason);
    }
}
