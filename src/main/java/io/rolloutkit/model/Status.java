package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Status(
        @JsonProperty("code") StatusCode code,
        @JsonProperty("message") String message,
        @JsonProperty("details") List<ErrorInfo> details
) {
    public Status {
        if (code == null) {
            code = StatusCode.UNKNOWN;
        }
        message = message == null ? "" : message;
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static Status running() {
        return new Status(StatusCode.RUNNING, "Rollout is running", List.of());
    }

    public static Status finished() {
        return new Status(StatusCode.FINISHED, "Rollout finished", List.of());
    }

    public static Status finished(String message) {
        return new Status(StatusCode.FINISHED, message, List.of());
    }

    public static Status error(String message, List<ErrorInfo> details) {
        return new Status(StatusCode.INTERNAL, message, details);
    }

    public static Status cancelled(String message, List<ErrorInfo> details) {
        return new Status(StatusCode.CANCELLED, message, details);
    }

    @JsonIgnore
    public boolean isRunning() {
        return code == StatusCode.RUNNING;
    }

    @JsonIgnore
    public boolean isFinished() {
        return code == StatusCode.FINISHED;
    }

    @JsonIgnore
    public boolean isError() {
        return code == StatusCode.INTERNAL;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return code != StatusCode.RUNNING;
    }
}
