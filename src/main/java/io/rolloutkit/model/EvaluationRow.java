package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.rolloutkit.util.Hashing;
import io.rolloutkit.util.Jsons;

import java.time.Instant;
import java.util.List;

/**
 * Persisted unit of work. The owning process writes it while the rollout runs; the watcher
 * may later force a stale {@code RUNNING} row to {@code CANCELLED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationRow(
        @JsonProperty("row_id") String rowId,
        @JsonProperty("messages") List<Message> messages,
        @JsonProperty("tools") List<ToolSchema> tools,
        @JsonProperty("rollout_status") Status rolloutStatus,
        @JsonProperty("owning_pid") Long owningPid,
        @JsonProperty("eval_metadata") EvalMetadata evalMetadata,
        @JsonProperty("execution_metadata") ExecutionMetadata executionMetadata,
        @JsonProperty("created_at") Instant createdAt
) {
    public EvaluationRow {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? null : List.copyOf(tools);
    }

    /** New row whose id is derived from its initial messages when none is supplied. */
    public static EvaluationRow create(String rowId, List<Message> messages, EvalMetadata evalMetadata) {
        String id = rowId == null || rowId.isBlank() ? stableRowId(messages) : rowId;
        return new EvaluationRow(id, messages, null, null, null, evalMetadata, null, Instant.now());
    }

    public static String stableRowId(List<Message> messages) {
        return "row_" + Hashing.sha256Hex(Jsons.toCompactJson(messages == null ? List.of() : messages)).substring(0, 16);
    }

    public EvaluationRow withMessages(List<Message> value) {
        return new EvaluationRow(rowId, value, tools, rolloutStatus, owningPid, evalMetadata, executionMetadata, createdAt);
    }

    public EvaluationRow withTools(List<ToolSchema> value) {
        return new EvaluationRow(rowId, messages, value, rolloutStatus, owningPid, evalMetadata, executionMetadata, createdAt);
    }

    public EvaluationRow withStatus(Status value) {
        return new EvaluationRow(rowId, messages, tools, value, owningPid, evalMetadata, executionMetadata, createdAt);
    }

    public EvaluationRow withOwningPid(Long value) {
        return new EvaluationRow(rowId, messages, tools, rolloutStatus, value, evalMetadata, executionMetadata, createdAt);
    }

    public EvaluationRow withEvalMetadata(EvalMetadata value) {
        return new EvaluationRow(rowId, messages, tools, rolloutStatus, owningPid, value, executionMetadata, createdAt);
    }

    public EvaluationRow withExecutionMetadata(ExecutionMetadata value) {
        return new EvaluationRow(rowId, messages, tools, rolloutStatus, owningPid, evalMetadata, value, createdAt);
    }

    @JsonIgnore
    public boolean isRunning() {
        return rolloutStatus != null && rolloutStatus.isRunning();
    }
}
