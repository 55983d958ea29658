package io.rolloutkit.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class EvaluationRowTest {

    @Test
    void serializesWithSnakeCaseFieldsAndNumericStatus() {
        EvaluationRow row = new EvaluationRow(
                "row_1",
                List.of(Message.user("hi")),
                null,
                Status.cancelled("Process 9 terminated", List.of(
                        new ErrorInfo(ErrorInfo.REASON_PROCESS_TERMINATED, "eval_watcher", Map.of("pid", 9)))),
                9L,
                EvalMetadata.named("grid").withScore(0.5, true),
                new ExecutionMetadata("inv_1", "rol_1", "run_1", 2),
                Instant.parse("2024-03-05T10:00:00Z")
        );

        JsonNode json = Jsons.readTree(Jsons.toCompactJson(row));

        Assertions.assertEquals("row_1", json.path("row_id").asText());
        Assertions.assertEquals(StatusCode.CANCELLED.code(), json.path("rollout_status").path("code").asInt());
        Assertions.assertEquals("process_terminated",
                json.path("rollout_status").path("details").get(0).path("reason").asText());
        Assertions.assertEquals(9, json.path("owning_pid").asInt());
        Assertions.assertEquals("rol_1", json.path("execution_metadata").path("rollout_id").asText());
        Assertions.assertEquals("2024-03-05T10:00:00Z", json.path("created_at").asText());
        Assertions.assertFalse(json.has("running"));
        Assertions.assertFalse(json.has("tools"));
        Assertions.assertFalse(json.path("rollout_status").has("terminal"));
        Assertions.assertEquals(row, Jsons.fromJson(Jsons.toCompactJson(row), EvaluationRow.class));
    }

    @Test
    void stableRowIdDependsOnlyOnMessages() {
        List<Message> messages = List.of(Message.system("s"), Message.user("u"));

        EvaluationRow a = EvaluationRow.create(null, messages, null);
        EvaluationRow b = EvaluationRow.create("", messages, EvalMetadata.named("other"));
        EvaluationRow c = EvaluationRow.create(null, List.of(Message.user("u")), null);

        Assertions.assertEquals(a.rowId(), b.rowId());
        Assertions.assertNotEquals(a.rowId(), c.rowId());
        Assertions.assertTrue(a.rowId().startsWith("row_"));
        Assertions.assertEquals(20, a.rowId().length());
        Assertions.assertEquals("given", EvaluationRow.create("given", messages, null).rowId());
    }

    @Test
    void statusCodesAndHelpers() {
        Assertions.assertEquals(100, StatusCode.FINISHED.code());
        Assertions.assertEquals(101, StatusCode.RUNNING.code());
        Assertions.assertEquals(StatusCode.INTERNAL, Status.error("x", List.of()).code());
        Assertions.assertEquals(StatusCode.RUNNING, StatusCode.fromCode(101));
        Assertions.assertTrue(Status.running().isRunning());
        Assertions.assertFalse(Status.running().isTerminal());
        Assertions.assertTrue(Status.cancelled("gone", null).isTerminal());
        Assertions.assertEquals(List.of(), new Status(null, null, null).details());
        Assertions.assertEquals(StatusCode.UNKNOWN, new Status(null, null, null).code());
    }

    @Test
    void toolCallAndTerminationReasonWireNames() {
        JsonNode call = Jsons.readTree(Jsons.toCompactJson(ToolCall.of("move", Map.of("d", 1)).withCallId("c1")));
        Assertions.assertEquals("move", call.path("tool_name").asText());
        Assertions.assertEquals("c1", call.path("call_id").asText());
        Assertions.assertFalse(call.has("no_op"));
        Assertions.assertEquals("\"control_plane_signal\"", Jsons.toCompactJson(TerminationReason.CONTROL_PLANE_SIGNAL));
        Assertions.assertTrue(ToolCall.NO_OP.isNoOp());
        Assertions.assertThrows(IllegalArgumentException.class, () -> ToolCall.of(" ", Map.of()));
    }
}
