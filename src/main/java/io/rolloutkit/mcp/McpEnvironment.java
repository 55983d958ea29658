package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.rolloutkit.env.RolloutEnvironment;
import io.rolloutkit.model.ControlPlaneStatus;
import io.rolloutkit.model.ResetResult;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.StepResult;
import io.rolloutkit.model.ToolCall;
import io.rolloutkit.model.ToolSchema;
import io.rolloutkit.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Environment reached through MCP tools. Tool results are the observation; reward and
 * termination come only from the control plane.
 */
public final class McpEnvironment implements RolloutEnvironment {
    static final String NO_TOOL_CALL_OBSERVATION = "No tool call was generated.";

    private final McpHttpClient client;
    private final ControlPlaneClient controlPlane;

    public McpEnvironment(McpHttpClient client, ControlPlaneClient controlPlane) {
        this.client = client;
        this.controlPlane = controlPlane;
    }

    @Override
    public ResetResult reset(Session session) {
        JsonNode initial = controlPlane.initialState(session).orElse(Jsons.object());
        JsonNode listed = client.call(session.baseAddress(), session.id(), "tools/list", Jsons.object());
        List<ToolSchema> tools = new ArrayList<>();
        for (JsonNode tool : listed.path("tools")) {
            tools.add(new ToolSchema(
                    tool.path("name").asText(),
                    tool.path("description").asText(null),
                    tool.get("inputSchema")
            ));
        }
        return new ResetResult(initial, tools);
    }

    @Override
    public StepResult step(Session session, ToolCall call) {
        Map<String, Object> info = new LinkedHashMap<>();
        JsonNode observation;
        if (call.isNoOp()) {
            // Nothing to send; the server only learns about it through the next status poll.
            observation = TextNode.valueOf(NO_TOOL_CALL_OBSERVATION);
            info.put("no_tool_call", true);
        } else {
            ObjectNode params = Jsons.object();
            params.put("name", call.toolName());
            params.set("arguments", Jsons.mapper().valueToTree(call.arguments()));
            JsonNode result = client.call(session.baseAddress(), session.id(), "tools/call", params);
            observation = observationOf(result);
            if (result.path("isError").asBoolean(false)) {
                info.put("tool_error", true);
            }
        }
        Optional<ControlPlaneStatus> status = controlPlane.status(session);
        double reward = 0.0;
        boolean done = false;
        if (status.isPresent()) {
            reward = status.get().reward();
            done = status.get().terminated();
            info.put("control_plane", status.get().info());
        }
        return new StepResult(observation, reward, done, info);
    }

    static JsonNode observationOf(JsonNode result) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : result.path("content")) {
            if ("text".equals(part.path("type").asText())) {
                text.append(part.path("text").asText());
            }
        }
        String raw = text.toString().trim();
        if (raw.isEmpty()) {
            return result.path("structuredContent").isMissingNode() ? TextNode.valueOf("") : result.get("structuredContent");
        }
        if (raw.startsWith("{") || raw.startsWith("[")) {
            try {
                return Jsons.readTree(raw);
            } catch (RuntimeException e) {
                return TextNode.valueOf(raw);
            }
        }
        return TextNode.valueOf(raw);
    }
}
