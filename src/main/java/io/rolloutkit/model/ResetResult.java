package io.rolloutkit.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ResetResult(JsonNode observation, List<ToolSchema> tools) {
    public ResetResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
