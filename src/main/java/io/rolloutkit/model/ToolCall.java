package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCall(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("call_id") String callId
) {
    public static final String NO_OP_TOOL_NAME = "_no_tool_call";
    public static final ToolCall NO_OP = new ToolCall(
            NO_OP_TOOL_NAME,
            Map.of("reason", "no_tool_call_generated"),
            null
    );

    public ToolCall {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName must not be blank");
        }
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCall of(String toolName, Map<String, Object> arguments) {
        return new ToolCall(toolName, arguments, null);
    }

    public ToolCall withCallId(String id) {
        return new ToolCall(toolName, arguments, id);
    }

    @JsonIgnore
    public boolean isNoOp() {
        return NO_OP_TOOL_NAME.equals(toolName);
    }

    /** Compact {@code name(args)} form used in control-plane step logs. */
    public String describe() {
        return toolName + "(" + arguments + ")";
    }
}
