package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One conversation turn. For {@code tool} messages, {@code content} carries only what the
 * model may see; reward and termination travel in {@code metadata}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        @JsonProperty("role") String role,
        @JsonProperty("content") String content,
        @JsonProperty("tool_call_id") String toolCallId,
        @JsonProperty("tool_calls") List<ToolCall> toolCalls,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    public static Message system(String content) {
        return new Message(ROLE_SYSTEM, content, null, null, null);
    }

    public static Message user(String content) {
        return new Message(ROLE_USER, content, null, null, null);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return new Message(ROLE_ASSISTANT, content, null,
                toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls), null);
    }

    public static Message tool(String toolCallId, String content, Map<String, Object> metadata) {
        return new Message(ROLE_TOOL, content, toolCallId, null,
                metadata == null || metadata.isEmpty() ? null : metadata);
    }
}
