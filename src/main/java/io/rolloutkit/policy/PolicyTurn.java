package io.rolloutkit.policy;

import io.rolloutkit.model.Message;
import io.rolloutkit.model.ToolCall;

/**
 * What a policy produced for one step. {@code toolCall} is null when the model answered
 * without calling a tool. {@code assistantMessage} is the turn as it should appear in the
 * conversation; when absent the executor builds one from the tool call.
 */
public record PolicyTurn(ToolCall toolCall, Message assistantMessage) {
    public static PolicyTurn of(ToolCall toolCall) {
        return new PolicyTurn(toolCall, null);
    }
}
