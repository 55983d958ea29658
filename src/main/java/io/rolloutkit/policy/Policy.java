package io.rolloutkit.policy;

import io.rolloutkit.model.Message;
import io.rolloutkit.model.ToolSchema;

import java.util.List;

/**
 * Decides the next tool call of a rollout from the conversation so far. The conversation
 * is read-only. Implementations signal a malformed model reply with
 * {@link io.rolloutkit.env.ProtocolException} and an unreachable model with
 * {@link io.rolloutkit.env.TransportException}; they are called concurrently for different
 * rollouts.
 */
public interface Policy {

    PolicyTurn nextAction(List<ToolSchema> tools, int rolloutIndex, List<Message> conversation);
}
