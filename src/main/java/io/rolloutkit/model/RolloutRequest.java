package io.rolloutkit.model;

import java.util.Objects;

/**
 * One rollout to run: its position in the batch, the session it owns and the prompts used
 * to open the conversation. {@code userPromptTemplate} may reference {@code {observation}}.
 */
public record RolloutRequest(int index, Session session, String systemPrompt, String userPromptTemplate) {
    public RolloutRequest {
        Objects.requireNonNull(session, "session");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }
}
