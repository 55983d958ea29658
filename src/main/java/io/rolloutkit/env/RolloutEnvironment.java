package io.rolloutkit.env;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.model.ResetResult;
import io.rolloutkit.model.RolloutRequest;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.StepResult;
import io.rolloutkit.model.ToolCall;

/**
 * Session-stateful environment driven by a rollout. Implementations report unreachable
 * endpoints with {@link TransportException}.
 */
public interface RolloutEnvironment {

    ResetResult reset(Session session);

    StepResult step(Session session, ToolCall call);

    default String formatUserPrompt(RolloutRequest request, JsonNode observation) {
        String rendered = observation == null || observation.isNull()
                ? ""
                : observation.isTextual() ? observation.asText() : observation.toString();
        String template = request.userPromptTemplate();
        if (template == null || template.isBlank()) {
            return rendered;
        }
        return template.replace("{observation}", rendered);
    }

    default String formatToolResponse(JsonNode observation) {
        if (observation == null || observation.isNull()) {
            return "";
        }
        return observation.isTextual() ? observation.asText() : observation.toString();
    }
}
