package io.rolloutkit.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record StepResult(JsonNode observation, double reward, boolean done, Map<String, Object> info) {
    public StepResult {
        info = info == null ? Map.of() : info;
    }
}
