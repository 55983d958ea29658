package io.rolloutkit.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Authoritative session state reported out of band by the environment. */
public record ControlPlaneStatus(boolean terminated, double reward, JsonNode info) {
}
