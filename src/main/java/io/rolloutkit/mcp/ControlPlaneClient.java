package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.model.ControlPlaneStatus;
import io.rolloutkit.model.Session;

import java.util.Optional;

/**
 * Out-of-band channel reporting authoritative termination and reward for a session.
 * An empty result means "no signal"; it never fails the rollout.
 */
public interface ControlPlaneClient {

    Optional<ControlPlaneStatus> status(Session session);

    Optional<JsonNode> initialState(Session session);

    /** A client that never reports anything, for environments without a control plane. */
    static ControlPlaneClient none() {
        return new ControlPlaneClient() {
            @Override
            public Optional<ControlPlaneStatus> status(Session session) {
                return Optional.empty();
            }

            @Override
            public Optional<JsonNode> initialState(Session session) {
                return Optional.empty();
            }
        };
    }
}
