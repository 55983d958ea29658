package io.rolloutkit.rollout;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.mcp.ControlPlaneClient;
import io.rolloutkit.model.ControlPlaneStatus;
import io.rolloutkit.model.Session;
import io.rolloutkit.util.Jsons;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Reports termination once the session has taken {@code terminateAfter} steps (0 = never). */
public final class FakeControlPlane implements ControlPlaneClient {
    private final FakeEnvironment environment;
    private final int terminateAfter;
    private final AtomicInteger polls = new AtomicInteger();

    public FakeControlPlane(FakeEnvironment environment, int terminateAfter) {
        this.environment = environment;
        this.terminateAfter = terminateAfter;
    }

    @Override
    public Optional<ControlPlaneStatus> status(Session session) {
        polls.incrementAndGet();
        boolean terminated = terminateAfter > 0 && environment.stepsTaken(session) >= terminateAfter;
        JsonNode info = Jsons.object().put("source", "fake");
        return Optional.of(new ControlPlaneStatus(terminated, terminated ? 1.0 : 0.0, info));
    }

    @Override
    public Optional<JsonNode> initialState(Session session) {
        return Optional.empty();
    }

    public int polls() {
        return polls.get();
    }
}
