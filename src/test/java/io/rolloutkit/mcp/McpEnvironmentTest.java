package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.env.ProtocolException;
import io.rolloutkit.env.TransportException;
import io.rolloutkit.model.Message;
import io.rolloutkit.model.ResetResult;
import io.rolloutkit.model.RolloutRequest;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.StepResult;
import io.rolloutkit.model.TerminationReason;
import io.rolloutkit.model.ToolCall;
import io.rolloutkit.model.Trajectory;
import io.rolloutkit.recording.RecordPlaybackStore;
import io.rolloutkit.rollout.ExecutionManager;
import io.rolloutkit.rollout.ScriptedPolicy;
import io.rolloutkit.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class McpEnvironmentTest {

    @Test
    void initializeSendsSeedAndStepReadsRewardFromControlPlane() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(2)) {
            McpHttpClient client = new McpHttpClient(Duration.ofSeconds(5));
            HttpControlPlaneClient controlPlane = new HttpControlPlaneClient(Duration.ofSeconds(2));
            HttpConnectionManager connections = new HttpConnectionManager(client);
            McpEnvironment env = new McpEnvironment(client, controlPlane);
            Session session = new Session(server.endpoint(), 42);

            connections.initialize(session);
            Assertions.assertEquals("sess-1", session.id());
            Assertions.assertEquals(42L, server.seed("sess-1"));
            Assertions.assertEquals(List.of("initialize", "notifications/initialized"), server.methods());

            ResetResult reset = env.reset(session);
            Assertions.assertEquals(0, reset.observation().path("position").asInt());
            Assertions.assertEquals("move", reset.tools().get(0).name());

            StepResult first = env.step(session, ToolCall.of("move", Map.of()));
            Assertions.assertEquals(1, first.observation().path("position").asInt());
            Assertions.assertFalse(first.done());
            Assertions.assertEquals(0.0, first.reward());

            StepResult second = env.step(session, ToolCall.of("move", Map.of()));
            Assertions.assertTrue(second.done());
            Assertions.assertEquals(1.0, second.reward());
            Assertions.assertTrue(second.info().containsKey("control_plane"));
            Assertions.assertTrue(server.statusSessionHeaders().stream().allMatch("sess-1"::equals));

            connections.close(session);
            connections.close(session);
            Assertions.assertEquals(Set.of("sess-1"), server.deleted());
            Assertions.assertEquals(1, server.deleteRequests());
        }
    }

    @Test
    void closedStateTravelsWithTheSessionNotTheManager() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(2)) {
            McpHttpClient client = new McpHttpClient(Duration.ofSeconds(5));
            Session session = new Session(server.endpoint(), 7);
            new HttpConnectionManager(client).initialize(session);

            new HttpConnectionManager(client).close(session);
            new HttpConnectionManager(client).close(session);

            Assertions.assertTrue(session.isClosed());
            Assertions.assertEquals(1, server.deleteRequests());
        }
    }

    @Test
    void noOpStepIsAnsweredLocally() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(5)) {
            McpHttpClient client = new McpHttpClient(Duration.ofSeconds(5));
            McpEnvironment env = new McpEnvironment(client, new HttpControlPlaneClient(Duration.ofSeconds(2)));
            Session session = new Session(server.endpoint(), 1);
            new HttpConnectionManager(client).initialize(session);

            StepResult result = env.step(session, ToolCall.NO_OP);

            Assertions.assertEquals(McpEnvironment.NO_TOOL_CALL_OBSERVATION, result.observation().asText());
            Assertions.assertEquals(Boolean.TRUE, result.info().get("no_tool_call"));
            Assertions.assertFalse(server.methods().contains("tools/call"));
            Assertions.assertEquals(0, server.position("sess-1"));
        }
    }

    @Test
    void batchAgainstServerTerminatesEveryRolloutAndClosesSessions() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(3)) {
            McpHttpClient client = new McpHttpClient(Duration.ofSeconds(5));
            HttpControlPlaneClient controlPlane = new HttpControlPlaneClient(Duration.ofSeconds(2));
            ExecutionManager manager = new ExecutionManager(new HttpConnectionManager(client),
                    new McpEnvironment(client, controlPlane), controlPlane, RecordPlaybackStore.live(), null);
            List<RolloutRequest> requests = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                requests.add(new RolloutRequest(i, new Session(server.endpoint(), i), "Walk.", "{observation}"));
            }

            List<Trajectory> trajectories = manager.execute(requests, new ScriptedPolicy(), 10, 2);

            for (Trajectory trajectory : trajectories) {
                Assertions.assertFalse(trajectory.failed(), trajectory.failure());
                Assertions.assertEquals(3, trajectory.steps());
                Assertions.assertTrue(trajectory.terminated());
                Assertions.assertEquals(TerminationReason.CONTROL_PLANE_SIGNAL, trajectory.terminationReason());
                Map<?, ?> source = (Map<?, ?>) trajectory.controlPlaneSummary().get("control_plane_source");
                Assertions.assertEquals(Boolean.TRUE, source.get("terminated"));
                Assertions.assertEquals(1.0, trajectory.totalReward());
                Message last = trajectory.conversation().get(trajectory.conversation().size() - 1);
                Assertions.assertEquals("{\"position\":3}", last.content());
            }
            Assertions.assertEquals(4, server.deleted().size());
        }
    }

    @Test
    void missingSessionHeaderIsAProtocolError() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(1).withoutSessionHeader()) {
            HttpConnectionManager connections = new HttpConnectionManager(new McpHttpClient(Duration.ofSeconds(5)));

            Assertions.assertThrows(ProtocolException.class,
                    () -> connections.initialize(new Session(server.endpoint(), 3)));
        }
    }

    @Test
    void unreachableServerIsATransportError() throws Exception {
        String endpoint;
        try (FakeMcpServer server = new FakeMcpServer(1)) {
            endpoint = server.endpoint();
        }
        HttpConnectionManager connections = new HttpConnectionManager(new McpHttpClient(Duration.ofSeconds(2)));

        Assertions.assertThrows(TransportException.class, () -> connections.initialize(new Session(endpoint, 3)));
    }

    @Test
    void rpcErrorIsReportedWithMethodName() throws Exception {
        try (FakeMcpServer server = new FakeMcpServer(1)) {
            McpHttpClient client = new McpHttpClient(Duration.ofSeconds(5));
            Session session = new Session(server.endpoint(), 1);
            new HttpConnectionManager(client).initialize(session);

            ProtocolException e = Assertions.assertThrows(ProtocolException.class,
                    () -> client.call(session.baseAddress(), session.id(), "resources/list", Jsons.object()));
            Assertions.assertTrue(e.getMessage().startsWith("resources/list failed"));
        }
    }

    @Test
    void toolResultTextBecomesStructuredObservation() {
        JsonNode json = McpEnvironment.observationOf(Jsons.readTree(
                "{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"grid\\\":[1,2]}\"}]}"));
        JsonNode text = McpEnvironment.observationOf(Jsons.readTree(
                "{\"content\":[{\"type\":\"text\",\"text\":\"You hit a wall\"}]}"));
        JsonNode structured = McpEnvironment.observationOf(Jsons.readTree(
                "{\"content\":[],\"structuredContent\":{\"x\":1}}"));

        Assertions.assertEquals(2, json.path("grid").size());
        Assertions.assertEquals("You hit a wall", text.asText());
        Assertions.assertEquals(1, structured.path("x").asInt());
    }

    @Test
    void eventStreamKeepsLastDataLine() {
        JsonNode last = McpHttpClient.lastEventData("event: message\ndata: {\"n\":1}\n\ndata: {\"n\":2}\n");

        Assertions.assertEquals(2, last.path("n").asInt());
        Assertions.assertThrows(ProtocolException.class, () -> McpHttpClient.lastEventData("event: ping\n"));
    }
}
