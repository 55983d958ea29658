package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.rolloutkit.model.ControlPlaneStatus;
import io.rolloutkit.model.Session;
import io.rolloutkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/** Polls {@code /control/status} and {@code /control/initial_state} next to the MCP endpoint. */
public final class HttpControlPlaneClient implements ControlPlaneClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpControlPlaneClient.class);

    private final HttpClient http;
    private final Duration timeout;

    public HttpControlPlaneClient(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public HttpControlPlaneClient(HttpClient http, Duration timeout) {
        this.http = http;
        this.timeout = timeout;
    }

    @Override
    public Optional<ControlPlaneStatus> status(Session session) {
        return get(session, "/control/status").map(body -> new ControlPlaneStatus(
                body.path("terminated").asBoolean(false),
                body.path("reward").asDouble(0.0),
                body
        ));
    }

    @Override
    public Optional<JsonNode> initialState(Session session) {
        return get(session, "/control/initial_state");
    }

    /** {@code http://host:8000/mcp/} becomes {@code http://host:8000}. */
    static String controlBase(String baseAddress) {
        String base = baseAddress.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.endsWith("/mcp")) {
            base = base.substring(0, base.length() - "/mcp".length());
        }
        return base;
    }

    private Optional<JsonNode> get(Session session, String path) {
        if (!session.isInitialized()) {
            return Optional.empty();
        }
        String url = controlBase(session.baseAddress()) + path;
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header(McpHttpClient.SESSION_HEADER, session.id())
                .GET()
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() != 200) {
                LOG.debug("Control plane {} answered {} for session {}", url, resp.statusCode(), session.id());
                return Optional.empty();
            }
            return Optional.of(Jsons.readTree(resp.body()));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Control plane {} unavailable for session {}: {}", url, session.id(), e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
