package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rolloutkit.env.ProtocolException;
import io.rolloutkit.env.TransportException;
import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC client for the streamable HTTP flavour of MCP. Replies may come back as
 * plain JSON or as a server-sent event stream; both are accepted.
 */
public final class McpHttpClient {
    public static final String SESSION_HEADER = "mcp-session-id";
    static final String PROTOCOL_VERSION = "2025-03-26";

    private final HttpClient http;
    private final Duration requestTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    public McpHttpClient(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), requestTimeout);
    }

    public McpHttpClient(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    public HttpClient http() {
        return http;
    }

    /** Performs the initialize handshake and returns the session id issued by the server. */
    public String initialize(String endpoint, long seed) {
        ObjectNode params = Jsons.object();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", "rolloutkit");
        clientInfo.put("version", "0.1.0");
        params.putObject("_meta").put("seed", seed);
        HttpResponse<String> response = post(endpoint, null, request("initialize", params));
        String sessionId = response.headers().firstValue(SESSION_HEADER).orElse(null);
        if (sessionId == null || sessionId.isBlank()) {
            throw new ProtocolException("Server at " + endpoint + " did not issue an " + SESSION_HEADER + " header");
        }
        unwrapResult(parseBody(response), "initialize");
        ObjectNode initialized = Jsons.object();
        initialized.put("jsonrpc", "2.0");
        initialized.put("method", "notifications/initialized");
        post(endpoint, sessionId, initialized);
        return sessionId;
    }

    public JsonNode call(String endpoint, String sessionId, String method, JsonNode params) {
        HttpResponse<String> response = post(endpoint, sessionId, request(method, params));
        return unwrapResult(parseBody(response), method);
    }

    /** Ends the server-side session. */
    public void terminate(String endpoint, String sessionId) {
        HttpRequest req = HttpRequest.newBuilder(URI.create(endpoint))
                .timeout(requestTimeout)
                .header(SESSION_HEADER, sessionId)
                .DELETE()
                .build();
        HttpResponse<String> resp = send(req, endpoint);
        // 405 means the server does not support explicit termination.
        if (resp.statusCode() / 100 != 2 && resp.statusCode() != 404 && resp.statusCode() != 405) {
            throw new TransportException("DELETE " + endpoint + " failed status=" + resp.statusCode());
        }
    }

    private ObjectNode request(String method, JsonNode params) {
        ObjectNode body = Jsons.object();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        if (params != null) {
            body.set("params", params);
        }
        return body;
    }

    private HttpResponse<String> post(String endpoint, String sessionId, JsonNode body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(endpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/event-stream")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
        if (sessionId != null) {
            builder.header(SESSION_HEADER, sessionId);
        }
        HttpResponse<String> resp = send(builder.build(), endpoint);
        if (resp.statusCode() / 100 != 2) {
            throw new TransportException("POST " + endpoint + " failed status=" + resp.statusCode());
        }
        return resp;
    }

    private HttpResponse<String> send(HttpRequest req, String endpoint) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException("Failed to reach " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while calling " + endpoint, e);
        }
    }

    static JsonNode parseBody(HttpResponse<String> response) {
        String body = response.body() == null ? "" : response.body().trim();
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (contentType.startsWith("text/event-stream")) {
            return lastEventData(body);
        }
        if (body.isEmpty()) {
            return Jsons.object();
        }
        return Jsons.readTree(body);
    }

    static JsonNode lastEventData(String stream) {
        JsonNode last = null;
        for (String line : stream.split("\\r?\\n")) {
            if (line.startsWith("data:")) {
                String data = line.substring("data:".length()).trim();
                if (!data.isEmpty()) {
                    last = Jsons.readTree(data);
                }
            }
        }
        if (last == null) {
            throw new ProtocolException("Event stream carried no data");
        }
        return last;
    }

    private static JsonNode unwrapResult(JsonNode envelope, String method) {
        JsonNode error = envelope.get("error");
        if (error != null && !error.isNull()) {
            throw new ProtocolException(method + " failed: " + error.path("message").asText(error.toString()));
        }
        JsonNode result = envelope.get("result");
        if (result == null) {
            throw new ProtocolException(method + " returned no result");
        }
        return result;
    }
}
