package io.rolloutkit.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process MCP server over plain HTTP. Each session walks a line; the control plane reports
 * termination once a session has made {@code goal} moves. Tool results come back as an event stream.
 */
final class FakeMcpServer implements AutoCloseable {
    private final HttpServer server;
    private final int goal;
    private final AtomicInteger sessions = new AtomicInteger();
    private final Map<String, AtomicInteger> positions = new ConcurrentHashMap<>();
    private final Map<String, Long> seeds = new ConcurrentHashMap<>();
    private final Set<String> deleted = ConcurrentHashMap.newKeySet();
    private final AtomicInteger deleteRequests = new AtomicInteger();
    private final List<String> methods = new CopyOnWriteArrayList<>();
    private final List<String> statusSessionHeaders = new CopyOnWriteArrayList<>();
    private volatile int controlStatusCode = 200;
    private volatile long controlDelayMs;
    private volatile boolean issueSessionHeader = true;

    FakeMcpServer(int goal) throws IOException {
        this.goal = goal;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/mcp", this::handleMcp);
        server.createContext("/control/status", this::handleStatus);
        server.createContext("/control/initial_state", this::handleInitialState);
        server.start();
    }

    String endpoint() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/mcp";
    }

    FakeMcpServer controlStatusCode(int code) {
        this.controlStatusCode = code;
        return this;
    }

    FakeMcpServer controlDelayMs(long millis) {
        this.controlDelayMs = millis;
        return this;
    }

    FakeMcpServer withoutSessionHeader() {
        this.issueSessionHeader = false;
        return this;
    }

    int position(String sessionId) {
        AtomicInteger p = positions.get(sessionId);
        return p == null ? -1 : p.get();
    }

    Long seed(String sessionId) {
        return seeds.get(sessionId);
    }

    Set<String> deleted() {
        return deleted;
    }

    int deleteRequests() {
        return deleteRequests.get();
    }

    List<String> methods() {
        return methods;
    }

    List<String> statusSessionHeaders() {
        return statusSessionHeaders;
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handleMcp(HttpExchange exchange) throws IOException {
        String sessionId = exchange.getRequestHeaders().getFirst(McpHttpClient.SESSION_HEADER);
        if ("DELETE".equals(exchange.getRequestMethod())) {
            deleteRequests.incrementAndGet();
            if (sessionId == null || !positions.containsKey(sessionId)) {
                respond(exchange, 404, "application/json", "{}", null);
                return;
            }
            deleted.add(sessionId);
            respond(exchange, 200, "application/json", "{}", null);
            return;
        }
        JsonNode request = Jsons.readTree(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        String method = request.path("method").asText();
        methods.add(method);
        switch (method) {
            case "initialize" -> {
                String id = "sess-" + sessions.incrementAndGet();
                positions.put(id, new AtomicInteger());
                seeds.put(id, request.path("params").path("_meta").path("seed").asLong());
                ObjectNode result = Jsons.object();
                result.put("protocolVersion", McpHttpClient.PROTOCOL_VERSION);
                respond(exchange, 200, "application/json", envelope(request, result), issueSessionHeader ? id : null);
            }
            case "notifications/initialized" -> respond(exchange, 202, "application/json", "", null);
            case "tools/list" -> {
                ObjectNode result = Jsons.object();
                ObjectNode tool = result.putArray("tools").addObject();
                tool.put("name", "move");
                tool.put("description", "Move one cell forward");
                tool.putObject("inputSchema").put("type", "object");
                respond(exchange, 200, "application/json", envelope(request, result), null);
            }
            case "tools/call" -> {
                AtomicInteger position = positions.get(sessionId);
                if (position == null) {
                    respond(exchange, 404, "application/json", "{}", null);
                    return;
                }
                int now = position.incrementAndGet();
                ObjectNode result = Jsons.object();
                ObjectNode text = result.putArray("content").addObject();
                text.put("type", "text");
                text.put("text", "{\"position\":" + now + "}");
                String stream = "event: message\ndata: " + envelope(request, result) + "\n\n";
                respond(exchange, 200, "text/event-stream", stream, null);
            }
            default -> {
                ObjectNode error = Jsons.object();
                error.put("jsonrpc", "2.0");
                error.set("id", request.get("id"));
                error.putObject("error").put("code", -32601).put("message", "Method not found: " + method);
                respond(exchange, 200, "application/json", Jsons.toCompactJson(error), null);
            }
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        String sessionId = exchange.getRequestHeaders().getFirst(McpHttpClient.SESSION_HEADER);
        statusSessionHeaders.add(String.valueOf(sessionId));
        pause();
        if (controlStatusCode != 200) {
            respond(exchange, controlStatusCode, "application/json", "{}", null);
            return;
        }
        int position = position(sessionId);
        boolean terminated = position >= goal;
        ObjectNode body = Jsons.object();
        body.put("terminated", terminated);
        body.put("reward", terminated ? 1.0 : 0.0);
        body.put("position", position);
        respond(exchange, 200, "application/json", Jsons.toCompactJson(body), null);
    }

    private void handleInitialState(HttpExchange exchange) throws IOException {
        ObjectNode body = Jsons.object();
        body.put("position", 0);
        body.put("goal", goal);
        respond(exchange, 200, "application/json", Jsons.toCompactJson(body), null);
    }

    private void pause() {
        if (controlDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(controlDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String envelope(JsonNode request, JsonNode result) {
        ObjectNode body = Jsons.object();
        body.put("jsonrpc", "2.0");
        body.set("id", request.get("id"));
        body.set("result", result);
        return Jsons.toCompactJson(body);
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body, String sessionId)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if (sessionId != null) {
            exchange.getResponseHeaders().set(McpHttpClient.SESSION_HEADER, sessionId);
        }
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        } else {
            exchange.close();
        }
    }
}
