package io.rolloutkit.mcp;

import io.rolloutkit.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpConnectionManager implements ConnectionManager {
    private static final Logger LOG = LoggerFactory.getLogger(HttpConnectionManager.class);

    private final McpHttpClient client;

    public HttpConnectionManager(McpHttpClient client) {
        this.client = client;
    }

    public McpHttpClient client() {
        return client;
    }

    @Override
    public void initialize(Session session) {
        if (session.isInitialized()) {
            return;
        }
        String sessionId = client.initialize(session.baseAddress(), session.seed());
        session.assignId(sessionId);
        LOG.debug("Initialized session {} at {}", sessionId, session.baseAddress());
    }

    @Override
    public void close(Session session) {
        String id = session.id();
        if (id == null || !session.markClosed()) {
            return;
        }
        try {
            client.terminate(session.baseAddress(), id);
        } catch (RuntimeException e) {
            LOG.warn("Failed to close session {} at {}: {}", id, session.baseAddress(), e.getMessage());
        }
    }
}
