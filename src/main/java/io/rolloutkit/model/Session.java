package io.rolloutkit.model;

import java.util.Objects;

/**
 * Handle to one remote environment session. The id is assigned once by the connection
 * manager; afterwards only {@code terminated} and the closed flag change.
 */
public final class Session {
    private final String baseAddress;
    private final long seed;
    private volatile String id;
    private volatile boolean terminated;
    private boolean closed;

    public Session(String baseAddress, long seed) {
        this.baseAddress = Objects.requireNonNull(baseAddress, "baseAddress");
        this.seed = seed;
    }

    public String baseAddress() {
        return baseAddress;
    }

    public long seed() {
        return seed;
    }

    public String id() {
        return id;
    }

    public boolean isInitialized() {
        return id != null;
    }

    public synchronized void assignId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
        if (id != null && !id.equals(sessionId)) {
            throw new IllegalStateException("Session already bound to " + id);
        }
        this.id = sessionId;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public void markTerminated() {
        this.terminated = true;
    }

    /** Returns true for the first caller only, so a session is released at most once. */
    public synchronized boolean markClosed() {
        if (closed) {
            return false;
        }
        closed = true;
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", base=" + baseAddress + ", seed=" + seed + ", terminated=" + terminated + "}";
    }
}
