package io.rolloutkit.mcp;

import io.rolloutkit.env.TransportException;
import io.rolloutkit.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Opens and closes remote sessions. {@link #initialize} fails fast with
 * {@link TransportException}; {@link #close} is idempotent and never throws.
 */
public interface ConnectionManager {

    void initialize(Session session);

    void close(Session session);

    default void initializeAll(List<Session> sessions, int maxConcurrency) {
        if (sessions.isEmpty()) {
            return;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(maxConcurrency, sessions.size())));
        try {
            List<Future<?>> futures = new ArrayList<>(sessions.size());
            for (Session session : sessions) {
                futures.add(pool.submit(() -> initialize(session)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TransportException("Failed to initialize sessions", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while initializing sessions", e);
        } finally {
            pool.shutdownNow();
        }
    }

    default void closeAll(List<Session> sessions, int maxConcurrency) {
        if (sessions.isEmpty()) {
            return;
        }
        Logger log = LoggerFactory.getLogger(ConnectionManager.class);
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(maxConcurrency, sessions.size())));
        try {
            List<Future<?>> futures = new ArrayList<>(sessions.size());
            for (Session session : sessions) {
                futures.add(pool.submit(() -> close(session)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.warn("Session close failed: {}", e.getCause().toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing {} sessions", sessions.size());
        } finally {
            pool.shutdown();
        }
    }
}
