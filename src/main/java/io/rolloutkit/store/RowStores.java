package io.rolloutkit.store;

import io.rolloutkit.config.EngineSettings;
import io.rolloutkit.config.RolloutKitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-wide row store with an explicit lifecycle. Callers that can take a
 * {@link RowStore} as a constructor argument should; this holder serves the CLI and
 * other entry points that need one shared instance.
 */
public final class RowStores {
    private static final Logger LOG = LoggerFactory.getLogger(RowStores.class);
    private static RowStore current;

    private RowStores() {
    }

    public static RowStore create(RolloutKitConfig config, EngineSettings settings) {
        RowStore store = switch (settings.rowStore()) {
            case SQLITE -> new SqliteRowStore(config.sqliteFile());
            case JSONL -> new JsonlRowStore(
                    config.datasetsDir(),
                    Duration.ofMillis(settings.lockTimeoutMs()),
                    Clock.systemUTC()
            );
        };
        store.init();
        return store;
    }

    public static synchronized RowStore init(RolloutKitConfig config, EngineSettings settings) {
        if (current != null) {
            throw new IllegalStateException("Row store already initialized");
        }
        current = create(config, settings);
        LOG.info("Row store initialized: {} at {}", settings.rowStore(), config.rootDir());
        return current;
    }

    public static synchronized RowStore get() {
        if (current == null) {
            throw new IllegalStateException("Row store not initialized; call RowStores.init first");
        }
        return current;
    }

    public static synchronized void shutdown() {
        if (current == null) {
            return;
        }
        try {
            current.close();
        } finally {
            current = null;
        }
    }
}
