package io.rolloutkit.store;

import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.StatusCode;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of {@link EvaluationRow}s, shared between the process running rollouts and
 * the liveness watcher. {@link #log} is an upsert keyed by {@code row_id}.
 */
public interface RowStore extends AutoCloseable {

    void init();

    void log(EvaluationRow row);

    List<EvaluationRow> read();

    default Optional<EvaluationRow> read(String rowId) {
        return read().stream().filter(r -> r.rowId().equals(rowId)).findFirst();
    }

    default List<EvaluationRow> findByStatus(StatusCode code) {
        return read().stream()
                .filter(r -> r.rolloutStatus() != null && r.rolloutStatus().code() == code)
                .toList();
    }

    @Override
    default void close() {
    }
}
