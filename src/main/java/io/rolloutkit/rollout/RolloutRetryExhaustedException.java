package io.rolloutkit.rollout;

import io.rolloutkit.model.EvaluationRow;

public final class RolloutRetryExhaustedException extends RuntimeException {
    private final EvaluationRow row;
    private final int attempts;

    public RolloutRetryExhaustedException(EvaluationRow row, int attempts) {
        super("Rollout for row " + row.rowId() + " failed after " + attempts + " attempts: "
                + (row.rolloutStatus() == null ? "" : row.rolloutStatus().message()));
        this.row = row;
        this.attempts = attempts;
    }

    public EvaluationRow row() {
        return row;
    }

    public int attempts() {
        return attempts;
    }
}
