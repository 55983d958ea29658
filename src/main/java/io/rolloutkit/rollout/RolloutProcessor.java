package io.rolloutkit.rollout;

import io.rolloutkit.model.EvaluationRow;

/**
 * Turns an input row into a completed row. The returned row's status decides whether the
 * attempt counts as finished; throwing counts as an error.
 */
@FunctionalInterface
public interface RolloutProcessor {

    EvaluationRow process(EvaluationRow row, RolloutContext context) throws Exception;
}
