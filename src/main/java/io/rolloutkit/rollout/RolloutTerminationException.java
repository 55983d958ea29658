package io.rolloutkit.rollout;

/**
 * Stops a rollout on purpose. The trajectory collected so far is kept, the rollout counts
 * as finished and is never retried.
 */
public class RolloutTerminationException extends RuntimeException {
    public RolloutTerminationException(String message) {
        super(message);
    }
}
