package io.rolloutkit.rollout;

/** Where an attempt sits: the row's position in its batch and the 1-based attempt number. */
public record RolloutContext(int rowIndex, int attempt, String invocationId) {
}
