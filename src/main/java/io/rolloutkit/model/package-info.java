/**
 * Value types shared by the engine: sessions, tool calls, conversation messages,
 * trajectories and the persisted {@link io.rolloutkit.model.EvaluationRow}.
 *
 * <p>Everything here serializes with Jackson using the snake_case field names found in
 * row files and recordings.
 */
package io.rolloutkit.model;
