/**
 * Rollout execution.
 *
 * <p>{@link io.rolloutkit.rollout.RolloutExecutor} owns one conversation from reset to
 * termination. {@link io.rolloutkit.rollout.ExecutionManager} fans a batch of them out on a
 * fixed pool and returns trajectories in request order.
 * {@link io.rolloutkit.rollout.RetryingRolloutRunner} works on persisted rows instead:
 * each attempt is written as {@code RUNNING} before it starts and retried on its own when it
 * does not finish.
 *
 * <p>Error classes:
 *
 * <ul>
 *   <li>transport failures abort the attempt and are retried at row granularity;</li>
 *   <li>protocol failures from the policy become no-op steps;</li>
 *   <li>{@link io.rolloutkit.rollout.RolloutTerminationException} stops a rollout and keeps it.</li>
 * </ul>
 */
package io.rolloutkit.rollout;
