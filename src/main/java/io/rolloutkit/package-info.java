/**
 * RolloutKit source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.rolloutkit.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.rolloutkit.rollout.ExecutionManager} runs batches of rollouts on a bounded pool.</li>
 *   <li>{@code io.rolloutkit.rollout.RolloutExecutor} is the per-rollout conversation loop.</li>
 *   <li>{@code io.rolloutkit.rollout.RetryingRolloutRunner} persists rows and retries them one by one.</li>
 *   <li>{@code io.rolloutkit.watcher.EvalWatcher} repairs rows orphaned by dead processes.</li>
 * </ul>
 */
package io.rolloutkit;
