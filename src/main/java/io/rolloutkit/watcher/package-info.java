/**
 * Cross-process liveness repair for rows whose owning process died mid-rollout.
 */
package io.rolloutkit.watcher;
