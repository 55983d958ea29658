package io.rolloutkit.rollout;

public enum RolloutState {
    RESET,
    AWAITING_POLICY,
    STEPPING,
    CHECKING_CONTROL_PLANE,
    TERMINATED
}
