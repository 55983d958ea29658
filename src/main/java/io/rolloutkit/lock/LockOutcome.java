package io.rolloutkit.lock;

/** Result of an acquisition attempt; contention is a value, not an exception. */
public record LockOutcome(boolean acquired, Long holderPid) {
    public static LockOutcome granted() {
        return new LockOutcome(true, null);
    }

    public static LockOutcome heldBy(long pid) {
        return new LockOutcome(false, pid);
    }
}
