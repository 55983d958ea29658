package io.rolloutkit.lock;

public final class LockTimeoutException extends RuntimeException {
    private final Long holderPid;

    public LockTimeoutException(String message, Long holderPid) {
        super(message);
        this.holderPid = holderPid;
    }

    public LockTimeoutException(String message, Throwable cause) {
        super(message, cause);
        this.holderPid = null;
    }

    public Long holderPid() {
        return holderPid;
    }
}
