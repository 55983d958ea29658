package io.rolloutkit.env;

/** A policy or environment produced something unusable, such as a malformed tool call. */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
