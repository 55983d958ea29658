package io.rolloutkit.env;

/** The environment could not be reached or answered with a transport-level failure. */
public class TransportException extends RuntimeException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
