package io.didacli.error;

/**
 * Transport-level failure: DNS, connect, timeout, interrupt, or an endpoint
 * that was never configured. No HTTP status is available.
 */
public final class NetworkException extends DidaException {
    public NetworkException(String message) {
        this(message, null);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, "NETWORK_ERROR", null, null, cause);
    }
}
