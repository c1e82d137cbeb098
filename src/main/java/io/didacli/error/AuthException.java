package io.didacli.error;

public final class AuthException extends DidaException {
    public AuthException(String message) {
        this(message, null);
    }

    public AuthException(String message, Throwable cause) {
        super(message, "AUTH_ERROR", null, null, cause);
    }
}
