package io.didacli.error;

/**
 * Base of every failure the CLI reports on purpose. Each subclass carries a
 * stable {@link #code()} that scripts can match on and that {@code ExitCode}
 * maps to a process exit status.
 */
public class DidaException extends RuntimeException {
    private final String code;
    private final Integer statusCode;
    private final String path;

    public DidaException(String message, String code) {
        this(message, code, null, null, null);
    }

    public DidaException(String message, String code, Integer statusCode, String path, Throwable cause) {
        super(message, cause);
        this.code = code == null || code.isBlank() ? "UNKNOWN_ERROR" : code;
        this.statusCode = statusCode;
        this.path = path;
    }

    public String code() {
        return code;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public String path() {
        return path;
    }

    public String type() {
        return getClass().getSimpleName();
    }
}
