package io.didacli.error;

/**
 * The server answered, but not with something usable: a non-2xx status or a
 * success status whose body could not be parsed.
 */
public final class ApiException extends DidaException {
    public static final int MAX_BODY_CHARS = 500;

    private final String body;

    public ApiException(String message, int statusCode, String path, String body) {
        super("API returned HTTP " + statusCode + ": " + message, "API_ERROR", statusCode, path, null);
        this.body = truncate(body);
    }

    public int status() {
        return statusCode();
    }

    public String body() {
        return body;
    }

    static String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() <= MAX_BODY_CHARS ? body : body.substring(0, MAX_BODY_CHARS);
    }
}
