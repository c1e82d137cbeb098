package io.didacli.error;

public final class ValidationException extends DidaException {
    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(message, "VALIDATION_ERROR", 400, field, null);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
