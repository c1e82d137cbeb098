package io.didacli.error;

public final class NotImplementedException extends DidaException {
    public NotImplementedException() {
        this("Not implemented");
    }

    public NotImplementedException(String message) {
        super(message, "NOT_IMPLEMENTED", 501, null, null);
    }
}
