package io.didacli.error;

public final class NotFoundException extends DidaException {
    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id, "NOT_FOUND", 404, resource + "/" + id, null);
    }
}
