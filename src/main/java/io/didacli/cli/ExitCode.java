package io.didacli.cli;

import io.didacli.error.AuthException;
import io.didacli.error.NetworkException;
import io.didacli.error.NotFoundException;
import io.didacli.error.NotImplementedException;
import io.didacli.error.ValidationException;

/** Process exit statuses; stable so scripts can branch on them. */
public final class ExitCode {
    public static final int OK = 0;
    public static final int UNKNOWN = 1;
    public static final int VALIDATION = 2;
    public static final int AUTH = 3;
    public static final int NOT_FOUND = 4;
    public static final int NETWORK = 5;
    public static final int NOT_IMPLEMENTED = 6;

    private ExitCode() {
    }

    public static int forError(Throwable error) {
        if (error instanceof ValidationException) {
            return VALIDATION;
        }
        if (error instanceof AuthException) {
            return AUTH;
        }
        if (error instanceof NotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof NetworkException) {
            return NETWORK;
        }
        if (error instanceof NotImplementedException) {
            return NOT_IMPLEMENTED;
        }
        return UNKNOWN;
    }
}
