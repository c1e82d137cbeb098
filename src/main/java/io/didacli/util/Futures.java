package io.didacli.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {
    private Futures() {
    }

    /**
     * Waits for {@code future} and rethrows the exact exception it failed with,
     * so every waiter sees the same instance the owner threw.
     */
    public static <T> T joinUnwrapped(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
