package io.didacli.auth;

import io.didacli.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serializes credential refreshes. While one refresh runs, every other caller
 * waits for it and gets the same credential or the same exception; the slot
 * is released once the refresh settles.
 */
public final class RefreshCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);
    private static final RefreshCoordinator PROCESS_WIDE = new RefreshCoordinator();

    private final AtomicReference<CompletableFuture<Credential>> slot = new AtomicReference<>();

    public static RefreshCoordinator processWide() {
        return PROCESS_WIDE;
    }

    public Credential withMutex(Supplier<Credential> refresh) {
        CompletableFuture<Credential> mine = new CompletableFuture<>();
        CompletableFuture<Credential> running = slot.compareAndExchange(null, mine);
        if (running != null) {
            log.debug("joining in-flight credential refresh");
            return Futures.joinUnwrapped(running);
        }
        try {
            Credential refreshed = refresh.get();
            mine.complete(refreshed);
            return refreshed;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            slot.compareAndSet(mine, null);
        }
    }

    boolean inFlight() {
        return slot.get() != null;
    }
}
