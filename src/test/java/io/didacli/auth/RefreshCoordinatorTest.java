package io.didacli.auth;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

final class RefreshCoordinatorTest {

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        RefreshCoordinator coordinator = new RefreshCoordinator();
        AtomicInteger refreshes = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        AtomicReference<Credential> ownerResult = new AtomicReference<>();
        Thread owner = new Thread(() -> ownerResult.set(coordinator.withMutex(() -> {
            refreshes.incrementAndGet();
            started.countDown();
            await(release);
            return Credential.ofAccessToken("fresh");
        })));
        owner.start();
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
        Assertions.assertTrue(coordinator.inFlight());

        List<Thread> joiners = new ArrayList<>();
        List<AtomicReference<Credential>> joinerResults = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            AtomicReference<Credential> result = new AtomicReference<>();
            Thread joiner = new Thread(() -> result.set(coordinator.withMutex(() -> {
                refreshes.incrementAndGet();
                return Credential.ofAccessToken("duplicate");
            })));
            joiner.start();
            joiners.add(joiner);
            joinerResults.add(result);
        }
        for (Thread joiner : joiners) {
            awaitWaiting(joiner);
        }
        release.countDown();
        owner.join(5_000L);
        for (Thread joiner : joiners) {
            joiner.join(5_000L);
        }

        Assertions.assertEquals(1, refreshes.get());
        for (AtomicReference<Credential> result : joinerResults) {
            Assertions.assertSame(ownerResult.get(), result.get());
        }
        Assertions.assertFalse(coordinator.inFlight());
    }

    @Test
    void failureIsSeenByWaitersAndSlotResets() throws Exception {
        RefreshCoordinator coordinator = new RefreshCoordinator();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        IllegalStateException failure = new IllegalStateException("refresh rejected");

        AtomicReference<Throwable> ownerError = new AtomicReference<>();
        AtomicReference<Throwable> joinerError = new AtomicReference<>();
        Thread owner = new Thread(() -> ownerError.set(capture(coordinator, () -> {
            started.countDown();
            await(release);
            throw failure;
        })));
        owner.start();
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
        Thread joiner = new Thread(() -> joinerError.set(capture(coordinator,
                () -> Credential.ofAccessToken("unexpected"))));
        joiner.start();
        awaitWaiting(joiner);
        release.countDown();
        owner.join(5_000L);
        joiner.join(5_000L);

        Assertions.assertSame(failure, ownerError.get());
        Assertions.assertSame(failure, joinerError.get());

        Credential next = coordinator.withMutex(() -> Credential.ofAccessToken("retry"));
        Assertions.assertEquals("retry", next.accessToken());
    }

    private static Throwable capture(RefreshCoordinator coordinator, Supplier<Credential> refresh) {
        try {
            coordinator.withMutex(refresh);
            return null;
        } catch (RuntimeException e) {
            return e;
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (thread.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
        Assertions.assertEquals(Thread.State.WAITING, thread.getState());
    }
}
