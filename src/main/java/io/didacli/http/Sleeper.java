package io.didacli.http;

import java.time.Duration;

/**
 * Waits between retry attempts. Swappable so the backoff schedule can be
 * observed without actually sleeping.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
