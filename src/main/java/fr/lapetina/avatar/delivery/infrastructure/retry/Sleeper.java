package fr.lapetina.avatar.delivery.infrastructure.retry;

import java.time.Duration;

/**
 * Suspends the calling thread between retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
