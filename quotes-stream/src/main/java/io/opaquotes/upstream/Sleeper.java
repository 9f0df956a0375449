package io.opaquotes.upstream;

import java.time.Duration;

/**
 * Backoff sleep, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
