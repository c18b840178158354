package de.bsommerfeld.harvester.frameio;

import java.time.Duration;

/**
 * Blocking pause used for throttling and backoff. Production code sleeps the
 * calling thread; tests substitute an implementation that records the
 * requested durations.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
