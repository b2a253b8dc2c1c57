package tech.tenderflow.ingest.time;

import java.time.Duration;

/**
 * Blocking pause, injectable so waits can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
