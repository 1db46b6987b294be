package com.cronix.scheduler.engine;

import java.time.Duration;

/**
 * Pause between retry attempts. Tests replace it to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
