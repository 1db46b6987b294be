package com.cronix.scheduler.engine;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential delay between retries: {@code base * 2^(retry-1)}, capped at {@code max},
 * optionally scaled by a random factor in [0.8, 1.2) and capped at {@code max} again.
 */
public class BackoffPolicy {
    private final long baseMs;
    private final long maxMs;
    private final boolean jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(long baseMs, long maxMs, boolean jitter) {
        this(baseMs, maxMs, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(long baseMs, long maxMs, boolean jitter, DoubleSupplier random) {
        if (baseMs < 0 || maxMs < baseMs) {
            throw new IllegalArgumentException("backoff needs 0 <= base <= max, got " + baseMs + "/" + maxMs);
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Delay before retry number {@code retry} (1 for the first retry).
     */
    public Duration delay(int retry) {
        int shift = Math.min(Math.max(retry - 1, 0), 30);
        long delay = Math.min(maxMs, baseMs << shift);
        if (delay < 0) {
            delay = maxMs;
        }
        if (jitter) {
            // jitter ±20%, never past the cap
            delay = Math.min(maxMs, (long) (delay * (0.8 + random.getAsDouble() * 0.4)));
        }
        return Duration.ofMillis(delay);
    }
}
