package com.cronix.scheduler.store;

import java.time.Duration;

import lombok.Value;

/**
 * How much run history to keep. A null or non-positive {@code maxAge} disables the
 * age window, a non-positive {@code maxPerJob} disables the per-job cap.
 */
@Value
public class RetentionPolicy {
    Duration maxAge;
    int maxPerJob;

    public boolean hasAgeLimit() {
        return maxAge != null && !maxAge.isZero() && !maxAge.isNegative();
    }

    public boolean hasPerJobLimit() {
        return maxPerJob > 0;
    }
}
