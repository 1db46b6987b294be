package com.cronix.scheduler.engine;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Defaults applied to jobs that do not set their own limits.
 */
@Value
@Builder
public class ExecutorSettings {
    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(30);
    @Builder.Default
    int defaultRetries = 0;
    @Builder.Default
    int responseBodyLimit = 1 << 20;
    /** records kept per job after each run, 0 keeps everything */
    @Builder.Default
    int maxLogsPerJob = 5;
}
