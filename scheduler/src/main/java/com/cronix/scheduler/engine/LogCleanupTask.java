package com.cronix.scheduler.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.cronix.scheduler.exception.StoreException;
import com.cronix.scheduler.store.LogRecorder;
import com.cronix.scheduler.store.RetentionPolicy;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies the retention policy to the run history at a fixed interval.
 */
@Slf4j
public class LogCleanupTask implements AutoCloseable {
    private final LogRecorder logs;
    private final RetentionPolicy policy;
    private final Clock clock;
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(
            ExecutionService.namedThreads("cronix-log-cleanup-"));

    public LogCleanupTask(LogRecorder logs, RetentionPolicy policy, Clock clock) {
        this.logs = logs;
        this.policy = policy;
        this.clock = clock;
    }

    public void start(Duration interval) {
        long minutes = Math.max(1, interval.toMinutes());
        timer.scheduleWithFixedDelay(this::runOnce, minutes, minutes, TimeUnit.MINUTES);
        log.info("Log cleanup every {} minute(s), max age {}, max {} per job", minutes, policy.getMaxAge(),
                policy.getMaxPerJob());
    }

    /**
     * One cleanup pass. Store failures are logged and retried on the next pass.
     */
    public int runOnce() {
        try {
            int deleted = logs.cleanup(policy, clock.instant());
            if (deleted > 0) {
                log.info("Log cleanup removed {} record(s)", deleted);
            }
            return deleted;
        } catch (StoreException e) {
            log.error("Log cleanup failed", e);
            return 0;
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
