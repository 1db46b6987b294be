package com.cronix.scheduler.engine;

import java.time.Instant;

/**
 * Receives due fires from the {@link JobScheduler}. Implementations must return
 * quickly; the scheduling loop calls them inline.
 */
@FunctionalInterface
public interface JobDispatcher {
    void dispatch(String jobId, Instant fireAt);
}
