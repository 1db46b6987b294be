package com.cronix.scheduler.domain;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one logical run of a job, retries included. A record starts as
 * {@link JobLogStatus#RUNNING} without {@code finishedAt} and is never changed
 * again once finalized.
 */
@Value
@Builder(toBuilder = true)
public class JobLog {
    String id;
    String jobId;
    Instant startedAt;
    Instant finishedAt;
    Long durationMs;
    JobLogStatus status;
    Integer responseCode;
    String error;
    String responseBody;
    int attempts;

    public boolean isFinalized() {
        return finishedAt != null;
    }
}
