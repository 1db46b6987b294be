package com.cronix.scheduler.store;

import java.time.Instant;
import java.util.List;

import com.cronix.scheduler.domain.JobLog;

/**
 * Append-mostly history of job runs.
 */
public interface LogRecorder {
    /**
     * Creates a running record for a run that starts now.
     */
    JobLog begin(String jobId, Instant startedAt);

    /**
     * Finalizes a record created by {@link #begin}. Does nothing when the job, and
     * with it the record, has been deleted in the meantime.
     */
    void complete(JobLog log);

    /**
     * Inserts an already finalized record. Used when {@link #begin} failed.
     */
    JobLog append(JobLog log);

    /**
     * Finalized records of a job, newest first.
     */
    List<JobLog> list(String jobId, int limit, int offset);

    /**
     * Deletes records older than the policy's age window and, per job, all but
     * the newest {@code maxPerJob}. Returns the number of deleted records.
     */
    int cleanup(RetentionPolicy policy, Instant now);

    int cleanupJob(String jobId, int keep);

    int deleteByJob(String jobId);

    /**
     * Marks every unfinished record as failed. Called once at startup, when no run
     * can still be in flight.
     */
    int failUnfinished(String error, Instant finishedAt);
}
