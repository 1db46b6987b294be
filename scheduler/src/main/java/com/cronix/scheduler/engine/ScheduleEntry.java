package com.cronix.scheduler.engine;

import java.time.Instant;

import com.cronix.cron.CronExpression;

/**
 * A job's place in the fire order. Ties on {@code fireAt} keep insertion order.
 */
final class ScheduleEntry implements Comparable<ScheduleEntry> {
    final String jobId;
    final CronExpression cron;
    final Instant fireAt;
    final long seq;

    ScheduleEntry(String jobId, CronExpression cron, Instant fireAt, long seq) {
        this.jobId = jobId;
        this.cron = cron;
        this.fireAt = fireAt;
        this.seq = seq;
    }

    @Override
    public int compareTo(ScheduleEntry o) {
        int c = fireAt.compareTo(o.fireAt);
        return c != 0 ? c : Long.compare(seq, o.seq);
    }
}
