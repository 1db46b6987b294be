package com.cronix.scheduler.store;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.domain.JobLogStatus;
import com.cronix.scheduler.exception.StoreException;

/**
 * Run history kept on the heap. Like the database foreign key, records can only be
 * created for jobs that exist in the given {@link JobStore}.
 */
public class InMemoryLogRecorder implements LogRecorder {
    private static final Comparator<JobLog> NEWEST_FIRST = Comparator.comparing(JobLog::getStartedAt).reversed()
            .thenComparing(JobLog::getId, Comparator.reverseOrder());

    private final JobStore jobs;
    private final Map<String, JobLog> logs = new LinkedHashMap<>();

    public InMemoryLogRecorder(JobStore jobs) {
        this.jobs = jobs;
    }

    @Override
    public synchronized JobLog begin(String jobId, Instant startedAt) {
        requireJob(jobId);
        JobLog log = JobLog.builder()
                .id(UUID.randomUUID().toString())
                .jobId(jobId)
                .startedAt(startedAt)
                .status(JobLogStatus.RUNNING)
                .build();
        logs.put(log.getId(), log);
        return log;
    }

    @Override
    public synchronized void complete(JobLog log) {
        JobLog current = logs.get(log.getId());
        if (current == null || current.isFinalized()) {
            return;
        }
        logs.put(log.getId(), log);
    }

    @Override
    public synchronized JobLog append(JobLog log) {
        requireJob(log.getJobId());
        JobLog stored = log.getId() == null ? log.toBuilder().id(UUID.randomUUID().toString()).build() : log;
        logs.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public synchronized List<JobLog> list(String jobId, int limit, int offset) {
        return logs.values().stream()
                .filter(l -> jobId.equals(l.getJobId()) && l.isFinalized())
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int cleanup(RetentionPolicy policy, Instant now) {
        int deleted = 0;
        if (policy.hasAgeLimit()) {
            Instant cutoff = now.minus(policy.getMaxAge());
            deleted += removeIf(l -> l.isFinalized() && l.getStartedAt().isBefore(cutoff));
        }
        if (policy.hasPerJobLimit()) {
            Map<String, Boolean> seen = new HashMap<>();
            for (JobLog log : new ArrayList<>(logs.values())) {
                if (seen.put(log.getJobId(), Boolean.TRUE) == null) {
                    deleted += trim(log.getJobId(), policy.getMaxPerJob());
                }
            }
        }
        return deleted;
    }

    @Override
    public synchronized int cleanupJob(String jobId, int keep) {
        return trim(jobId, keep);
    }

    @Override
    public synchronized int deleteByJob(String jobId) {
        return removeIf(l -> jobId.equals(l.getJobId()));
    }

    @Override
    public synchronized int failUnfinished(String error, Instant finishedAt) {
        int n = 0;
        for (Map.Entry<String, JobLog> e : logs.entrySet()) {
            JobLog log = e.getValue();
            if (!log.isFinalized()) {
                Instant end = finishedAt.isBefore(log.getStartedAt()) ? log.getStartedAt() : finishedAt;
                e.setValue(log.toBuilder()
                        .status(JobLogStatus.FAILURE)
                        .finishedAt(end)
                        .durationMs(Duration.between(log.getStartedAt(), end).toMillis())
                        .error(error)
                        .build());
                n++;
            }
        }
        return n;
    }

    private int trim(String jobId, int keep) {
        List<JobLog> finalized = list(jobId, Integer.MAX_VALUE, 0);
        int n = 0;
        for (int i = Math.max(keep, 0); i < finalized.size(); i++) {
            logs.remove(finalized.get(i).getId());
            n++;
        }
        return n;
    }

    private int removeIf(Predicate<JobLog> predicate) {
        int n = 0;
        Iterator<JobLog> it = logs.values().iterator();
        while (it.hasNext()) {
            if (predicate.test(it.next())) {
                it.remove();
                n++;
            }
        }
        return n;
    }

    private void requireJob(String jobId) {
        if (jobs.findById(jobId).isEmpty()) {
            throw new StoreException("job " + jobId + " does not exist", null);
        }
    }
}
