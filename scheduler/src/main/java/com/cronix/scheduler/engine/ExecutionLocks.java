package com.cronix.scheduler.engine;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * One permit per job so that a job never has two runs in flight.
 */
public class ExecutionLocks {
    private final ConcurrentMap<String, Semaphore> locks = new ConcurrentHashMap<>();
    // deleted jobs whose permit was still held when they were forgotten
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String jobId) {
        return semaphore(jobId).tryAcquire();
    }

    public boolean tryAcquire(String jobId, Duration wait) throws InterruptedException {
        return semaphore(jobId).tryAcquire(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void release(String jobId) {
        Semaphore s = locks.get(jobId);
        if (s == null) {
            return;
        }
        s.release();
        if (retired.contains(jobId)) {
            forget(jobId);
        }
    }

    public boolean isBusy(String jobId) {
        Semaphore s = locks.get(jobId);
        return s != null && s.availablePermits() == 0;
    }

    /**
     * Drops the permit of a deleted job. If a run still holds it, the entry is
     * dropped when that run releases.
     */
    public void forget(String jobId) {
        retired.add(jobId);
        Semaphore s = locks.get(jobId);
        if (s == null) {
            retired.remove(jobId);
            return;
        }
        if (s.tryAcquire()) {
            locks.remove(jobId, s);
            retired.remove(jobId);
        }
    }

    int size() {
        return locks.size();
    }

    private Semaphore semaphore(String jobId) {
        return locks.computeIfAbsent(jobId, k -> new Semaphore(1));
    }
}
