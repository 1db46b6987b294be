package com.cronix.scheduler.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.exception.JobBusyException;
import com.cronix.scheduler.exception.StoreException;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.cronix.scheduler.store.JobStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs fires handed over by the scheduler on a bounded worker pool and serves
 * manual runs. At most one run per job is in flight; a scheduled fire that finds
 * its job busy is skipped.
 */
@Slf4j
public class ExecutionService implements JobDispatcher, AutoCloseable {
    private final JobStore store;
    private final JobExecutor executor;
    private final ExecutionLocks locks;
    private final SchedulerMetrics metrics;
    private final Duration runNowWait;
    private final ThreadPoolExecutor pool;

    public ExecutionService(JobStore store, JobExecutor executor, ExecutionLocks locks, SchedulerMetrics metrics,
                            int maxConcurrent, int queueCapacity, Duration runNowWait) {
        this.store = store;
        this.executor = executor;
        this.locks = locks;
        this.metrics = metrics;
        this.runNowWait = runNowWait;
        this.pool = new ThreadPoolExecutor(maxConcurrent, maxConcurrent, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity), namedThreads("cronix-exec-"));
        this.pool.allowCoreThreadTimeOut(true);
    }

    @Override
    public void dispatch(String jobId, Instant fireAt) {
        try {
            pool.execute(() -> runScheduled(jobId, fireAt));
        } catch (RejectedExecutionException e) {
            metrics.incRejected();
            log.warn("Dropped fire of job {} at {}: worker queue full or shutting down", jobId, fireAt);
        }
    }

    /**
     * Runs {@code job} on the calling thread, waiting a bounded time for a run
     * already in flight to finish.
     *
     * @throws JobBusyException if the job is still running after the wait
     */
    public JobLog runNow(Job job) {
        boolean acquired;
        try {
            acquired = locks.tryAcquire(job.getId(), runNowWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobBusyException(job.getId());
        }
        if (!acquired) {
            throw new JobBusyException(job.getId());
        }
        try {
            log.info("Manual run of job {} ({})", job.getName(), job.getId());
            return executor.execute(job);
        } finally {
            locks.release(job.getId());
        }
    }

    public boolean isRunning(String jobId) {
        return locks.isBusy(jobId);
    }

    public void forget(String jobId) {
        locks.forget(jobId);
    }

    private void runScheduled(String jobId, Instant fireAt) {
        Optional<Job> job;
        try {
            job = store.findById(jobId);
        } catch (StoreException e) {
            metrics.incSkipped("store_error");
            log.error("Skipping fire of job {} at {}: cannot load job", jobId, fireAt, e);
            return;
        }
        if (job.isEmpty()) {
            metrics.incSkipped("missing");
            log.debug("Skipping fire of deleted job {}", jobId);
            return;
        }
        if (!job.get().isActive()) {
            metrics.incSkipped("inactive");
            log.debug("Skipping fire of inactive job {}", jobId);
            return;
        }
        if (!locks.tryAcquire(jobId)) {
            metrics.incSkipped("busy");
            log.warn("Skipping fire of job {} at {}: previous run still in flight", jobId, fireAt);
            return;
        }
        try {
            executor.execute(job.get());
        } catch (RuntimeException e) {
            log.error("Run of job {} aborted", jobId, e);
        } finally {
            locks.release(jobId);
        }
    }

    /**
     * Stops taking work, lets in-flight runs finish within {@code grace}, then
     * interrupts what is left.
     */
    public void shutdown(Duration grace) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} run(s) still active after {}s, interrupting", pool.getActiveCount(), grace.toSeconds());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(30));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
