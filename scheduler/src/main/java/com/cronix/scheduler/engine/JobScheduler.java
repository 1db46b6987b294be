package com.cronix.scheduler.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.cronix.cron.CronExpression;
import com.cronix.cron.InvalidScheduleException;
import com.cronix.cron.NoUpcomingFireTimeException;
import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.exception.StoreException;
import com.cronix.scheduler.store.JobStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps every active job ordered by its next fire time and hands due jobs to a
 * {@link JobDispatcher}.
 *
 * <p>A single loop thread owns the ordering. Other threads change it only through
 * commands queued by {@link #register}, {@link #update} and {@link #remove}; the
 * loop applies them between fires. Fires that were missed while the process was
 * busy or down are not replayed: after a fire the next time is computed from now.
 * The one exception is startup, where a job whose stored next fire time has
 * passed fires once right away.
 */
@Slf4j
public class JobScheduler implements AutoCloseable {
    static final Duration MAX_WAIT = Duration.ofSeconds(1);

    private final JobStore store;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final ZoneId zone;

    private final TreeSet<ScheduleEntry> queue = new TreeSet<>();
    private final Map<String, ScheduleEntry> entries = new HashMap<>();
    private final Map<String, Instant> published = new ConcurrentHashMap<>();
    private final BlockingQueue<Runnable> commands = new LinkedBlockingQueue<>();
    private final AtomicLong seq = new AtomicLong();
    private final ExecutorService bookkeeping = Executors.newSingleThreadExecutor(
            ExecutionService.namedThreads("cronix-bookkeeping-"));

    private volatile boolean running;
    private volatile boolean closed;
    private Thread loop;

    public JobScheduler(JobStore store, JobDispatcher dispatcher, Clock clock, ZoneId zone) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Loads active jobs from the store and starts the loop.
     *
     * @return number of jobs scheduled
     */
    public synchronized int start() {
        if (running || closed) {
            throw new IllegalStateException("scheduler already started or closed");
        }
        List<Job> active = store.listActive();
        Instant now = clock.instant();
        int scheduled = 0;
        for (Job job : active) {
            CronExpression cron;
            try {
                cron = CronExpression.parse(job.getSchedule());
            } catch (InvalidScheduleException e) {
                log.warn("Not scheduling job {} ({}): {}", job.getName(), job.getId(), e.getMessage());
                continue;
            }
            Instant fireAt;
            if (job.getNextFireAt() != null && !job.getNextFireAt().isAfter(now)) {
                log.info("Job {} ({}) missed its fire at {}, catching up", job.getName(), job.getId(),
                        job.getNextFireAt());
                fireAt = now;
            } else {
                fireAt = nextOrNull(job.getId(), cron, now);
                if (fireAt == null) {
                    continue;
                }
                persist(job.getId(), fireAt);
            }
            insert(job.getId(), cron, fireAt);
            scheduled++;
        }

        running = true;
        loop = new Thread(this::runLoop, "cronix-scheduler");
        loop.setDaemon(true);
        loop.start();
        log.info("Scheduler started with {} job(s) in zone {}", scheduled, zone);
        return scheduled;
    }

    /**
     * Adds an active job, or replaces its entry. The schedule is parsed on the
     * calling thread; the returned future completes with the next fire time
     * (null when the job is inactive) once the loop has applied the change.
     *
     * @throws InvalidScheduleException if the schedule does not parse
     */
    public CompletableFuture<Instant> register(Job job) {
        if (!job.isActive()) {
            return remove(job.getId()).thenApply(ignored -> (Instant) null);
        }
        CronExpression cron = CronExpression.parse(job.getSchedule());
        String jobId = job.getId();
        CompletableFuture<Instant> done = new CompletableFuture<>();
        submit(done, () -> {
            dequeue(jobId);
            Instant next = nextOrNull(jobId, cron, clock.instant());
            if (next == null) {
                done.completeExceptionally(new NoUpcomingFireTimeException(cron.getExpression(),
                        clock.instant().atZone(zone)));
                return;
            }
            insert(jobId, cron, next);
            persist(jobId, next);
            done.complete(next);
        });
        return done;
    }

    /**
     * Same as {@link #register}; an inactive job is dequeued.
     */
    public CompletableFuture<Instant> update(Job job) {
        return register(job);
    }

    /**
     * Dequeues a job and clears its stored next fire time. Completes with true if
     * it was scheduled.
     */
    public CompletableFuture<Boolean> remove(String jobId) {
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        submit(done, () -> {
            boolean removed = dequeue(jobId);
            if (removed) {
                persist(jobId, null);
            }
            done.complete(removed);
        });
        return done;
    }

    public Optional<Instant> nextFireTime(String jobId) {
        return Optional.ofNullable(published.get(jobId));
    }

    public int size() {
        return published.size();
    }

    /**
     * Makes the loop look at the clock now instead of at the end of its wait.
     */
    public void wakeUp() {
        commands.offer(() -> {
        });
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
        }
        wakeUp();
        if (loop != null) {
            try {
                loop.join(MAX_WAIT.toMillis() * 5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        bookkeeping.shutdown();
        try {
            bookkeeping.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    private void submit(CompletableFuture<?> done, Runnable command) {
        if (closed) {
            done.completeExceptionally(new IllegalStateException("scheduler is closed"));
            return;
        }
        commands.offer(() -> {
            try {
                command.run();
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
    }

    private void runLoop() {
        while (running) {
            try {
                long waitMs = MAX_WAIT.toMillis();
                if (!queue.isEmpty()) {
                    long untilDue = Duration.between(clock.instant(), queue.first().fireAt).toMillis();
                    waitMs = Math.max(0, Math.min(waitMs, untilDue));
                }
                Runnable command = waitMs == 0 ? commands.poll() : commands.poll(waitMs, TimeUnit.MILLISECONDS);
                while (command != null) {
                    command.run();
                    command = commands.poll();
                }
                if (running) {
                    fireDue(clock.instant());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Scheduler loop error", e);
            }
        }
        Runnable pending;
        while ((pending = commands.poll()) != null) {
            pending.run();
        }
    }

    private void fireDue(Instant now) {
        while (!queue.isEmpty() && !queue.first().fireAt.isAfter(now)) {
            ScheduleEntry due = queue.pollFirst();
            entries.remove(due.jobId);

            Instant next = nextOrNull(due.jobId, due.cron, now);
            if (next != null) {
                insert(due.jobId, due.cron, next);
            } else {
                published.remove(due.jobId);
            }
            persist(due.jobId, next);

            try {
                dispatcher.dispatch(due.jobId, due.fireAt);
            } catch (RuntimeException e) {
                log.error("Dispatch of job {} failed", due.jobId, e);
            }
        }
    }

    private void insert(String jobId, CronExpression cron, Instant fireAt) {
        ScheduleEntry entry = new ScheduleEntry(jobId, cron, fireAt, seq.incrementAndGet());
        queue.add(entry);
        entries.put(jobId, entry);
        published.put(jobId, fireAt);
    }

    private boolean dequeue(String jobId) {
        ScheduleEntry old = entries.remove(jobId);
        published.remove(jobId);
        if (old == null) {
            return false;
        }
        queue.remove(old);
        return true;
    }

    private Instant nextOrNull(String jobId, CronExpression cron, Instant after) {
        try {
            return cron.next(after, zone);
        } catch (NoUpcomingFireTimeException e) {
            log.warn("Job {} dropped from schedule: {}", jobId, e.getMessage());
            return null;
        }
    }

    private void persist(String jobId, Instant nextFireAt) {
        if (closed) {
            return;
        }
        try {
            bookkeeping.execute(() -> {
                try {
                    store.updateNextFire(jobId, nextFireAt);
                } catch (StoreException e) {
                    log.warn("Could not store next fire time of job {}: {}", jobId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Bookkeeping stopped, next fire of job {} not stored", jobId);
        }
    }
}
