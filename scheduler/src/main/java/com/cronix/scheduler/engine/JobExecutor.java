package com.cronix.scheduler.engine;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.domain.JobLogStatus;
import com.cronix.scheduler.exception.StoreException;
import com.cronix.scheduler.http.HttpInvoker;
import com.cronix.scheduler.http.HttpStatusText;
import com.cronix.scheduler.http.OutboundRequest;
import com.cronix.scheduler.http.OutboundResponse;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.cronix.scheduler.store.LogRecorder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one job: issues the HTTP call with retries and records the run as a single
 * log entry. Callers are responsible for making sure a job runs at most once at a time.
 */
@Slf4j
@RequiredArgsConstructor
public class JobExecutor {
    private final HttpInvoker invoker;
    private final LogRecorder logs;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorSettings settings;
    private final SchedulerMetrics metrics;

    /**
     * Executes {@code job} and returns the finalized record. Execution failures are
     * data in the record, never exceptions.
     */
    public JobLog execute(Job job) {
        Instant startedAt = clock.instant();
        JobLog running = null;
        try {
            running = logs.begin(job.getId(), startedAt);
        } catch (StoreException e) {
            log.warn("Could not open run record for job {}, will append at the end: {}", job.getId(), e.getMessage());
        }

        metrics.incInFlight();
        Attempts outcome;
        try {
            outcome = attempt(job);
        } finally {
            metrics.decInFlight();
        }

        Instant finishedAt = clock.instant();
        if (finishedAt.isBefore(startedAt)) {
            finishedAt = startedAt;
        }
        JobLog.JobLogBuilder builder = running == null
                ? JobLog.builder().jobId(job.getId()).startedAt(startedAt)
                : running.toBuilder();
        JobLog done = builder
                .finishedAt(finishedAt)
                .durationMs(Duration.between(startedAt, finishedAt).toMillis())
                .status(outcome.status)
                .responseCode(outcome.responseCode)
                .error(outcome.error)
                .responseBody(outcome.responseBody)
                .attempts(outcome.attempts)
                .build();

        try {
            if (running != null) {
                logs.complete(done);
            } else {
                done = logs.append(done);
            }
            if (settings.getMaxLogsPerJob() > 0) {
                logs.cleanupJob(job.getId(), settings.getMaxLogsPerJob());
            }
        } catch (StoreException e) {
            log.error("Failed to record run of job {}", job.getId(), e);
        }

        metrics.incRun(done.getStatus().wireName());
        metrics.observeAttempts(done.getAttempts());
        metrics.observeRunSeconds(done.getDurationMs() / 1000.0);
        if (done.getStatus() == JobLogStatus.SUCCESS) {
            log.info("Job {} ({}) succeeded with {} in {}ms", job.getName(), job.getId(), done.getResponseCode(),
                    done.getDurationMs());
        } else {
            log.warn("Job {} ({}) failed after {} attempt(s): {}", job.getName(), job.getId(), done.getAttempts(),
                    done.getError());
        }
        return done;
    }

    private Attempts attempt(Job job) {
        int retries = job.getMaxRetries() == null ? settings.getDefaultRetries() : job.getMaxRetries();
        Duration timeout = job.getTimeoutSeconds() == null
                ? settings.getDefaultTimeout()
                : Duration.ofSeconds(job.getTimeoutSeconds());
        OutboundRequest request = OutboundRequest.builder()
                .url(job.getEndpoint())
                .method(job.getMethod())
                .headers(job.getHeaders())
                .body(job.getBody())
                .timeout(timeout)
                .bodyLimit(settings.getResponseBodyLimit())
                .build();

        int maxAttempts = 1 + Math.max(retries, 0);
        Attempts last = null;
        for (int n = 1; n <= maxAttempts; n++) {
            try {
                OutboundResponse response = invoker.invoke(request);
                if (response.isSuccessful()) {
                    return new Attempts(JobLogStatus.SUCCESS, response.getStatus(), null, response.getBody(), n);
                }
                String error = "unexpected status " + HttpStatusText.of(response.getStatus());
                last = new Attempts(JobLogStatus.FAILURE, response.getStatus(), error, response.getBody(), n);
                if (!response.isServerError()) {
                    return last;
                }
            } catch (HttpTimeoutException e) {
                last = new Attempts(JobLogStatus.FAILURE, null, "timeout after " + timeout.toMillis() + "ms", null, n);
            } catch (IOException e) {
                last = new Attempts(JobLogStatus.FAILURE, null, describe(e), null, n);
            } catch (IllegalArgumentException e) {
                // URI or method the client refuses, retrying cannot help
                return new Attempts(JobLogStatus.FAILURE, null, describe(e), null, n);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Attempts(JobLogStatus.FAILURE, null, "interrupted", null, n);
            }

            if (n < maxAttempts) {
                metrics.incRetry();
                Duration delay = backoff.delay(n);
                log.debug("Job {} attempt {} failed ({}), retrying in {}ms", job.getId(), n, last.error,
                        delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return last;
                }
            }
        }
        return last;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static final class Attempts {
        final JobLogStatus status;
        final Integer responseCode;
        final String error;
        final String responseBody;
        final int attempts;

        Attempts(JobLogStatus status, Integer responseCode, String error, String responseBody, int attempts) {
            this.status = status;
            this.responseCode = responseCode;
            this.error = error;
            this.responseBody = responseBody == null || responseBody.isEmpty() ? null : responseBody;
            this.attempts = attempts;
        }
    }
}
