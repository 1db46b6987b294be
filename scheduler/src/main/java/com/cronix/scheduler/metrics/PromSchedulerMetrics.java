package com.cronix.scheduler.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus-backed implementation of SchedulerMetrics.
 */
public class PromSchedulerMetrics implements SchedulerMetrics {
    private final Counter runsTotal;
    private final Histogram runAttempts;
    private final Histogram runDurationSeconds;
    private final Counter retriesTotal;
    private final Gauge runsInFlight;
    private final Counter skippedTotal;
    private final Counter rejectedTotal;
    private final Counter httpRequestsTotal;

    public PromSchedulerMetrics(CollectorRegistry registry, boolean jvmExports) {
        if (jvmExports) {
            // register default JVM metrics once
            DefaultExports.register(registry);
        }

        this.runsTotal = Counter.build()
                .name("cronix_job_runs_total")
                .help("Finished job runs by status")
                .labelNames("status")
                .register(registry);
        this.runAttempts = Histogram.build()
                .name("cronix_job_run_attempts")
                .help("HTTP attempts per job run")
                .buckets(1, 2, 3, 5, 8, 11)
                .register(registry);
        this.runDurationSeconds = Histogram.build()
                .name("cronix_job_run_duration_seconds")
                .help("Wall time of a job run including retries")
                .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0, 300.0)
                .register(registry);
        this.retriesTotal = Counter.build()
                .name("cronix_job_retries_total")
                .help("Retried HTTP attempts")
                .register(registry);
        this.runsInFlight = Gauge.build()
                .name("cronix_job_runs_in_flight")
                .help("Job runs currently executing")
                .register(registry);
        this.skippedTotal = Counter.build()
                .name("cronix_fires_skipped_total")
                .help("Scheduled fires that did not run")
                .labelNames("reason")
                .register(registry);
        this.rejectedTotal = Counter.build()
                .name("cronix_dispatch_rejected_total")
                .help("Fires rejected because the worker queue was full")
                .register(registry);
        this.httpRequestsTotal = Counter.build()
                .name("cronix_http_requests_total")
                .help("API HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);
    }

    @Override
    public void incRun(String status) {
        runsTotal.labels(status).inc();
    }

    @Override
    public void observeAttempts(int attempts) {
        runAttempts.observe(attempts);
    }

    @Override
    public void observeRunSeconds(double seconds) {
        runDurationSeconds.observe(seconds);
    }

    @Override
    public void incRetry() {
        retriesTotal.inc();
    }

    @Override
    public void incInFlight() {
        runsInFlight.inc();
    }

    @Override
    public void decInFlight() {
        runsInFlight.dec();
    }

    @Override
    public void incSkipped(String reason) {
        skippedTotal.labels(reason).inc();
    }

    @Override
    public void incRejected() {
        rejectedTotal.inc();
    }

    @Override
    public void incHttpRequest(String path, String method, int status) {
        httpRequestsTotal.labels(path, method, String.valueOf(status)).inc();
    }
}
