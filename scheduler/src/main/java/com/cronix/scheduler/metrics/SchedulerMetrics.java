package com.cronix.scheduler.metrics;

/**
 * Metrics hook for the scheduler service. Default is no-op.
 */
public interface SchedulerMetrics {
    void incRun(String status);

    void observeAttempts(int attempts);

    void observeRunSeconds(double seconds);

    void incRetry();

    void incInFlight();

    void decInFlight();

    /**
     * A scheduled fire that did not run; {@code reason} is busy, inactive, missing or store_error.
     */
    void incSkipped(String reason);

    void incRejected();

    void incHttpRequest(String path, String method, int status);

    static SchedulerMetrics noop() {
        return new SchedulerMetrics() {
            public void incRun(String status) {
            }

            public void observeAttempts(int attempts) {
            }

            public void observeRunSeconds(double seconds) {
            }

            public void incRetry() {
            }

            public void incInFlight() {
            }

            public void decInFlight() {
            }

            public void incSkipped(String reason) {
            }

            public void incRejected() {
            }

            public void incHttpRequest(String path, String method, int status) {
            }
        };
    }
}
