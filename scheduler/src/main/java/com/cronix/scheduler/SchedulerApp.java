package com.cronix.scheduler;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

import com.cronix.scheduler.auth.Authenticator;
import com.cronix.scheduler.auth.SessionTokens;
import com.cronix.scheduler.domain.User;
import com.cronix.scheduler.engine.BackoffPolicy;
import com.cronix.scheduler.engine.ExecutionLocks;
import com.cronix.scheduler.engine.ExecutionService;
import com.cronix.scheduler.engine.ExecutorSettings;
import com.cronix.scheduler.engine.JobExecutor;
import com.cronix.scheduler.engine.JobScheduler;
import com.cronix.scheduler.engine.LogCleanupTask;
import com.cronix.scheduler.engine.Sleeper;
import com.cronix.scheduler.http.HttpInvoker;
import com.cronix.scheduler.metrics.PromSchedulerMetrics;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.cronix.scheduler.server.ApiJson;
import com.cronix.scheduler.server.ApiServer;
import com.cronix.scheduler.server.Cors;
import com.cronix.scheduler.server.Exchanges;
import com.cronix.scheduler.service.EndpointTester;
import com.cronix.scheduler.service.JobService;
import com.cronix.scheduler.service.JobServiceImpl;
import com.cronix.scheduler.service.JobValidator;
import com.cronix.scheduler.service.ScheduleDescriber;
import com.cronix.scheduler.store.RetentionPolicy;
import com.cronix.scheduler.store.Stores;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.prometheus.client.CollectorRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires stores, engine and HTTP API into one running service.
 */
@Slf4j
@Getter
public class SchedulerApp implements AutoCloseable {
    static final String RESTART_ERROR = "interrupted by restart";

    private final SchedulerConfig config;
    private final Stores stores;
    private final JobScheduler scheduler;
    private final ExecutionService executions;
    private final LogCleanupTask cleanup;
    private final JobService jobService;
    private final SessionTokens tokens;
    private final ApiServer server;
    private volatile boolean ready;

    private SchedulerApp(SchedulerConfig config, Stores stores, JobScheduler scheduler, ExecutionService executions,
                         LogCleanupTask cleanup, JobService jobService, SessionTokens tokens, ApiServer server) {
        this.config = config;
        this.stores = stores;
        this.scheduler = scheduler;
        this.executions = executions;
        this.cleanup = cleanup;
        this.jobService = jobService;
        this.tokens = tokens;
        this.server = server;
    }

    /**
     * Builds and starts the whole service. Exposed for tests, which pass
     * in-memory stores, a fake invoker and a manual clock.
     */
    public static SchedulerApp start(SchedulerConfig cfg, Stores stores, HttpInvoker invoker, Sleeper sleeper,
                                     Clock clock, CollectorRegistry registry) throws IOException {
        ObjectMapper mapper = ApiJson.newMapper();
        SchedulerMetrics metrics = new PromSchedulerMetrics(registry, registry == CollectorRegistry.defaultRegistry);

        int interrupted = stores.getLogs().failUnfinished(RESTART_ERROR, clock.instant());
        if (interrupted > 0) {
            log.warn("Marked {} unfinished run(s) as failed after restart", interrupted);
        }
        if (cfg.isAuthDisabled()) {
            stores.getUsers().upsert(User.builder()
                    .id(Authenticator.LOCAL_USER.getUserId())
                    .email(Authenticator.LOCAL_USER.getEmail())
                    .name("Local Developer")
                    .provider("local")
                    .createdAt(clock.instant())
                    .build());
        }

        ExecutorSettings settings = ExecutorSettings.builder()
                .defaultTimeout(cfg.getDefaultTimeout())
                .defaultRetries(cfg.getDefaultRetries())
                .responseBodyLimit(cfg.getResponseBodyLimit())
                .maxLogsPerJob(cfg.getLogMaxPerJob())
                .build();
        BackoffPolicy backoff = new BackoffPolicy(cfg.getBackoffBaseMs(), cfg.getBackoffMaxMs(), cfg.isBackoffJitter());
        JobExecutor executor = new JobExecutor(invoker, stores.getLogs(), backoff, sleeper, clock, settings, metrics);
        ExecutionService executions = new ExecutionService(stores.getJobs(), executor, new ExecutionLocks(), metrics,
                cfg.getMaxConcurrent(), cfg.getQueueCapacity(), cfg.getRunNowWait());

        JobScheduler scheduler = new JobScheduler(stores.getJobs(), executions, clock, cfg.getZone());
        scheduler.start();

        RetentionPolicy retention = new RetentionPolicy(cfg.getLogRetention(), cfg.getLogMaxPerJob());
        LogCleanupTask cleanup = new LogCleanupTask(stores.getLogs(), retention, clock);
        cleanup.start(cfg.getLogCleanupInterval());

        JobValidator validator = new JobValidator(cfg.getZone());
        JobService jobService = new JobServiceImpl(stores.getJobs(), stores.getLogs(), scheduler, executions,
                validator, new ScheduleDescriber(), new EndpointTester(invoker, validator, mapper), retention, clock);

        SessionTokens tokens = new SessionTokens(secret(cfg), mapper, clock);
        Authenticator authenticator = new Authenticator(tokens, cfg.getAuthCookie(), cfg.isAuthDisabled());

        SchedulerApp[] self = new SchedulerApp[1];
        ApiServer server = ApiServer.builder()
                .port(cfg.getHttpPort())
                .jobService(jobService)
                .users(stores.getUsers())
                .authenticator(authenticator)
                .cors(new Cors(cfg.getCorsOrigins()))
                .exchanges(new Exchanges(mapper, metrics))
                .registry(registry)
                .healthy(() -> stores.getJobs().ping() && scheduler.isRunning())
                .ready(() -> self[0] != null && self[0].ready)
                .build();

        SchedulerApp app = new SchedulerApp(cfg, stores, scheduler, executions, cleanup, jobService, tokens, server);
        self[0] = app;
        server.start();
        app.ready = true;
        return app;
    }

    private static String secret(SchedulerConfig cfg) {
        String secret = cfg.getAuthSecret();
        if (secret != null && !secret.isEmpty()) {
            return secret;
        }
        // only reachable with auth disabled; tokens are never checked then
        byte[] random = new byte[32];
        new SecureRandom().nextBytes(random);
        return Base64.getEncoder().encodeToString(random);
    }

    public int getPort() {
        return server.getPort();
    }

    @Override
    public void close() {
        ready = false;
        server.close();
        scheduler.close();
        executions.shutdown(config.getShutdownGrace());
        cleanup.close();
        stores.close();
        log.info("Scheduler stopped");
    }
}
