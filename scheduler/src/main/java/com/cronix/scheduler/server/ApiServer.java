package com.cronix.scheduler.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

import com.cronix.scheduler.auth.Authenticator;
import com.cronix.scheduler.service.JobService;
import com.cronix.scheduler.store.UserStore;
import com.sun.net.httpserver.HttpServer;

import io.prometheus.client.CollectorRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * The JSON API on the JDK HTTP server.
 */
@Slf4j
public class ApiServer implements AutoCloseable {
    private final HttpServer server;
    private final ExecutorService executor;

    @Builder
    private ApiServer(int port, JobService jobService, UserStore users, Authenticator authenticator, Cors cors,
                      Exchanges exchanges, CollectorRegistry registry, BooleanSupplier healthy,
                      BooleanSupplier ready) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", exchange -> {
            boolean ok;
            try {
                ok = healthy.getAsBoolean();
            } catch (RuntimeException e) {
                log.warn("Health check failed: {}", e.getMessage());
                ok = false;
            }
            exchanges.respond(exchange, ok ? 200 : 503, ok ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> {
            boolean ok = ready.getAsBoolean();
            exchanges.respond(exchange, ok ? 200 : 503, ok ? "READY" : "NOT_READY");
        });
        server.createContext("/metrics", new MetricsHandlerProm(registry, exchanges));
        server.createContext(JobsHandler.PREFIX, new JobsHandler(exchanges, authenticator, cors, jobService));
        server.createContext("/api/profile", new ProfileHandler(exchanges, authenticator, cors, users));
        server.createContext("/auth/logout", new LogoutHandler(exchanges, authenticator, cors));
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
    }

    public ApiServer start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
        return this;
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }
}
