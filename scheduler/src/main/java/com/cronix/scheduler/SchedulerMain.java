package com.cronix.scheduler;

import java.time.Clock;

import com.cronix.scheduler.engine.Sleeper;
import com.cronix.scheduler.http.JdkHttpInvoker;
import com.cronix.scheduler.server.ApiJson;
import com.cronix.scheduler.store.Stores;

import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SchedulerMain {
    public static void main(String[] args) throws Exception {
        SchedulerConfig cfg;
        try {
            cfg = SchedulerConfig.fromEnv(System.getenv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        Stores stores = Stores.fromConfig(cfg, ApiJson.newMapper());
        SchedulerApp app;
        try {
            app = SchedulerApp.start(cfg, stores, new JdkHttpInvoker(), Sleeper.system(), Clock.systemUTC(),
                    CollectorRegistry.defaultRegistry);
        } catch (Exception e) {
            stores.close();
            throw e;
        }
        log.info("HTTP server on {}", app.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down, waiting up to {} for running jobs", cfg.getShutdownGrace());
            app.close();
        }, "cronix-shutdown"));
    }
}
