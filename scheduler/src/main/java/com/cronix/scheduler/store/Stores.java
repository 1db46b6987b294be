package com.cronix.scheduler.store;

import com.cronix.scheduler.SchedulerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The three stores of one backend and the resource that backs them.
 */
@Slf4j
@Getter
public class Stores implements AutoCloseable {
    private final JobStore jobs;
    private final LogRecorder logs;
    private final UserStore users;
    private final AutoCloseable resource;

    public Stores(JobStore jobs, LogRecorder logs, UserStore users, AutoCloseable resource) {
        this.jobs = jobs;
        this.logs = logs;
        this.users = users;
        this.resource = resource;
    }

    public static Stores inMemory() {
        InMemoryJobStore jobs = new InMemoryJobStore();
        return new Stores(jobs, new InMemoryLogRecorder(jobs), new InMemoryUserStore(), null);
    }

    public static Stores postgres(HikariDataSource ds, ObjectMapper mapper) {
        JdbcSchema.apply(ds);
        return new Stores(new JdbcJobStore(ds, mapper), new JdbcLogRecorder(ds), new JdbcUserStore(ds), ds);
    }

    public static Stores fromConfig(SchedulerConfig cfg, ObjectMapper mapper) {
        if (cfg.getStore() == SchedulerConfig.StoreKind.MEMORY) {
            log.warn("Using in-memory stores, nothing survives a restart");
            return inMemory();
        }
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.jdbcUrl());
        hc.setUsername(cfg.getPgUser());
        hc.setPassword(cfg.getPgPassword());
        hc.setMaximumPoolSize(cfg.getPgPoolSize());
        hc.setPoolName("cronix-pg");
        log.info("Connecting to {}", cfg.jdbcUrl());
        return postgres(new HikariDataSource(hc), mapper);
    }

    @Override
    public void close() {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Closing store resource failed: {}", e.getMessage());
        }
    }
}
