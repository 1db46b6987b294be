package com.cronix.scheduler;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class SchedulerConfigTest {
    @Test
    public void defaults() {
        SchedulerConfig cfg = SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x"));

        assertThat(cfg.getHttpPort(), is(8080));
        assertThat(cfg.getStore(), is(SchedulerConfig.StoreKind.POSTGRES));
        assertThat(cfg.jdbcUrl(), is("jdbc:postgresql://localhost:5432/cronix"));
        assertThat(cfg.getZone(), is(ZoneId.of("UTC")));
        assertThat(cfg.getDefaultTimeout(), is(Duration.ofSeconds(30)));
        assertThat(cfg.getDefaultRetries(), is(0));
        assertThat(cfg.getBackoffBaseMs(), is(1000L));
        assertThat(cfg.getBackoffMaxMs(), is(30000L));
        assertTrue(cfg.isBackoffJitter());
        assertThat(cfg.getResponseBodyLimit(), is(1 << 20));
        assertThat(cfg.getLogMaxPerJob(), is(5));
        assertThat(cfg.getLogRetention(), is(Duration.ofDays(30)));
        assertThat(cfg.getAuthCookie(), is("auth_token"));
        assertFalse(cfg.isAuthDisabled());
        assertThat(cfg.getCorsOrigins(), is(Set.of("http://localhost:5173", "http://localhost:3000")));
    }

    @Test
    public void overrides() {
        SchedulerConfig cfg = SchedulerConfig.fromEnv(Map.of(
                "HTTP_PORT", "9090",
                "STORE", "Memory",
                "SCHEDULER_ZONE", "Europe/Berlin",
                "EXECUTOR_MAX_CONCURRENT", "4",
                "EXECUTOR_BACKOFF_JITTER", "false",
                "AUTH_DISABLED", "yes",
                "CORS_ALLOWED_ORIGINS", " https://app.example.test , "));

        assertThat(cfg.getHttpPort(), is(9090));
        assertThat(cfg.getStore(), is(SchedulerConfig.StoreKind.MEMORY));
        assertThat(cfg.getZone(), is(ZoneId.of("Europe/Berlin")));
        assertThat(cfg.getMaxConcurrent(), is(4));
        assertFalse(cfg.isBackoffJitter());
        assertTrue(cfg.isAuthDisabled());
        assertThat(cfg.getCorsOrigins(), is(Set.of("https://app.example.test")));
    }

    @Test
    public void badValuesFailWithTheVariableName() {
        IllegalArgumentException port = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x", "HTTP_PORT", "eighty")));
        assertThat(port.getMessage(), containsString("HTTP_PORT"));

        IllegalArgumentException zone = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x", "SCHEDULER_ZONE", "Mars/Base")));
        assertThat(zone.getMessage(), containsString("SCHEDULER_ZONE"));

        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x", "EXECUTOR_DEFAULT_RETRIES", "11")));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x", "STORE", "redis")));
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.fromEnv(Map.of("AUTH_SECRET", "x",
                "EXECUTOR_BACKOFF_BASE_MS", "5000", "EXECUTOR_BACKOFF_MAX_MS", "100")));
    }

    @Test
    public void secretIsRequiredUnlessAuthIsOff() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of()));
        assertThat(e.getMessage(), containsString("AUTH_SECRET"));
        assertTrue(SchedulerConfig.fromEnv(Map.of("AUTH_DISABLED", "true")).isAuthDisabled());
    }
}
