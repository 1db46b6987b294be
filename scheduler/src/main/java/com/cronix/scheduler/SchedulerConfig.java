package com.cronix.scheduler;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;

/**
 * Service settings, read from environment variables with defaults.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {
    public enum StoreKind {
        POSTGRES, MEMORY
    }

    int httpPort;
    StoreKind store;
    String pgHost;
    int pgPort;
    String pgDb;
    String pgUser;
    String pgPassword;
    int pgPoolSize;
    ZoneId zone;
    int maxConcurrent;
    int queueCapacity;
    Duration defaultTimeout;
    int defaultRetries;
    long backoffBaseMs;
    long backoffMaxMs;
    boolean backoffJitter;
    int responseBodyLimit;
    Duration runNowWait;
    Duration logRetention;
    int logMaxPerJob;
    Duration logCleanupInterval;
    Duration shutdownGrace;
    String authSecret;
    String authCookie;
    boolean authDisabled;
    Set<String> corsOrigins;

    public static SchedulerConfig fromEnv(Map<String, String> env) {
        Reader r = new Reader(env);
        SchedulerConfig cfg = SchedulerConfig.builder()
                .httpPort(r.integer("HTTP_PORT", 8080, 0, 65535))
                .store(r.storeKind("STORE", StoreKind.POSTGRES))
                .pgHost(r.string("PG_HOST", "localhost"))
                .pgPort(r.integer("PG_PORT", 5432, 1, 65535))
                .pgDb(r.string("PG_DB", "cronix"))
                .pgUser(r.string("PG_USER", "app"))
                .pgPassword(r.string("PG_PASSWORD", "app"))
                .pgPoolSize(r.integer("PG_POOL_SIZE", 10, 1, 500))
                .zone(r.zone("SCHEDULER_ZONE", "UTC"))
                .maxConcurrent(r.integer("EXECUTOR_MAX_CONCURRENT", 32, 1, 4096))
                .queueCapacity(r.integer("EXECUTOR_QUEUE_CAPACITY", 256, 1, 1_000_000))
                .defaultTimeout(Duration.ofSeconds(r.integer("EXECUTOR_DEFAULT_TIMEOUT_SECONDS", 30, 1, 300)))
                .defaultRetries(r.integer("EXECUTOR_DEFAULT_RETRIES", 0, 0, 10))
                .backoffBaseMs(r.integer("EXECUTOR_BACKOFF_BASE_MS", 1000, 0, 3_600_000))
                .backoffMaxMs(r.integer("EXECUTOR_BACKOFF_MAX_MS", 30000, 0, 3_600_000))
                .backoffJitter(r.bool("EXECUTOR_BACKOFF_JITTER", true))
                .responseBodyLimit(r.integer("EXECUTOR_RESPONSE_BODY_LIMIT", 1 << 20, 0, 64 << 20))
                .runNowWait(Duration.ofMillis(r.integer("RUN_NOW_WAIT_MS", 2000, 0, 600_000)))
                .logRetention(Duration.ofDays(r.integer("LOG_RETENTION_DAYS", 30, 0, 36500)))
                .logMaxPerJob(r.integer("LOG_MAX_PER_JOB", 5, 0, 1_000_000))
                .logCleanupInterval(Duration.ofMinutes(r.integer("LOG_CLEANUP_INTERVAL_MINUTES", 60, 1, 525_600)))
                .shutdownGrace(Duration.ofSeconds(r.integer("SHUTDOWN_GRACE_SECONDS", 30, 0, 3600)))
                .authSecret(r.string("AUTH_SECRET", ""))
                .authCookie(r.string("AUTH_COOKIE", "auth_token"))
                .authDisabled(r.bool("AUTH_DISABLED", false))
                .corsOrigins(r.list("CORS_ALLOWED_ORIGINS", "http://localhost:5173,http://localhost:3000"))
                .build();
        cfg.validate();
        return cfg;
    }

    void validate() {
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException("EXECUTOR_BACKOFF_MAX_MS must be >= EXECUTOR_BACKOFF_BASE_MS");
        }
        if (!authDisabled && (authSecret == null || authSecret.isEmpty())) {
            throw new IllegalArgumentException("AUTH_SECRET is required unless AUTH_DISABLED=true");
        }
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + pgHost + ":" + pgPort + "/" + pgDb;
    }

    private static final class Reader {
        private final Map<String, String> env;

        Reader(Map<String, String> env) {
            this.env = env;
        }

        String string(String key, String def) {
            String v = env.get(key);
            return v == null ? def : v;
        }

        int integer(String key, int def, int min, int max) {
            String v = env.get(key);
            if (v == null || v.isBlank()) {
                return def;
            }
            int parsed;
            try {
                parsed = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'");
            }
            if (parsed < min || parsed > max) {
                throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ", got " + parsed);
            }
            return parsed;
        }

        boolean bool(String key, boolean def) {
            String v = env.get(key);
            if (v == null || v.isBlank()) {
                return def;
            }
            switch (v.trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                case "yes":
                    return true;
                case "false":
                case "0":
                case "no":
                    return false;
                default:
                    throw new IllegalArgumentException(key + " must be true or false, got '" + v + "'");
            }
        }

        ZoneId zone(String key, String def) {
            String v = string(key, def);
            try {
                return ZoneId.of(v.trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException(key + " is not a time zone: '" + v + "'");
            }
        }

        StoreKind storeKind(String key, StoreKind def) {
            String v = env.get(key);
            if (v == null || v.isBlank()) {
                return def;
            }
            try {
                return StoreKind.valueOf(v.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + " must be postgres or memory, got '" + v + "'");
            }
        }

        Set<String> list(String key, String def) {
            return Arrays.stream(string(key, def).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
    }
}
