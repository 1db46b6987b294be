package com.cronix.scheduler.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.cronix.cron.CronExpression;
import com.cronix.cron.InvalidScheduleException;
import com.cronix.cron.NoUpcomingFireTimeException;
import com.cronix.scheduler.exception.ValidationException;

/**
 * Checks and normalizes user supplied job fields.
 */
public class JobValidator {
    static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");
    // the JDK client refuses to send these
    static final Set<String> RESTRICTED_HEADERS = Set.of("host", "connection", "content-length", "expect", "upgrade");
    private static final Pattern HEADER_NAME = Pattern.compile("[!#$%&'*+.^_`|~0-9A-Za-z-]+");
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_ENDPOINT_LENGTH = 2048;
    static final int MAX_BODY_BYTES = 1 << 20;
    static final int MIN_TIMEOUT_SECONDS = 1;
    static final int MAX_TIMEOUT_SECONDS = 300;
    static final int MAX_RETRIES = 10;

    private final ZoneId zone;

    public JobValidator(ZoneId zone) {
        this.zone = zone;
    }

    public String name(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    /**
     * Parses the schedule and makes sure it fires at least once after {@code now}.
     *
     * @return the next fire time
     */
    public Instant schedule(String schedule, Instant now) {
        if (schedule == null || schedule.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(schedule), "schedule is required");
        }
        CronExpression cron = CronExpression.parse(schedule);
        try {
            return cron.next(now, zone);
        } catch (NoUpcomingFireTimeException e) {
            throw new InvalidScheduleException(cron.getExpression(), "schedule never fires");
        }
    }

    public String endpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ValidationException("endpoint is required");
        }
        String trimmed = endpoint.trim();
        if (trimmed.length() > MAX_ENDPOINT_LENGTH) {
            throw new ValidationException("endpoint must be at most " + MAX_ENDPOINT_LENGTH + " characters");
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new ValidationException("endpoint is not a valid URL: " + e.getMessage());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ValidationException("endpoint must use http or https");
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new ValidationException("endpoint must include a host");
        }
        return trimmed;
    }

    public String method(String method) {
        if (method == null || method.isBlank()) {
            throw new ValidationException("method is required");
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(upper)) {
            throw new ValidationException("invalid HTTP method '" + method
                    + "'. Supported methods: GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS");
        }
        return upper;
    }

    public Map<String, String> headers(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> h : headers.entrySet()) {
            String key = h.getKey() == null ? "" : h.getKey().trim();
            if (!HEADER_NAME.matcher(key).matches()) {
                throw new ValidationException("invalid header name '" + h.getKey() + "'");
            }
            if (RESTRICTED_HEADERS.contains(key.toLowerCase(Locale.ROOT))) {
                throw new ValidationException("header '" + key + "' cannot be set");
            }
            String value = h.getValue() == null ? "" : h.getValue();
            if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                throw new ValidationException("header '" + key + "' contains a line break");
            }
            out.put(key, value);
        }
        return Map.copyOf(out);
    }

    /**
     * Returns the body, or null when it is null or empty.
     */
    public String body(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        if (body.getBytes(StandardCharsets.UTF_8).length > MAX_BODY_BYTES) {
            throw new ValidationException("body must be at most " + MAX_BODY_BYTES + " bytes");
        }
        return body;
    }

    public Integer timeoutSeconds(Integer timeoutSeconds) {
        if (timeoutSeconds != null
                && (timeoutSeconds < MIN_TIMEOUT_SECONDS || timeoutSeconds > MAX_TIMEOUT_SECONDS)) {
            throw new ValidationException("timeout_seconds must be between " + MIN_TIMEOUT_SECONDS + " and "
                    + MAX_TIMEOUT_SECONDS);
        }
        return timeoutSeconds;
    }

    public Integer maxRetries(Integer maxRetries) {
        if (maxRetries != null && (maxRetries < 0 || maxRetries > MAX_RETRIES)) {
            throw new ValidationException("max_retries must be between 0 and " + MAX_RETRIES);
        }
        return maxRetries;
    }
}
