package com.cronix.scheduler.domain;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * A scheduled HTTP call owned by a user. The store holds the authoritative copy.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    String id;
    String ownerId;
    String name;
    String schedule;
    String endpoint;
    String method;
    Map<String, String> headers;
    String body;
    boolean active;
    /** null means the configured default */
    Integer timeoutSeconds;
    /** null means the configured default */
    Integer maxRetries;
    /** last next-fire time written by the scheduler, used to detect a missed fire after restart */
    Instant nextFireAt;
    Instant createdAt;
    Instant updatedAt;

    public Map<String, String> getHeaders() {
        return headers == null ? Map.of() : headers;
    }
}
