package com.cronix.scheduler.api;

import java.time.Instant;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {
    private String id;
    private String userId;
    private String name;
    private String schedule;
    private String scheduleDescription;
    private String endpoint;
    private String method;
    private Map<String, String> headers;
    private String body;
    private boolean active;
    private Integer timeoutSeconds;
    private Integer maxRetries;
    private Instant nextRunAt;
    private boolean running;
    private Instant createdAt;
    private Instant updatedAt;
}
