package com.cronix.scheduler.api;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: null fields keep their current value, an empty {@code body}
 * clears the body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobUpdateRequest {
    private String name;
    private String schedule;
    private String endpoint;
    private String method;
    private Map<String, String> headers;
    private String body;
    private Boolean active;
    private Integer timeoutSeconds;
    private Integer maxRetries;
}
