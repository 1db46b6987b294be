package com.cronix.scheduler.api;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreateRequest {
    private String name;
    private String schedule;
    private String endpoint;
    private String method;
    private Map<String, String> headers;
    private String body;
    /** defaults to true */
    private Boolean active;
    private Integer timeoutSeconds;
    private Integer maxRetries;
}
