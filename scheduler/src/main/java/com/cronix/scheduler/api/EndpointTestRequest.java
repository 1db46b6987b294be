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
public class EndpointTestRequest {
    private String endpoint;
    private String method;
    private Map<String, String> headers;
    private String body;
}
