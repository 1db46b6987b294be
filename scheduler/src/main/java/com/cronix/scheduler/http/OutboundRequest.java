package com.cronix.scheduler.http;

import java.time.Duration;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * One HTTP call made on behalf of a job or an endpoint test.
 */
@Value
@Builder
public class OutboundRequest {
    String url;
    String method;
    Map<String, String> headers;
    String body;
    Duration timeout;
    /** maximum number of response body bytes to keep */
    int bodyLimit;
}
