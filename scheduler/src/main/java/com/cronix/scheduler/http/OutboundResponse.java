package com.cronix.scheduler.http;

import java.util.Map;

import lombok.Value;

/**
 * Status, first value of each header and the (possibly truncated) body of a response.
 */
@Value
public class OutboundResponse {
    int status;
    Map<String, String> headers;
    String body;
    boolean truncated;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isServerError() {
        return status >= 500 && status < 600;
    }
}
