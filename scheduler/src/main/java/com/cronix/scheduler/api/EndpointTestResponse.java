package com.cronix.scheduler.api;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the tested endpoint answered. {@code body} is the parsed JSON value when the
 * response is JSON, otherwise the raw text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EndpointTestResponse {
    private int status;
    private String statusText;
    private Map<String, String> headers;
    private Object body;
}
