package com.cronix.scheduler.service;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import com.cronix.scheduler.api.EndpointTestRequest;
import com.cronix.scheduler.api.EndpointTestResponse;
import com.cronix.scheduler.exception.EndpointUnreachableException;
import com.cronix.scheduler.http.HttpInvoker;
import com.cronix.scheduler.http.HttpStatusText;
import com.cronix.scheduler.http.OutboundRequest;
import com.cronix.scheduler.http.OutboundResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls an endpoint once on behalf of the browser so users can try a job before
 * saving it.
 */
@Slf4j
@RequiredArgsConstructor
public class EndpointTester {
    static final Duration TIMEOUT = Duration.ofSeconds(30);
    static final int BODY_LIMIT = 1 << 20;

    private final HttpInvoker invoker;
    private final JobValidator validator;
    private final ObjectMapper mapper;

    public EndpointTestResponse test(EndpointTestRequest request) {
        OutboundRequest outbound = OutboundRequest.builder()
                .url(validator.endpoint(request.getEndpoint()))
                .method(validator.method(request.getMethod()))
                .headers(validator.headers(request.getHeaders()))
                .body(validator.body(request.getBody()))
                .timeout(TIMEOUT)
                .bodyLimit(BODY_LIMIT)
                .build();
        OutboundResponse response;
        try {
            response = invoker.invoke(outbound);
        } catch (HttpTimeoutException e) {
            throw new EndpointUnreachableException("request timed out after " + TIMEOUT.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new EndpointUnreachableException(e.getMessage() == null ? e.getClass().getSimpleName()
                    : e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EndpointUnreachableException("interrupted", e);
        }
        log.debug("Endpoint test {} {} -> {}", outbound.getMethod(), outbound.getUrl(), response.getStatus());
        return EndpointTestResponse.builder()
                .status(response.getStatus())
                .statusText(HttpStatusText.of(response.getStatus()))
                .headers(response.getHeaders())
                .body(parseBody(response.getBody()))
                .build();
    }

    private Object parseBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
