package com.cronix.scheduler.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import com.cronix.scheduler.exception.ValidationException;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;

/**
 * Request and response helpers shared by the handlers. Every response is counted
 * in the request metrics under its normalized path.
 */
public class Exchanges {
    private final ObjectMapper mapper;
    private final SchedulerMetrics metrics;

    public Exchanges(ObjectMapper mapper, SchedulerMetrics metrics) {
        this.mapper = mapper;
        this.metrics = metrics;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public void respond(HttpExchange exchange, int code, String body) throws IOException {
        respond(exchange, code, "text/plain; charset=utf-8", body);
    }

    public void respond(HttpExchange exchange, int code, String contentType, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        send(exchange, code, body.getBytes(StandardCharsets.UTF_8));
    }

    public void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
        byte[] data = mapper.writeValueAsBytes(value);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        send(exchange, code, data);
    }

    public void respondEmpty(HttpExchange exchange, int code) throws IOException {
        count(exchange, code);
        exchange.sendResponseHeaders(code, -1);
        exchange.close();
    }

    /**
     * Reads the JSON request body.
     *
     * @throws ValidationException if the body is missing or not valid JSON for {@code type}
     */
    public <T> T readJson(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] data;
        try (InputStream is = exchange.getRequestBody()) {
            data = is.readAllBytes();
        }
        if (data.length == 0) {
            throw new ValidationException("request body is required");
        }
        try {
            T value = mapper.readValue(data, type);
            if (value == null) {
                throw new ValidationException("request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException("invalid JSON body: " + e.getOriginalMessage());
        }
    }

    public static Map<String, String> query(HttpExchange exchange) {
        Map<String, String> out = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    /**
     * An integer query parameter, or {@code def} when absent or not a number.
     */
    public static int queryInt(HttpExchange exchange, String name, int def) {
        String v = query(exchange).get(name);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        if (rawPath.startsWith("/api/jobs/")) {
            String rest = rawPath.substring("/api/jobs/".length());
            if (rest.equals("test") || rest.equals("cleanup-logs")) {
                return rawPath;
            }
            if (rest.endsWith("/run")) {
                return "/api/jobs/:id/run";
            }
            if (rest.endsWith("/logs")) {
                return "/api/jobs/:id/logs";
            }
            return "/api/jobs/:id";
        }
        return rawPath;
    }

    private void send(HttpExchange exchange, int code, byte[] data) throws IOException {
        count(exchange, code);
        exchange.sendResponseHeaders(code, data.length == 0 ? -1 : data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    private void count(HttpExchange exchange, int code) {
        metrics.incHttpRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), code);
    }
}
