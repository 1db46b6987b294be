package com.cronix.scheduler.server;

import java.io.IOException;
import java.io.StringWriter;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

/**
 * Prometheus scrape endpoint. Scrapes are counted with the other requests.
 */
class MetricsHandlerProm implements HttpHandler {
    private final CollectorRegistry registry;
    private final Exchanges exchanges;

    MetricsHandlerProm(CollectorRegistry registry, Exchanges exchanges) {
        this.registry = registry;
        this.exchanges = exchanges;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchanges.respond(exchange, 405, "method not allowed");
            return;
        }
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        exchanges.respond(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
    }
}
