package com.cronix.scheduler.server;

import java.io.IOException;

import com.cronix.scheduler.api.ErrorResponse;
import com.cronix.scheduler.auth.Authenticator;
import com.cronix.scheduler.auth.Session;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import lombok.extern.slf4j.Slf4j;

/**
 * Base of the authenticated {@code /api} handlers: CORS, preflight, session lookup
 * and error mapping.
 */
@Slf4j
abstract class ApiHandler implements HttpHandler {
    protected final Exchanges exchanges;
    private final Authenticator authenticator;
    private final Cors cors;

    ApiHandler(Exchanges exchanges, Authenticator authenticator, Cors cors) {
        this.exchanges = exchanges;
        this.authenticator = authenticator;
        this.cors = cors;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            cors.apply(exchange);
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchanges.respondEmpty(exchange, 204);
                return;
            }
            Session session = authenticator.authenticate(exchange);
            handle(exchange, session);
        } catch (Exception e) {
            ApiExceptionMapper.Mapped mapped = ApiExceptionMapper.map(e);
            try {
                exchanges.respondJson(exchange, mapped.getStatus(), mapped.getBody());
            } catch (IOException | IllegalStateException writeFailure) {
                // headers already sent
                log.debug("Could not write error response: {}", writeFailure.getMessage());
            }
        } finally {
            exchange.close();
        }
    }

    protected abstract void handle(HttpExchange exchange, Session session) throws IOException;

    protected void methodNotAllowed(HttpExchange exchange) throws IOException {
        exchanges.respondJson(exchange, 405, new ErrorResponse("method not allowed", exchange.getRequestMethod()));
    }

    protected void notFound(HttpExchange exchange) throws IOException {
        exchanges.respondJson(exchange, 404, new ErrorResponse("not found"));
    }
}
