package com.cronix.scheduler.server;

import java.io.IOException;

import com.cronix.scheduler.api.ErrorResponse;
import com.cronix.scheduler.api.MessageResponse;
import com.cronix.scheduler.auth.Authenticator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * Clears the session cookie. Works without a valid session.
 */
class LogoutHandler implements HttpHandler {
    private final Exchanges exchanges;
    private final Authenticator authenticator;
    private final Cors cors;

    LogoutHandler(Exchanges exchanges, Authenticator authenticator, Cors cors) {
        this.exchanges = exchanges;
        this.authenticator = authenticator;
        this.cors = cors;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            cors.apply(exchange);
            String method = exchange.getRequestMethod();
            if ("OPTIONS".equalsIgnoreCase(method)) {
                exchanges.respondEmpty(exchange, 204);
                return;
            }
            if (!"POST".equalsIgnoreCase(method)) {
                exchanges.respondJson(exchange, 405, new ErrorResponse("method not allowed", method));
                return;
            }
            exchange.getResponseHeaders().add("Set-Cookie", authenticator.expiredCookie());
            exchanges.respondJson(exchange, 200, new MessageResponse("Logged out successfully"));
        } finally {
            exchange.close();
        }
    }
}
