package com.cronix.scheduler.auth;

import java.util.List;

import com.cronix.scheduler.exception.UnauthorizedException;
import com.sun.net.httpserver.HttpExchange;

import lombok.extern.slf4j.Slf4j;

/**
 * Finds the session of a request: the session cookie first, then an
 * {@code Authorization: Bearer} header.
 */
@Slf4j
public class Authenticator {
    public static final Session LOCAL_USER = new Session("00000000-0000-0000-0000-000000000001", "dev@localhost");

    private final SessionTokens tokens;
    private final String cookieName;
    private final boolean disabled;

    public Authenticator(SessionTokens tokens, String cookieName, boolean disabled) {
        this.tokens = tokens;
        this.cookieName = cookieName;
        this.disabled = disabled;
        if (disabled) {
            log.warn("Authentication is disabled, every request runs as {}", LOCAL_USER.getEmail());
        }
    }

    public String getCookieName() {
        return cookieName;
    }

    /**
     * @throws UnauthorizedException if the request carries no valid session
     */
    public Session authenticate(HttpExchange exchange) {
        if (disabled) {
            return LOCAL_USER;
        }
        String token = cookie(exchange);
        if (token == null) {
            String header = exchange.getRequestHeaders().getFirst("Authorization");
            if (header == null || header.isBlank()) {
                throw new UnauthorizedException("No authentication token found");
            }
            String[] parts = header.trim().split(" ");
            if (parts.length != 2 || !"Bearer".equals(parts[0])) {
                throw new UnauthorizedException("Invalid authorization header");
            }
            token = parts[1];
        }
        return tokens.verify(token);
    }

    private String cookie(HttpExchange exchange) {
        List<String> headers = exchange.getRequestHeaders().get("Cookie");
        if (headers == null) {
            return null;
        }
        for (String header : headers) {
            for (String pair : header.split(";")) {
                int eq = pair.indexOf('=');
                if (eq > 0 && pair.substring(0, eq).trim().equals(cookieName)) {
                    String value = pair.substring(eq + 1).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    /**
     * A Set-Cookie value that removes the session cookie.
     */
    public String expiredCookie() {
        return cookieName + "=; Path=/; Max-Age=0; HttpOnly; SameSite=Lax";
    }
}
