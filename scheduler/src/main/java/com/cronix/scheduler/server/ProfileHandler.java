package com.cronix.scheduler.server;

import java.io.IOException;
import java.util.Optional;

import com.cronix.scheduler.api.ErrorResponse;
import com.cronix.scheduler.api.JobMapper;
import com.cronix.scheduler.auth.Authenticator;
import com.cronix.scheduler.auth.Session;
import com.cronix.scheduler.domain.User;
import com.cronix.scheduler.store.UserStore;
import com.sun.net.httpserver.HttpExchange;

class ProfileHandler extends ApiHandler {
    private final UserStore users;

    ProfileHandler(Exchanges exchanges, Authenticator authenticator, Cors cors, UserStore users) {
        super(exchanges, authenticator, cors);
        this.users = users;
    }

    @Override
    protected void handle(HttpExchange exchange, Session session) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            methodNotAllowed(exchange);
            return;
        }
        Optional<User> user = users.findById(session.getUserId());
        if (user.isEmpty()) {
            exchanges.respondJson(exchange, 404, new ErrorResponse("User not found"));
            return;
        }
        exchanges.respondJson(exchange, 200, JobMapper.toProfileResponse(user.get()));
    }
}
