package com.cronix.scheduler.server;

import java.io.IOException;
import java.util.Locale;

import com.cronix.scheduler.api.EndpointTestRequest;
import com.cronix.scheduler.api.JobCreateRequest;
import com.cronix.scheduler.api.JobUpdateRequest;
import com.cronix.scheduler.auth.Authenticator;
import com.cronix.scheduler.auth.Session;
import com.cronix.scheduler.service.JobService;
import com.sun.net.httpserver.HttpExchange;

/**
 * Everything under {@code /api/jobs}.
 */
class JobsHandler extends ApiHandler {
    static final String PREFIX = "/api/jobs";
    static final int DEFAULT_JOBS_LIMIT = 20;
    static final int DEFAULT_LOGS_LIMIT = 50;

    private final JobService jobService;

    JobsHandler(Exchanges exchanges, Authenticator authenticator, Cors cors, JobService jobService) {
        super(exchanges, authenticator, cors);
        this.jobService = jobService;
    }

    @Override
    protected void handle(HttpExchange exchange, Session session) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > PREFIX.length() ? path.substring(PREFIX.length()) : "";
        if (!rest.isEmpty() && !rest.startsWith("/")) {
            notFound(exchange);
            return;
        }
        if (rest.endsWith("/") && rest.length() > 1) {
            rest = rest.substring(0, rest.length() - 1);
        }
        String owner = session.getUserId();

        if (rest.isEmpty() || rest.equals("/")) {
            switch (method) {
                case "POST":
                    JobCreateRequest create = exchanges.readJson(exchange, JobCreateRequest.class);
                    exchanges.respondJson(exchange, 201, jobService.createJob(owner, create));
                    return;
                case "GET":
                    int limit = Exchanges.queryInt(exchange, "limit", DEFAULT_JOBS_LIMIT);
                    int offset = Exchanges.queryInt(exchange, "offset", 0);
                    exchanges.respondJson(exchange, 200, jobService.getJobs(owner, limit, offset));
                    return;
                default:
                    methodNotAllowed(exchange);
                    return;
            }
        }

        String[] segments = rest.substring(1).split("/");
        if (segments.length == 1 && segments[0].equals("test")) {
            if (!method.equals("POST")) {
                methodNotAllowed(exchange);
                return;
            }
            EndpointTestRequest test = exchanges.readJson(exchange, EndpointTestRequest.class);
            exchanges.respondJson(exchange, 200, jobService.testEndpoint(test));
            return;
        }
        if (segments.length == 1 && segments[0].equals("cleanup-logs")) {
            if (!method.equals("POST")) {
                methodNotAllowed(exchange);
                return;
            }
            exchanges.respondJson(exchange, 200, jobService.cleanupLogs());
            return;
        }

        String id = segments[0];
        if (segments.length == 1) {
            switch (method) {
                case "GET":
                    exchanges.respondJson(exchange, 200, jobService.getJob(owner, id));
                    return;
                case "PUT":
                    JobUpdateRequest update = exchanges.readJson(exchange, JobUpdateRequest.class);
                    exchanges.respondJson(exchange, 200, jobService.updateJob(owner, id, update));
                    return;
                case "DELETE":
                    jobService.deleteJob(owner, id);
                    exchanges.respondEmpty(exchange, 204);
                    return;
                default:
                    methodNotAllowed(exchange);
                    return;
            }
        }
        if (segments.length == 2 && segments[1].equals("run")) {
            if (!method.equals("POST")) {
                methodNotAllowed(exchange);
                return;
            }
            exchanges.respondJson(exchange, 200, jobService.runJob(owner, id));
            return;
        }
        if (segments.length == 2 && segments[1].equals("logs")) {
            if (!method.equals("GET")) {
                methodNotAllowed(exchange);
                return;
            }
            int limit = Exchanges.queryInt(exchange, "limit", DEFAULT_LOGS_LIMIT);
            int offset = Exchanges.queryInt(exchange, "offset", 0);
            exchanges.respondJson(exchange, 200, jobService.getLogs(owner, id, limit, offset));
            return;
        }
        notFound(exchange);
    }
}
