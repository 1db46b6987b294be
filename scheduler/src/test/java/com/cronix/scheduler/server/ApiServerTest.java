package com.cronix.scheduler.server;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import com.cronix.scheduler.SchedulerApp;
import com.cronix.scheduler.SchedulerConfig;
import com.cronix.scheduler.ScriptedInvoker;
import com.cronix.scheduler.domain.User;
import com.cronix.scheduler.store.Stores;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.prometheus.client.CollectorRegistry;

public class ApiServerTest {
    private static final String USER_ID = "33333333-3333-3333-3333-333333333333";
    private static final String OTHER_ID = "44444444-4444-4444-4444-444444444444";

    private static final ObjectMapper mapper = ApiJson.newMapper();
    private static final HttpClient client = HttpClient.newHttpClient();
    private static final ScriptedInvoker invoker = new ScriptedInvoker();
    private static SchedulerApp app;
    private static String base;
    private static String token;
    private static String otherToken;

    @BeforeClass
    public static void setup() throws Exception {
        SchedulerConfig cfg = SchedulerConfig.fromEnv(Map.of(
                "HTTP_PORT", "0",
                "STORE", "memory",
                "AUTH_SECRET", "api-test-secret",
                "CORS_ALLOWED_ORIGINS", "http://localhost:5173"));
        Stores stores = Stores.inMemory();
        stores.getUsers().upsert(User.builder()
                .id(USER_ID)
                .email("ada@example.test")
                .name("Ada")
                .avatarUrl("https://img.example.test/ada.png")
                .provider("google")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build());
        app = SchedulerApp.start(cfg, stores, invoker, d -> {
        }, Clock.systemUTC(), new CollectorRegistry());
        base = "http://localhost:" + app.getPort();
        token = app.getTokens().issue(USER_ID, "ada@example.test", Duration.ofHours(1));
        otherToken = app.getTokens().issue(OTHER_ID, "bob@example.test", Duration.ofHours(1));
    }

    @AfterClass
    public static void teardown() {
        if (app != null)
            app.close();
    }

    private static HttpResponse<String> call(String method, String path, String body, String sessionToken)
            throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(base + path))
                .header("Content-Type", "application/json")
                .method(method, body == null ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (sessionToken != null) {
            b.header("Cookie", "theme=dark; auth_token=" + sessionToken);
        }
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> call(String method, String path, String body)
            throws IOException, InterruptedException {
        return call(method, path, body, token);
    }

    private static JsonNode json(HttpResponse<String> r) throws IOException {
        return mapper.readTree(r.body());
    }

    private static String createJob(String name) throws Exception {
        String body = "{\"name\":\"" + name + "\",\"schedule\":\"*/5 * * * *\","
                + "\"endpoint\":\"https://example.test/hook\",\"method\":\"POST\","
                + "\"headers\":{\"X-Key\":\"1\"},\"body\":\"{}\",\"max_retries\":2}";
        HttpResponse<String> r = call("POST", "/api/jobs", body);
        assertThat(r.body(), r.statusCode(), is(201));
        return json(r).get("id").asText();
    }

    @Test
    public void probesAnswerWithoutAuth() throws Exception {
        HttpResponse<String> health = call("GET", "/healthz", null, null);
        assertThat(health.statusCode(), is(200));
        assertThat(health.body(), is("OK"));
        assertThat(call("GET", "/readyz", null, null).statusCode(), is(200));
    }

    @Test
    public void apiNeedsASession() throws Exception {
        HttpResponse<String> none = call("GET", "/api/jobs", null, null);
        assertThat(none.statusCode(), is(401));
        assertThat(json(none).get("error").asText(), is("No authentication token found"));

        assertThat(call("GET", "/api/jobs", null, token + "x").statusCode(), is(401));

        HttpRequest bearer = HttpRequest.newBuilder()
                .uri(URI.create(base + "/api/jobs"))
                .header("Authorization", "Bearer " + token)
                .GET()
                .build();
        assertThat(client.send(bearer, HttpResponse.BodyHandlers.ofString()).statusCode(), is(200));
    }

    @Test
    public void jobLifecycle() throws Exception {
        String id = createJob("lifecycle");

        HttpResponse<String> got = call("GET", "/api/jobs/" + id, null);
        assertThat(got.statusCode(), is(200));
        JsonNode job = json(got);
        assertThat(job.get("name").asText(), is("lifecycle"));
        assertThat(job.get("user_id").asText(), is(USER_ID));
        assertThat(job.get("max_retries").asInt(), is(2));
        assertThat(job.get("headers").get("X-Key").asText(), is("1"));
        assertThat(job.get("next_run_at").asText(), notNullValue());
        assertTrue(job.get("next_run_at").asText().endsWith("Z"));
        assertThat(job.get("schedule_description").asText().isEmpty(), is(false));

        HttpResponse<String> updated = call("PUT", "/api/jobs/" + id, "{\"active\":false,\"name\":\"paused\"}");
        assertThat(updated.statusCode(), is(200));
        assertThat(json(updated).get("active").asBoolean(), is(false));
        assertTrue(json(updated).get("next_run_at").isNull());

        invoker.thenRespond(200, "{\"pong\":true}");
        HttpResponse<String> run = call("POST", "/api/jobs/" + id + "/run", null);
        assertThat(run.statusCode(), is(200));
        assertThat(json(run).get("status").asText(), is("success"));
        assertThat(json(run).get("response_code").asInt(), is(200));

        HttpResponse<String> logs = call("GET", "/api/jobs/" + id + "/logs?limit=10", null);
        assertThat(logs.statusCode(), is(200));
        assertThat(json(logs).size(), is(1));
        assertThat(json(logs).get(0).get("response_body").asText(), is("{\"pong\":true}"));

        assertThat(call("DELETE", "/api/jobs/" + id, null).statusCode(), is(204));
        assertThat(call("GET", "/api/jobs/" + id, null).statusCode(), is(404));
        assertThat(call("DELETE", "/api/jobs/" + id, null).statusCode(), is(404));
    }

    @Test
    public void listIsScopedToTheCaller() throws Exception {
        String id = createJob("mine");

        HttpResponse<String> mine = call("GET", "/api/jobs?limit=100", null);
        boolean found = false;
        for (JsonNode j : json(mine)) {
            found |= j.get("id").asText().equals(id);
        }
        assertTrue(found);

        assertThat(json(call("GET", "/api/jobs", null, otherToken)).size(), is(0));
        HttpResponse<String> foreign = call("GET", "/api/jobs/" + id, null, otherToken);
        assertThat(foreign.statusCode(), is(404));
        assertThat(json(foreign).get("error").asText(), is("not found"));
        assertThat(call("DELETE", "/api/jobs/" + id, null, otherToken).statusCode(), is(404));
        assertThat(call("GET", "/api/jobs/" + id, null).statusCode(), is(200));
    }

    @Test
    public void badInputIsA400() throws Exception {
        HttpResponse<String> badCron = call("POST", "/api/jobs",
                "{\"name\":\"x\",\"schedule\":\"* * *\",\"endpoint\":\"https://example.test\",\"method\":\"GET\"}");
        assertThat(badCron.statusCode(), is(400));
        assertThat(json(badCron).get("error").asText(), containsString("invalid schedule"));

        assertThat(call("POST", "/api/jobs", "{not json").statusCode(), is(400));
        assertThat(call("POST", "/api/jobs", "").statusCode(), is(400));
        assertThat(call("POST", "/api/jobs",
                "{\"name\":\"x\",\"schedule\":\"* * * * *\",\"endpoint\":\"https://example.test\",\"method\":\"BREW\"}")
                .statusCode(), is(400));
    }

    @Test
    public void unknownRoutesAndMethods() throws Exception {
        assertThat(call("PATCH", "/api/jobs", "{}").statusCode(), is(405));
        assertThat(call("GET", "/api/jobsX", null).statusCode(), is(404));
        assertThat(call("GET", "/api/jobs/" + UUID.randomUUID() + "/nope", null).statusCode(), is(404));
        assertThat(call("GET", "/api/jobs/not-a-uuid", null).statusCode(), is(404));
    }

    @Test
    public void endpointTestReportsTheResponse() throws Exception {
        invoker.thenRespond(201, "{\"created\":1}");
        HttpResponse<String> r = call("POST", "/api/jobs/test",
                "{\"endpoint\":\"https://example.test/t\",\"method\":\"POST\",\"body\":\"{}\"}");
        assertThat(r.statusCode(), is(200));
        JsonNode body = json(r);
        assertThat(body.get("status").asInt(), is(201));
        assertThat(body.get("status_text").asText(), is("201 Created"));
        assertThat(body.get("body").get("created").asInt(), is(1));
        assertThat(body.get("headers").get("Content-Type").asText(), is("application/json"));

        invoker.thenFail(new ConnectException("Connection refused"));
        HttpResponse<String> down = call("POST", "/api/jobs/test",
                "{\"endpoint\":\"https://example.test/t\",\"method\":\"GET\"}");
        assertThat(down.statusCode(), is(502));
        assertThat(json(down).get("error").asText(), containsString("Connection refused"));
    }

    @Test
    public void cleanupOnRequest() throws Exception {
        HttpResponse<String> r = call("POST", "/api/jobs/cleanup-logs", null);
        assertThat(r.statusCode(), is(200));
        assertThat(json(r).get("message").asText(), is("Old logs cleaned up successfully"));
    }

    @Test
    public void profileOfTheCaller() throws Exception {
        HttpResponse<String> r = call("GET", "/api/profile", null);
        assertThat(r.statusCode(), is(200));
        JsonNode p = json(r);
        assertThat(p.get("id").asText(), is(USER_ID));
        assertThat(p.get("email").asText(), is("ada@example.test"));
        assertThat(p.get("avatar_url").asText(), is("https://img.example.test/ada.png"));
        assertThat(p.get("created_at").asText(), is("2024-01-01T00:00:00Z"));

        HttpResponse<String> missing = call("GET", "/api/profile", null, otherToken);
        assertThat(missing.statusCode(), is(404));
        assertThat(json(missing).get("error").asText(), is("User not found"));
    }

    @Test
    public void logoutExpiresTheCookie() throws Exception {
        HttpResponse<String> r = call("POST", "/auth/logout", null, null);
        assertThat(r.statusCode(), is(200));
        assertThat(json(r).get("message").asText(), is("Logged out successfully"));
        String cookie = r.headers().firstValue("Set-Cookie").orElse("");
        assertThat(cookie, containsString("auth_token=;"));
        assertThat(cookie, containsString("Max-Age=0"));
    }

    @Test
    public void preflightFromTheDashboard() throws Exception {
        HttpRequest preflight = HttpRequest.newBuilder()
                .uri(URI.create(base + "/api/jobs"))
                .header("Origin", "http://localhost:5173")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> r = client.send(preflight, HttpResponse.BodyHandlers.ofString());
        assertThat(r.statusCode(), is(204));
        assertThat(r.headers().firstValue("Access-Control-Allow-Origin").orElse(""), is("http://localhost:5173"));
        assertThat(r.headers().firstValue("Access-Control-Allow-Credentials").orElse(""), is("true"));

        HttpRequest foreign = HttpRequest.newBuilder()
                .uri(URI.create(base + "/api/jobs"))
                .header("Origin", "https://evil.example")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();
        assertFalse(client.send(foreign, HttpResponse.BodyHandlers.ofString()).headers()
                .firstValue("Access-Control-Allow-Origin").isPresent());
    }

    @Test
    public void metricsAreExposed() throws Exception {
        call("GET", "/healthz", null, null);
        call("GET", "/api/jobs", null);
        HttpResponse<String> r = call("GET", "/metrics", null, null);
        assertThat(r.statusCode(), is(200));
        assertThat(r.body(), containsString("cronix_http_requests_total"));
        assertThat(r.body(), containsString("path=\"/api/jobs\""));
        assertThat(r.headers().firstValue("Content-Type").orElse(""), containsString("text/plain"));

        HttpResponse<String> again = call("GET", "/metrics", null, null);
        assertThat(again.body(), containsString("path=\"/metrics\""));
    }
}
