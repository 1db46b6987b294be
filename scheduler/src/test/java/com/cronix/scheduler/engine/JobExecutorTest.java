package com.cronix.scheduler.engine;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.cronix.scheduler.Jobs;
import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.domain.JobLogStatus;
import com.cronix.scheduler.http.JdkHttpInvoker;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.cronix.scheduler.store.InMemoryJobStore;
import com.cronix.scheduler.store.InMemoryLogRecorder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class JobExecutorTest {
    private static HttpServer server;
    private static String base;
    private static final AtomicInteger failHits = new AtomicInteger();
    private static final AtomicReference<String> lastBody = new AtomicReference<>();
    private static final AtomicReference<String> lastContentType = new AtomicReference<>();

    private InMemoryJobStore store;
    private InMemoryLogRecorder logs;
    private List<Duration> sleeps;

    @BeforeClass
    public static void startStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", ex -> {
            lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(ex.getRequestHeaders().getFirst("Content-Type"));
            respond(ex, 200, "{\"ok\":true}");
        });
        server.createContext("/fail", ex -> {
            failHits.incrementAndGet();
            respond(ex, 500, "boom");
        });
        server.createContext("/missing", ex -> respond(ex, 404, "nope"));
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "late");
        });
        server.createContext("/stalled", ex -> {
            ex.sendResponseHeaders(200, 10);
            try (OutputStream os = ex.getResponseBody()) {
                os.write("ok".getBytes(StandardCharsets.UTF_8));
                os.flush();
                Thread.sleep(6000);
                os.write("12345678".getBytes(StandardCharsets.UTF_8));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // client gave up on the body
            }
        });
        server.createContext("/big", ex -> {
            char[] body = new char[5000];
            Arrays.fill(body, 'x');
            respond(ex, 200, new String(body));
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterClass
    public static void stopStub() {
        if (server != null)
            server.stop(0);
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Before
    public void setUp() {
        store = new InMemoryJobStore();
        logs = new InMemoryLogRecorder(store);
        sleeps = new CopyOnWriteArrayList<>();
        failHits.set(0);
    }

    private JobExecutor executor(ExecutorSettings settings) {
        return new JobExecutor(new JdkHttpInvoker(), logs, new BackoffPolicy(100, 1000, false), sleeps::add,
                Clock.systemUTC(), settings, SchedulerMetrics.noop());
    }

    private JobExecutor executor() {
        return executor(ExecutorSettings.builder().build());
    }

    private Job saved(Job job) {
        return store.insert(job);
    }

    @Test
    public void successIsRecordedWithStatusAndBody() {
        Job job = saved(Jobs.job("* * * * *", base + "/ok").method("POST").body("{\"n\":1}").build());
        Instant before = Instant.now();

        JobLog log = executor().execute(job);

        assertThat(log.getStatus(), is(JobLogStatus.SUCCESS));
        assertThat(log.getResponseCode(), is(200));
        assertThat(log.getResponseBody(), is("{\"ok\":true}"));
        assertThat(log.getAttempts(), is(1));
        assertThat(log.getError(), nullValue());
        assertThat(!log.getStartedAt().isBefore(before.minusSeconds(1)), is(true));
        assertThat(!log.getFinishedAt().isBefore(log.getStartedAt()), is(true));
        assertThat(lastBody.get(), is("{\"n\":1}"));
        assertThat(lastContentType.get(), is("application/json"));

        List<JobLog> stored = logs.list(job.getId(), 10, 0);
        assertThat(stored.size(), is(1));
        assertThat(stored.get(0).getId(), is(log.getId()));
    }

    @Test
    public void serverErrorsAreRetriedIntoOneFailureRecord() {
        Job job = saved(Jobs.job("* * * * *", base + "/fail").maxRetries(3).build());

        JobLog log = executor().execute(job);

        assertThat(failHits.get(), is(4));
        assertThat(log.getStatus(), is(JobLogStatus.FAILURE));
        assertThat(log.getAttempts(), is(4));
        assertThat(log.getResponseCode(), is(500));
        assertThat(log.getError(), is("unexpected status 500 Internal Server Error"));
        assertThat(sleeps, is(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400))));
        assertThat(logs.list(job.getId(), 10, 0).size(), is(1));
    }

    @Test
    public void clientErrorsAreNotRetried() {
        Job job = saved(Jobs.job("* * * * *", base + "/missing").maxRetries(3).build());

        JobLog log = executor().execute(job);

        assertThat(log.getStatus(), is(JobLogStatus.FAILURE));
        assertThat(log.getAttempts(), is(1));
        assertThat(log.getResponseCode(), is(404));
        assertThat(log.getError(), containsString("404"));
        assertThat(sleeps.isEmpty(), is(true));
    }

    @Test
    public void slowEndpointTimesOut() {
        Job job = saved(Jobs.job("* * * * *", base + "/slow").timeoutSeconds(1).build());

        JobLog log = executor().execute(job);

        assertThat(log.getStatus(), is(JobLogStatus.FAILURE));
        assertThat(log.getResponseCode(), nullValue());
        assertThat(log.getError(), is("timeout after 1000ms"));
        assertThat(log.getDurationMs() < 2900, is(true));
    }

    @Test
    public void stalledBodyCountsAgainstTheTimeout() {
        Job job = saved(Jobs.job("* * * * *", base + "/stalled").timeoutSeconds(1).build());
        long start = System.nanoTime();

        JobLog log = executor().execute(job);

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertThat("run took " + elapsedMs + "ms", elapsedMs < 2500, is(true));
        assertThat(log.getStatus(), is(JobLogStatus.FAILURE));
        assertThat(log.getError(), is("timeout after 1000ms"));
        assertThat(log.getDurationMs() < 2500, is(true));
    }

    @Test
    public void unreachableHostIsANetworkFailure() throws IOException {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        Job job = saved(Jobs.job("* * * * *", "http://127.0.0.1:" + closedPort + "/").maxRetries(1).build());

        JobLog log = executor().execute(job);

        assertThat(log.getStatus(), is(JobLogStatus.FAILURE));
        assertThat(log.getAttempts(), is(2));
        assertThat(log.getResponseCode(), nullValue());
        assertThat(log.getError(), notNullValue());
    }

    @Test
    public void responseBodyIsTruncatedAtTheLimit() {
        Job job = saved(Jobs.job("* * * * *", base + "/big").build());

        JobLog log = executor(ExecutorSettings.builder().responseBodyLimit(100).build()).execute(job);

        assertThat(log.getStatus(), is(JobLogStatus.SUCCESS));
        assertThat(log.getResponseBody().length(), is(100));
    }

    @Test
    public void onlyTheNewestRecordsPerJobAreKept() {
        Job job = saved(Jobs.job("* * * * *", base + "/ok").build());
        JobExecutor executor = executor(ExecutorSettings.builder().maxLogsPerJob(2).build());

        executor.execute(job);
        executor.execute(job);
        JobLog last = executor.execute(job);

        List<JobLog> stored = logs.list(job.getId(), 10, 0);
        assertThat(stored.size(), is(2));
        assertThat(stored.get(0).getId(), is(last.getId()));
    }

    @Test
    public void runOfAJobDeletedBeforeStartStillReturnsARecord() {
        Job ghost = Jobs.job("* * * * *", base + "/ok").build();

        JobLog log = executor().execute(ghost);

        assertThat(log.getStatus(), is(JobLogStatus.SUCCESS));
        assertThat(logs.list(ghost.getId(), 10, 0).isEmpty(), is(true));
    }
}
