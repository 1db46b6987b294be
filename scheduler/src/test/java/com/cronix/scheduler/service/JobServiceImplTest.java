package com.cronix.scheduler.service;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.cronix.cron.InvalidScheduleException;
import com.cronix.scheduler.Jobs;
import com.cronix.scheduler.ManualClock;
import com.cronix.scheduler.ScriptedInvoker;
import com.cronix.scheduler.api.JobCreateRequest;
import com.cronix.scheduler.api.JobLogResponse;
import com.cronix.scheduler.api.JobResponse;
import com.cronix.scheduler.api.JobUpdateRequest;
import com.cronix.scheduler.engine.BackoffPolicy;
import com.cronix.scheduler.engine.ExecutionLocks;
import com.cronix.scheduler.engine.ExecutionService;
import com.cronix.scheduler.engine.ExecutorSettings;
import com.cronix.scheduler.engine.JobExecutor;
import com.cronix.scheduler.engine.JobScheduler;
import com.cronix.scheduler.exception.JobNotFoundException;
import com.cronix.scheduler.exception.ValidationException;
import com.cronix.scheduler.metrics.SchedulerMetrics;
import com.cronix.scheduler.server.ApiJson;
import com.cronix.scheduler.store.InMemoryJobStore;
import com.cronix.scheduler.store.InMemoryLogRecorder;
import com.cronix.scheduler.store.RetentionPolicy;

public class JobServiceImplTest {
    private static final String OWNER = Jobs.OWNER;
    private static final String STRANGER = "22222222-2222-2222-2222-222222222222";

    private ManualClock clock;
    private InMemoryJobStore store;
    private InMemoryLogRecorder logs;
    private ScriptedInvoker invoker;
    private JobScheduler scheduler;
    private ExecutionService executions;
    private JobService service;

    @Before
    public void setUp() {
        clock = new ManualClock(Instant.parse("2024-03-10T10:07:42Z"));
        store = new InMemoryJobStore();
        logs = new InMemoryLogRecorder(store);
        invoker = new ScriptedInvoker();
        JobExecutor executor = new JobExecutor(invoker, logs, new BackoffPolicy(0, 0, false), d -> {
        }, clock, ExecutorSettings.builder().build(), SchedulerMetrics.noop());
        executions = new ExecutionService(store, executor, new ExecutionLocks(), SchedulerMetrics.noop(), 2, 8,
                Duration.ofMillis(100));
        scheduler = new JobScheduler(store, executions, clock, ZoneOffset.UTC);
        scheduler.start();
        JobValidator validator = new JobValidator(ZoneOffset.UTC);
        service = new JobServiceImpl(store, logs, scheduler, executions, validator, new ScheduleDescriber(),
                new EndpointTester(invoker, validator, ApiJson.newMapper()),
                new RetentionPolicy(Duration.ofDays(30), 5), clock);
    }

    @After
    public void tearDown() {
        scheduler.close();
        executions.shutdown(Duration.ofSeconds(2));
    }

    private static JobCreateRequest.JobCreateRequestBuilder create() {
        return JobCreateRequest.builder()
                .name("  nightly report ")
                .schedule("*/5 * * * *")
                .endpoint("https://example.test/report")
                .method("post")
                .headers(Map.of("Authorization", "Bearer x"))
                .body("{\"full\":true}");
    }

    @Test
    public void createdJobIsStoredAndScheduled() {
        JobResponse job = service.createJob(OWNER, create().build());

        assertThat(job.getId(), notNullValue());
        assertThat(job.getUserId(), is(OWNER));
        assertThat(job.getName(), is("nightly report"));
        assertThat(job.getMethod(), is("POST"));
        assertTrue(job.isActive());
        assertFalse(job.isRunning());
        assertThat(job.getNextRunAt(), is(Instant.parse("2024-03-10T10:10:00Z")));
        assertThat(job.getScheduleDescription(), notNullValue());
        assertThat(job.getScheduleDescription(), not("*/5 * * * *"));
        assertThat(scheduler.nextFireTime(job.getId()).get(), is(job.getNextRunAt()));
        assertTrue(store.findById(job.getId()).isPresent());
    }

    @Test
    public void inactiveJobHasNoNextRun() {
        JobResponse job = service.createJob(OWNER, create().active(false).build());

        assertFalse(job.isActive());
        assertThat(job.getNextRunAt(), nullValue());
        assertThat(scheduler.size(), is(0));
    }

    @Test
    public void invalidInputStoresNothing() {
        assertThrows(InvalidScheduleException.class,
                () -> service.createJob(OWNER, create().schedule("* * *").build()));
        assertThrows(InvalidScheduleException.class,
                () -> service.createJob(OWNER, create().schedule("0 0 30 2 *").build()));
        assertThrows(ValidationException.class,
                () -> service.createJob(OWNER, create().endpoint("ftp://example.test").build()));
        assertThrows(ValidationException.class, () -> service.createJob(OWNER, create().method("TRACE").build()));
        assertThrows(ValidationException.class, () -> service.createJob(OWNER, create().name(" ").build()));
        assertThrows(ValidationException.class, () -> service.createJob(OWNER, create().maxRetries(11).build()));
        assertThat(service.getJobs(OWNER, 20, 0).size(), is(0));
        assertThat(scheduler.size(), is(0));
    }

    @Test
    public void jobsOfOtherUsersLookMissing() {
        JobResponse job = service.createJob(OWNER, create().build());

        assertThrows(JobNotFoundException.class, () -> service.getJob(STRANGER, job.getId()));
        assertThrows(JobNotFoundException.class, () -> service.deleteJob(STRANGER, job.getId()));
        assertThrows(JobNotFoundException.class, () -> service.runJob(STRANGER, job.getId()));
        assertThrows(JobNotFoundException.class, () -> service.getLogs(STRANGER, job.getId(), 10, 0));
        assertThrows(JobNotFoundException.class, () -> service.getJob(OWNER, "not-a-uuid"));
        assertTrue(service.getJobs(STRANGER, 20, 0).isEmpty());
        assertThat(scheduler.size(), is(1));
    }

    @Test
    public void deletingAnUnknownJobChangesNothing() {
        service.createJob(OWNER, create().build());

        assertThrows(JobNotFoundException.class, () -> service.deleteJob(OWNER, UUID.randomUUID().toString()));
        assertThat(scheduler.size(), is(1));
    }

    @Test
    public void deleteRemovesJobScheduleAndHistory() {
        JobResponse job = service.createJob(OWNER, create().build());
        service.runJob(OWNER, job.getId());

        service.deleteJob(OWNER, job.getId());

        assertFalse(store.findById(job.getId()).isPresent());
        assertFalse(scheduler.nextFireTime(job.getId()).isPresent());
        assertTrue(logs.list(job.getId(), 10, 0).isEmpty());
        assertThrows(JobNotFoundException.class, () -> service.getJob(OWNER, job.getId()));
    }

    @Test
    public void scheduleChangeRequeues() {
        JobResponse job = service.createJob(OWNER, create().build());

        JobResponse updated = service.updateJob(OWNER, job.getId(),
                JobUpdateRequest.builder().schedule("0 12 * * *").build());

        assertThat(updated.getNextRunAt(), is(Instant.parse("2024-03-10T12:00:00Z")));
        assertThat(scheduler.nextFireTime(job.getId()).get(), is(Instant.parse("2024-03-10T12:00:00Z")));
        assertThat(updated.getName(), is("nightly report"));
    }

    @Test
    public void pausingAndResuming() {
        JobResponse job = service.createJob(OWNER, create().build());

        JobResponse paused = service.updateJob(OWNER, job.getId(), JobUpdateRequest.builder().active(false).build());
        assertFalse(paused.isActive());
        assertThat(paused.getNextRunAt(), nullValue());
        assertThat(scheduler.size(), is(0));

        JobResponse resumed = service.updateJob(OWNER, job.getId(), JobUpdateRequest.builder().active(true).build());
        assertTrue(resumed.isActive());
        assertThat(resumed.getNextRunAt(), is(Instant.parse("2024-03-10T10:10:00Z")));
    }

    @Test
    public void partialUpdateKeepsOtherFields() {
        JobResponse job = service.createJob(OWNER, create().build());
        clock.advance(Duration.ofSeconds(30));

        JobResponse updated = service.updateJob(OWNER, job.getId(),
                JobUpdateRequest.builder().name("renamed").body("").build());

        assertThat(updated.getName(), is("renamed"));
        assertThat(updated.getBody(), nullValue());
        assertThat(updated.getSchedule(), is("*/5 * * * *"));
        assertThat(updated.getHeaders(), is(Map.of("Authorization", "Bearer x")));
        assertThat(updated.getNextRunAt(), is(job.getNextRunAt()));
        assertThat(updated.getUpdatedAt(), is(clock.instant()));
        assertThat(updated.getCreatedAt(), is(job.getCreatedAt()));
    }

    @Test
    public void invalidUpdateLeavesTheJobAlone() {
        JobResponse job = service.createJob(OWNER, create().build());

        assertThrows(InvalidScheduleException.class, () -> service.updateJob(OWNER, job.getId(),
                JobUpdateRequest.builder().name("renamed").schedule("99 * * * *").build()));

        JobResponse current = service.getJob(OWNER, job.getId());
        assertThat(current.getName(), is("nightly report"));
        assertThat(current.getSchedule(), is("*/5 * * * *"));
    }

    @Test
    public void manualRunIsRecorded() {
        JobResponse job = service.createJob(OWNER, create().build());
        invoker.thenRespond(200, "{\"ok\":true}");

        JobLogResponse run = service.runJob(OWNER, job.getId());

        assertThat(run.getStatus(), is("success"));
        assertThat(run.getResponseCode(), is(200));
        assertThat(run.getAttempts(), is(1));
        assertThat(invoker.getRequests().get(0).getMethod(), is("POST"));
        assertThat(invoker.getRequests().get(0).getBody(), is("{\"full\":true}"));

        List<JobLogResponse> history = service.getLogs(OWNER, job.getId(), 50, 0);
        assertThat(history.size(), is(1));
        assertThat(history.get(0).getId(), is(run.getId()));
    }

    @Test
    public void listingIsClampedAndPaged() {
        for (int i = 0; i < 3; i++) {
            service.createJob(OWNER, create().name("job " + i).build());
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(service.getJobs(OWNER, 0, 0).size(), is(1));
        assertThat(service.getJobs(OWNER, 2, 0).get(0).getName(), is("job 2"));
        assertThat(service.getJobs(OWNER, 2, 2).size(), is(1));
        assertThat(service.getJobs(OWNER, 1000, -5).size(), is(3));
    }

    @Test
    public void cleanupReportsWhatWasDeleted() {
        JobResponse job = service.createJob(OWNER, create().build());
        for (int i = 0; i < 7; i++) {
            service.runJob(OWNER, job.getId());
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(logs.list(job.getId(), 50, 0).size(), is(5));
        assertThat(service.cleanupLogs().getMessage(), is("Old logs cleaned up successfully"));
        assertThat(service.cleanupLogs().getDeleted(), is(0));
    }
}
