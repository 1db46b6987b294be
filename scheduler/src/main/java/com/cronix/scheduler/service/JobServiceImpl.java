package com.cronix.scheduler.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import com.cronix.scheduler.api.CleanupResponse;
import com.cronix.scheduler.api.EndpointTestRequest;
import com.cronix.scheduler.api.EndpointTestResponse;
import com.cronix.scheduler.api.JobCreateRequest;
import com.cronix.scheduler.api.JobLogResponse;
import com.cronix.scheduler.api.JobMapper;
import com.cronix.scheduler.api.JobResponse;
import com.cronix.scheduler.api.JobUpdateRequest;
import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.engine.ExecutionService;
import com.cronix.scheduler.engine.JobScheduler;
import com.cronix.scheduler.exception.JobNotFoundException;
import com.cronix.scheduler.store.JobStore;
import com.cronix.scheduler.store.LogRecorder;
import com.cronix.scheduler.store.RetentionPolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class JobServiceImpl implements JobService {
    static final int MAX_JOBS_PAGE = 100;
    static final int MAX_LOGS_PAGE = 500;
    private static final long SCHEDULER_WAIT_SECONDS = 5;

    private final JobStore jobStore;
    private final LogRecorder logRecorder;
    private final JobScheduler scheduler;
    private final ExecutionService executions;
    private final JobValidator validator;
    private final ScheduleDescriber describer;
    private final EndpointTester endpointTester;
    private final RetentionPolicy retention;
    private final Clock clock;

    @Override
    public JobResponse createJob(String ownerId, JobCreateRequest request) {
        Instant now = clock.instant();
        boolean active = request.getActive() == null || request.getActive();
        Instant next = validator.schedule(request.getSchedule(), now);
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .name(validator.name(request.getName()))
                .schedule(request.getSchedule().trim())
                .endpoint(validator.endpoint(request.getEndpoint()))
                .method(validator.method(request.getMethod()))
                .headers(validator.headers(request.getHeaders()))
                .body(validator.body(request.getBody()))
                .active(active)
                .timeoutSeconds(validator.timeoutSeconds(request.getTimeoutSeconds()))
                .maxRetries(validator.maxRetries(request.getMaxRetries()))
                .nextFireAt(active ? next : null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        jobStore.insert(job);
        if (active) {
            await(scheduler.register(job), job.getId());
        }
        log.info("Created job {} ({}) schedule='{}' active={}", job.getName(), job.getId(), job.getSchedule(), active);
        return toResponse(job);
    }

    @Override
    public JobResponse getJob(String ownerId, String jobId) {
        return toResponse(loadOwned(ownerId, jobId));
    }

    @Override
    public List<JobResponse> getJobs(String ownerId, int limit, int offset) {
        return jobStore.listByOwner(ownerId, clamp(limit, MAX_JOBS_PAGE), Math.max(offset, 0)).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Override
    public JobResponse updateJob(String ownerId, String jobId, JobUpdateRequest request) {
        Job current = loadOwned(ownerId, jobId);
        Instant now = clock.instant();

        Job.JobBuilder builder = current.toBuilder().updatedAt(now);
        if (request.getName() != null) {
            builder.name(validator.name(request.getName()));
        }
        String schedule = current.getSchedule();
        if (request.getSchedule() != null) {
            validator.schedule(request.getSchedule(), now);
            schedule = request.getSchedule().trim();
            builder.schedule(schedule);
        }
        String endpoint = current.getEndpoint();
        if (request.getEndpoint() != null) {
            endpoint = validator.endpoint(request.getEndpoint());
            builder.endpoint(endpoint);
        }
        if (request.getMethod() != null) {
            builder.method(validator.method(request.getMethod()));
        }
        if (request.getHeaders() != null) {
            builder.headers(validator.headers(request.getHeaders()));
        }
        if (request.getBody() != null) {
            builder.body(validator.body(request.getBody()));
        }
        boolean active = request.getActive() == null ? current.isActive() : request.getActive();
        builder.active(active);
        if (request.getTimeoutSeconds() != null) {
            builder.timeoutSeconds(validator.timeoutSeconds(request.getTimeoutSeconds()));
        }
        if (request.getMaxRetries() != null) {
            builder.maxRetries(validator.maxRetries(request.getMaxRetries()));
        }

        boolean requeue = !schedule.equals(current.getSchedule())
                || !endpoint.equals(current.getEndpoint())
                || active != current.isActive();
        Job updated = jobStore.update(builder.build()).orElseThrow(() -> new JobNotFoundException(jobId));
        if (requeue) {
            await(scheduler.update(updated), jobId);
            log.info("Job {} ({}) requeued, active={}", updated.getName(), jobId, active);
        }
        return toResponse(updated);
    }

    @Override
    public void deleteJob(String ownerId, String jobId) {
        Job job = loadOwned(ownerId, jobId);
        await(scheduler.remove(jobId), jobId);
        if (!jobStore.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        int logs = logRecorder.deleteByJob(jobId);
        executions.forget(jobId);
        log.info("Deleted job {} ({}) and {} log(s)", job.getName(), jobId, logs);
    }

    @Override
    public JobLogResponse runJob(String ownerId, String jobId) {
        Job job = loadOwned(ownerId, jobId);
        return JobMapper.toJobLogResponse(executions.runNow(job));
    }

    @Override
    public List<JobLogResponse> getLogs(String ownerId, String jobId, int limit, int offset) {
        loadOwned(ownerId, jobId);
        return logRecorder.list(jobId, clamp(limit, MAX_LOGS_PAGE), Math.max(offset, 0)).stream()
                .map(JobMapper::toJobLogResponse)
                .collect(Collectors.toList());
    }

    @Override
    public EndpointTestResponse testEndpoint(EndpointTestRequest request) {
        return endpointTester.test(request);
    }

    @Override
    public CleanupResponse cleanupLogs() {
        int deleted = logRecorder.cleanup(retention, clock.instant());
        log.info("Log cleanup on request removed {} record(s)", deleted);
        return new CleanupResponse(deleted, "Old logs cleaned up successfully");
    }

    private Job loadOwned(String ownerId, String jobId) {
        if (!isUuid(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return jobStore.findById(jobId)
                .filter(job -> Objects.equals(job.getOwnerId(), ownerId))
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobResponse toResponse(Job job) {
        Instant next = scheduler.nextFireTime(job.getId()).orElse(job.getNextFireAt());
        return JobMapper.toJobResponse(job, next, describer.describe(job.getSchedule()),
                executions.isRunning(job.getId()));
    }

    private <T> T await(CompletableFuture<T> change, String jobId) {
        try {
            return change.get(SCHEDULER_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } catch (TimeoutException e) {
            log.warn("Scheduler did not confirm change of job {} within {}s", jobId, SCHEDULER_WAIT_SECONDS);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static int clamp(int limit, int max) {
        return Math.min(Math.max(limit, 1), max);
    }

    private static boolean isUuid(String id) {
        if (id == null) {
            return false;
        }
        try {
            UUID.fromString(id);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
