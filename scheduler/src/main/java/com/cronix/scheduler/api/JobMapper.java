package com.cronix.scheduler.api;

import java.time.Instant;

import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.domain.User;

public final class JobMapper {
    private JobMapper() {
    }

    public static JobResponse toJobResponse(Job job, Instant nextRunAt, String scheduleDescription, boolean running) {
        return JobResponse.builder()
                .id(job.getId())
                .userId(job.getOwnerId())
                .name(job.getName())
                .schedule(job.getSchedule())
                .scheduleDescription(scheduleDescription)
                .endpoint(job.getEndpoint())
                .method(job.getMethod())
                .headers(job.getHeaders())
                .body(job.getBody())
                .active(job.isActive())
                .timeoutSeconds(job.getTimeoutSeconds())
                .maxRetries(job.getMaxRetries())
                .nextRunAt(job.isActive() ? nextRunAt : null)
                .running(running)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }

    public static JobLogResponse toJobLogResponse(JobLog log) {
        return JobLogResponse.builder()
                .id(log.getId())
                .jobId(log.getJobId())
                .startedAt(log.getStartedAt())
                .finishedAt(log.getFinishedAt())
                .durationMs(log.getDurationMs())
                .status(log.getStatus().wireName())
                .responseCode(log.getResponseCode())
                .error(log.getError())
                .responseBody(log.getResponseBody())
                .attempts(log.getAttempts())
                .build();
    }

    public static ProfileResponse toProfileResponse(User user) {
        return ProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .avatarUrl(user.getAvatarUrl())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
