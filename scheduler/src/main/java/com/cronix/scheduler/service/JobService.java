package com.cronix.scheduler.service;

import java.util.List;

import com.cronix.scheduler.api.CleanupResponse;
import com.cronix.scheduler.api.EndpointTestRequest;
import com.cronix.scheduler.api.EndpointTestResponse;
import com.cronix.scheduler.api.JobCreateRequest;
import com.cronix.scheduler.api.JobLogResponse;
import com.cronix.scheduler.api.JobResponse;
import com.cronix.scheduler.api.JobUpdateRequest;

/**
 * Job operations on behalf of one user. Jobs of other users behave as if they did
 * not exist.
 */
public interface JobService {
    JobResponse createJob(String ownerId, JobCreateRequest request);
    JobResponse getJob(String ownerId, String jobId);
    List<JobResponse> getJobs(String ownerId, int limit, int offset);
    JobResponse updateJob(String ownerId, String jobId, JobUpdateRequest request);
    void deleteJob(String ownerId, String jobId);
    JobLogResponse runJob(String ownerId, String jobId);
    List<JobLogResponse> getLogs(String ownerId, String jobId, int limit, int offset);
    EndpointTestResponse testEndpoint(EndpointTestRequest request);
    CleanupResponse cleanupLogs();
}
