package com.cronix.scheduler.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("job " + jobId + " not found");
    }
}
