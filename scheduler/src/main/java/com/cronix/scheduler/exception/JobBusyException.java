package com.cronix.scheduler.exception;

public class JobBusyException extends RuntimeException {
    public JobBusyException(String jobId) {
        super("job " + jobId + " is already running");
    }
}
