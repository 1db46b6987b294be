package com.cronix.scheduler.server;

import com.cronix.cron.InvalidScheduleException;
import com.cronix.scheduler.api.ErrorResponse;
import com.cronix.scheduler.exception.EndpointUnreachableException;
import com.cronix.scheduler.exception.JobBusyException;
import com.cronix.scheduler.exception.JobNotFoundException;
import com.cronix.scheduler.exception.StoreException;
import com.cronix.scheduler.exception.UnauthorizedException;
import com.cronix.scheduler.exception.ValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns exceptions thrown by handlers into status codes and error bodies.
 */
@Slf4j
public final class ApiExceptionMapper {
    private ApiExceptionMapper() {
    }

    public static final class Mapped {
        private final int status;
        private final ErrorResponse body;

        Mapped(int status, ErrorResponse body) {
            this.status = status;
            this.body = body;
        }

        public int getStatus() {
            return status;
        }

        public ErrorResponse getBody() {
            return body;
        }
    }

    public static Mapped map(Throwable e) {
        if (e instanceof InvalidScheduleException || e instanceof ValidationException) {
            return new Mapped(400, new ErrorResponse(e.getMessage()));
        }
        if (e instanceof UnauthorizedException) {
            return new Mapped(401, new ErrorResponse(e.getMessage()));
        }
        if (e instanceof JobNotFoundException) {
            return new Mapped(404, new ErrorResponse("not found"));
        }
        if (e instanceof JobBusyException) {
            return new Mapped(409, new ErrorResponse(e.getMessage()));
        }
        if (e instanceof EndpointUnreachableException) {
            return new Mapped(502, new ErrorResponse(e.getMessage()));
        }
        if (e instanceof StoreException) {
            log.error("Store failure", e);
            return new Mapped(500, new ErrorResponse("storage unavailable"));
        }
        log.error("Unhandled error", e);
        return new Mapped(500, new ErrorResponse("internal error"));
    }
}
