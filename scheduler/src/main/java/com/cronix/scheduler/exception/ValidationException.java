package com.cronix.scheduler.exception;

/**
 * Request content the caller has to fix: bad URL, method, headers, limits.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
