package com.cronix.scheduler.exception;

/**
 * The endpoint under test could not be reached at all (DNS, connect, timeout).
 */
public class EndpointUnreachableException extends RuntimeException {
    public EndpointUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
