package com.cronix.scheduler.http;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Performs outbound HTTP calls. Every status code is a response; only transport
 * problems throw.
 */
public interface HttpInvoker {
    /**
     * @throws HttpTimeoutException when the call exceeds {@link OutboundRequest#getTimeout()}
     * @throws IOException on connection or protocol failures
     */
    OutboundResponse invoke(OutboundRequest request) throws IOException, InterruptedException;
}
