package com.cronix.scheduler.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link HttpInvoker} on {@link java.net.http.HttpClient}. The timeout covers the
 * whole exchange including reading the body; a body that stalls past it is
 * abandoned and its stream closed.
 */
@Slf4j
public class JdkHttpInvoker implements HttpInvoker {
    private static final String CONTENT_TYPE = "Content-Type";
    private static final AtomicInteger READER_IDS = new AtomicInteger();
    // body reads block, so they stay off the common pool
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cronix-http-body-" + READER_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final HttpClient client;

    public JdkHttpInvoker() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public JdkHttpInvoker(HttpClient client) {
        this.client = client;
    }

    @Override
    public OutboundResponse invoke(OutboundRequest request) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = request.getBody() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.getBody());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.getUrl()))
                .timeout(request.getTimeout())
                .method(request.getMethod(), publisher);
        boolean hasContentType = false;
        if (request.getHeaders() != null) {
            for (Map.Entry<String, String> h : request.getHeaders().entrySet()) {
                builder.setHeader(h.getKey(), h.getValue());
                hasContentType |= CONTENT_TYPE.equalsIgnoreCase(h.getKey());
            }
        }
        if (!hasContentType) {
            builder.setHeader(CONTENT_TYPE, "application/json");
        }

        AtomicReference<InputStream> stream = new AtomicReference<>();
        CompletableFuture<OutboundResponse> pending = client
                .sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream())
                .thenApplyAsync(response -> {
                    stream.set(response.body());
                    return read(response, request.getBodyLimit());
                }, READERS);
        try {
            return pending.get(request.getTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            abort(pending, stream);
            throw new HttpTimeoutException("request timed out after " + request.getTimeout().toMillis() + "ms");
        } catch (InterruptedException e) {
            abort(pending, stream);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause == null ? e.getMessage() : cause.getMessage(), cause);
        }
    }

    private static void abort(CompletableFuture<?> pending, AtomicReference<InputStream> stream) {
        pending.cancel(true);
        InputStream in = stream.get();
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Closing abandoned response body failed: {}", e.getMessage());
        }
    }

    private static OutboundResponse read(HttpResponse<InputStream> response, int limit) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> h : response.headers().map().entrySet()) {
            if (!h.getValue().isEmpty() && !h.getKey().startsWith(":")) {
                headers.put(h.getKey(), h.getValue().get(0));
            }
        }
        try (InputStream in = response.body()) {
            byte[] data = in.readNBytes(limit);
            boolean truncated = in.read() != -1;
            return new OutboundResponse(response.statusCode(), headers, new String(data, StandardCharsets.UTF_8),
                    truncated);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
