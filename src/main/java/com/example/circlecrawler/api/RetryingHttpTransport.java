package com.example.circlecrawler.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link HttpTransport} over the JDK client. Idempotent GETs are attempted up to
 * {@code maxAttempts} times on I/O failures and on 408, 429 and 5xx answers, with
 * exponential backoff and jitter between attempts.
 */
public final class RetryingHttpTransport implements HttpTransport {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingHttpTransport.class);
    private static final long MAX_BACKOFF_MS = 10_000L;

    private final HttpClient client;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final long retryBaseDelayMs;

    public RetryingHttpTransport(Duration requestTimeout, int maxAttempts, long retryBaseDelayMs) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(requestTimeout)
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                requestTimeout,
                maxAttempts,
                retryBaseDelayMs);
    }

    RetryingHttpTransport(HttpClient client, Duration requestTimeout, int maxAttempts, long retryBaseDelayMs) {
        this.client = client;
        this.requestTimeout = requestTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBaseDelayMs = Math.min(MAX_BACKOFF_MS, Math.max(0L, retryBaseDelayMs));
    }

    @Override
    public HttpFetchResult get(URI uri, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET();
        headers.forEach(builder::header);
        HttpRequest request = builder.build();

        for (int attempt = 1; ; attempt++) {
            try {
                HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
                HttpFetchResult result = new HttpFetchResult(response.statusCode(), response.body());
                if (!shouldRetry(result.statusCode()) || attempt >= maxAttempts) {
                    return result;
                }
                LOGGER.debug("GET {} answered {} (attempt {}/{}); retrying", uri, result.statusCode(), attempt, maxAttempts);
            } catch (IOException ex) {
                if (attempt >= maxAttempts) {
                    throw ex;
                }
                LOGGER.debug("GET {} failed (attempt {}/{}); retrying", uri, attempt, maxAttempts, ex);
            }
            sleepBackoff(attempt);
        }
    }

    private boolean shouldRetry(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private void sleepBackoff(int attempt) throws InterruptedException {
        long delay = backoffCeilingMs(attempt);
        if (delay == 0) {
            return;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        Thread.sleep(delay / 2 + jitter);
    }

    /**
     * Upper bound of the pause after {@code attempt}; never above {@code MAX_BACKOFF_MS}.
     */
    long backoffCeilingMs(int attempt) {
        // The base is capped at MAX_BACKOFF_MS, so the shifted product stays far below Long.MAX_VALUE.
        return Math.min(MAX_BACKOFF_MS, retryBaseDelayMs << Math.min(16, Math.max(0, attempt - 1)));
    }
}
