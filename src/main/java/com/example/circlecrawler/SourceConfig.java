package com.example.circlecrawler;

import com.example.circlecrawler.api.CircleCiClient;

import java.net.URI;
import java.nio.file.Path;

/**
 * Immutable runtime settings for the CircleCI source and the command line runner.
 */
public record SourceConfig(
        String name,
        long jobId,
        long sourceId,
        boolean verify,
        String token,
        int concurrency,
        URI apiBaseUrl,
        String dashboardUrl,
        int requestTimeoutSeconds,
        int requestMaxAttempts,
        long requestRetryBaseDelayMs,
        int channelCapacity,
        Path outputDirectory,
        int bufferEntryThreshold
) {
    public static final String DEFAULT_DASHBOARD_URL = "https://app.circleci.com";
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_REQUEST_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 250L;
    public static final int DEFAULT_CHANNEL_CAPACITY = 64;
    public static final int DEFAULT_BUFFER_THRESHOLD = 100;

    /**
     * Settings for the public CircleCI endpoints with default transport and output options.
     */
    public static SourceConfig of(String name, long jobId, long sourceId, boolean verify, String token, int concurrency) {
        return new SourceConfig(
                name,
                jobId,
                sourceId,
                verify,
                token,
                concurrency,
                CircleCiClient.DEFAULT_BASE_URL,
                DEFAULT_DASHBOARD_URL,
                DEFAULT_REQUEST_TIMEOUT_SECONDS,
                DEFAULT_REQUEST_MAX_ATTEMPTS,
                DEFAULT_RETRY_BASE_DELAY_MS,
                DEFAULT_CHANNEL_CAPACITY,
                Path.of("output"),
                DEFAULT_BUFFER_THRESHOLD
        );
    }
}
