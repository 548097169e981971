package com.example.circlecrawler;

import com.example.circlecrawler.api.CircleCiClient;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {
    static final String TOKEN_ENV = "CIRCLECI_TOKEN";
    private static final String DEFAULT_NAME = "circleci";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.environment = environment;
    }

    public SourceConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        String token = optionalString(raw.token, environment.get(TOKEN_ENV));
        if (token == null) {
            throw new IllegalArgumentException("Config must include a token (or set " + TOKEN_ENV + ").");
        }
        int concurrency = raw.concurrency != null && raw.concurrency > 0
                ? raw.concurrency
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int timeoutSeconds = raw.requestTimeoutSeconds != null && raw.requestTimeoutSeconds > 0
                ? raw.requestTimeoutSeconds
                : SourceConfig.DEFAULT_REQUEST_TIMEOUT_SECONDS;
        int maxAttempts = raw.requestMaxAttempts != null && raw.requestMaxAttempts > 0
                ? raw.requestMaxAttempts
                : SourceConfig.DEFAULT_REQUEST_MAX_ATTEMPTS;
        long retryBaseDelayMs = raw.requestRetryBaseDelayMs != null && raw.requestRetryBaseDelayMs >= 0
                ? raw.requestRetryBaseDelayMs
                : SourceConfig.DEFAULT_RETRY_BASE_DELAY_MS;
        int channelCapacity = raw.channelCapacity != null && raw.channelCapacity > 0
                ? raw.channelCapacity
                : SourceConfig.DEFAULT_CHANNEL_CAPACITY;
        int bufferThreshold = raw.bufferEntryThreshold != null && raw.bufferEntryThreshold > 0
                ? raw.bufferEntryThreshold
                : SourceConfig.DEFAULT_BUFFER_THRESHOLD;

        return new SourceConfig(
                optionalString(raw.name, DEFAULT_NAME),
                raw.jobId == null ? 0L : raw.jobId,
                raw.sourceId == null ? 0L : raw.sourceId,
                raw.verify != null && raw.verify,
                token,
                concurrency,
                parseUrl("apiBaseUrl", optionalString(raw.apiBaseUrl, CircleCiClient.DEFAULT_BASE_URL.toString())),
                parseUrl("dashboardUrl", optionalString(raw.dashboardUrl, SourceConfig.DEFAULT_DASHBOARD_URL)).toString(),
                timeoutSeconds,
                maxAttempts,
                retryBaseDelayMs,
                channelCapacity,
                Path.of(optionalString(raw.outputDirectory, "output")),
                bufferThreshold
        );
    }

    private URI parseUrl(String field, String value) {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException(field + " must be an absolute URL: " + value);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException(field + " is not a valid URL: " + value, ex);
        }
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback == null || fallback.isBlank() ? null : fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String name;
        public Long jobId;
        public Long sourceId;
        public Boolean verify;
        public String token;
        public Integer concurrency;
        public String apiBaseUrl;
        public String dashboardUrl;
        public Integer requestTimeoutSeconds;
        public Integer requestMaxAttempts;
        public Long requestRetryBaseDelayMs;
        public Integer channelCapacity;
        public String outputDirectory;
        public Integer bufferEntryThreshold;
    }
}
