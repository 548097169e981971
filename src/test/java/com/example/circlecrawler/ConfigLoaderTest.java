package com.example.circlecrawler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void appliesDefaultsToMinimalConfig() throws Exception {
        Path file = write("{\"token\":\"abc\",\"unknownField\":1}");

        SourceConfig config = new ConfigLoader(Map.of()).load(file);

        assertThat(config.name()).isEqualTo("circleci");
        assertThat(config.token()).isEqualTo("abc");
        assertThat(config.concurrency()).isPositive();
        assertThat(config.apiBaseUrl()).isEqualTo(URI.create("https://circleci.com/api/v1.1/"));
        assertThat(config.dashboardUrl()).isEqualTo("https://app.circleci.com");
        assertThat(config.requestMaxAttempts()).isEqualTo(3);
        assertThat(config.channelCapacity()).isEqualTo(SourceConfig.DEFAULT_CHANNEL_CAPACITY);
        assertThat(config.outputDirectory()).isEqualTo(Path.of("output"));
        assertThat(config.verify()).isFalse();
    }

    @Test
    void readsEveryField() throws Exception {
        Path file = write("{\"name\":\"ci\",\"jobId\":5,\"sourceId\":6,\"verify\":true,\"token\":\"t\","
                + "\"concurrency\":3,\"apiBaseUrl\":\"https://ci.internal/api/v1.1/\","
                + "\"dashboardUrl\":\"https://ci.internal\",\"requestTimeoutSeconds\":9,"
                + "\"requestMaxAttempts\":1,\"requestRetryBaseDelayMs\":0,\"channelCapacity\":4,"
                + "\"outputDirectory\":\"out\",\"bufferEntryThreshold\":2}");

        SourceConfig config = new ConfigLoader(Map.of()).load(file);

        assertThat(config).isEqualTo(new SourceConfig("ci", 5L, 6L, true, "t", 3,
                URI.create("https://ci.internal/api/v1.1/"), "https://ci.internal", 9, 1, 0L, 4,
                Path.of("out"), 2));
    }

    @Test
    void fallsBackToTokenFromEnvironment() throws Exception {
        Path file = write("{\"name\":\"ci\"}");

        SourceConfig config = new ConfigLoader(Map.of(ConfigLoader.TOKEN_ENV, "from-env")).load(file);

        assertThat(config.token()).isEqualTo("from-env");
    }

    @Test
    void rejectsMissingToken() throws Exception {
        Path file = write("{\"token\":\"  \"}");

        assertThatThrownBy(() -> new ConfigLoader(Map.of()).load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.TOKEN_ENV);
    }

    @Test
    void rejectsRelativeApiUrl() throws Exception {
        Path file = write("{\"token\":\"t\",\"apiBaseUrl\":\"api/v1.1\"}");

        assertThatThrownBy(() -> new ConfigLoader(Map.of()).load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("apiBaseUrl");
    }

    private Path write(String json) throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }
}
