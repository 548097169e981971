package com.example.circlecrawler;

import com.example.circlecrawler.metadata.Chunk;
import com.example.circlecrawler.metadata.CircleCiMetadata;
import com.example.circlecrawler.metadata.SourceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkFileWriterTest {
    @TempDir
    Path outputDir;

    @Test
    void writesBatchesUntilPoisonAndFlushesRemainder() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        BlockingQueue<Chunk> queue = new LinkedBlockingQueue<>();
        ChunkFileWriter writer = new ChunkFileWriter(queue, mapper, outputDir, 2);
        Thread consumer = new Thread(writer);
        consumer.start();

        queue.put(chunk(1, "first"));
        queue.put(chunk(2, "second"));
        queue.put(chunk(3, "third"));
        queue.put(ChunkFileWriter.POISON);
        consumer.join(5_000);

        assertThat(writer.written()).isEqualTo(3L);
        assertThat(writer.filesWritten()).isEqualTo(2);
        assertThat(writer.failure()).isEmpty();
        JsonNode firstBatch = mapper.readTree(outputDir.resolve("chunks_000001.json").toFile());
        JsonNode secondBatch = mapper.readTree(outputDir.resolve("chunks_000002.json").toFile());
        assertThat(firstBatch.size()).isEqualTo(2);
        assertThat(secondBatch.size()).isEqualTo(1);
        JsonNode last = secondBatch.get(0);
        assertThat(last.get("sourceType").asText()).isEqualTo("CIRCLECI");
        assertThat(last.get("metadata").get("buildNumber").asLong()).isEqualTo(3L);
        assertThat(last.get("metadata").get("link").asText())
                .isEqualTo("https://app.circleci.com/pipelines/github/acme/api/3");
        assertThat(new String(Base64.getDecoder().decode(last.get("data").asText()), StandardCharsets.UTF_8))
                .isEqualTo("third");
    }

    @Test
    void poisonAloneWritesNoFile() throws Exception {
        BlockingQueue<Chunk> queue = new LinkedBlockingQueue<>();
        ChunkFileWriter writer = new ChunkFileWriter(queue, new ObjectMapper(), outputDir, 10);
        queue.put(ChunkFileWriter.POISON);

        writer.run();

        assertThat(writer.filesWritten()).isZero();
        try (var files = Files.list(outputDir)) {
            assertThat(files.count()).isZero();
        }
    }

    @Test
    void keepsDrainingAfterWriteFailureSoProducersNeverBlock() throws Exception {
        Path notADirectory = Files.writeString(outputDir.resolve("plain-file"), "x");
        BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(1);
        ChunkFileWriter writer = new ChunkFileWriter(queue, new ObjectMapper(), notADirectory.resolve("out"), 1);
        Thread consumer = new Thread(writer);
        consumer.start();

        Thread producer = new Thread(() -> {
            try {
                for (int build = 1; build <= 4; build++) {
                    queue.put(chunk(build, "log " + build));
                }
                queue.put(ChunkFileWriter.POISON);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        producer.join(5_000);
        consumer.join(5_000);

        assertThat(producer.isAlive()).isFalse();
        assertThat(consumer.isAlive()).isFalse();
        assertThat(writer.failure()).isPresent();
        assertThat(writer.written()).isZero();
        assertThat(writer.discarded()).isEqualTo(4L);
        assertThat(queue).isEmpty();
    }

    static Chunk chunk(int build, String body) {
        return new Chunk(
                SourceType.CIRCLECI,
                "circleci",
                1L,
                2L,
                body.getBytes(StandardCharsets.UTF_8),
                new CircleCiMetadata("github", "acme", "api", build, "test",
                        "https://app.circleci.com/pipelines/github/acme/api/" + build),
                false
        );
    }
}
