package com.example.circlecrawler;

import com.example.circlecrawler.api.CircleCiException;
import com.example.circlecrawler.metadata.Chunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final long POISON_TIMEOUT_SECONDS = 30;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar circle-crawler.jar <config.json>");
            System.exit(1);
        }
        SourceConfig config = new ConfigLoader().load(Path.of(args[0]));
        int exitCode = crawl(new CircleCiSource(config), config);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one crawl with a writer thread storing the chunks under the configured output directory.
     *
     * @return 0 on success, 1 when the projects could not be listed or chunks could not be written
     */
    static int crawl(CircleCiSource source, SourceConfig config) throws InterruptedException {
        BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(config.channelCapacity());
        ChunkFileWriter writer = new ChunkFileWriter(
                queue, new ObjectMapper(), config.outputDirectory(), config.bufferEntryThreshold());
        Thread consumer = new Thread(writer, "chunk-writer");
        consumer.start();

        int exitCode = 0;
        try {
            ScanReport report = source.chunks(queue);
            if (report.hasFailures()) {
                LOGGER.info("{} of {} projects were not fully scanned", report.failureCount(), report.projectsListed());
            }
        } catch (CircleCiException ex) {
            LOGGER.error("Error getting projects: {}", ex.getMessage(), ex);
            exitCode = 1;
        } finally {
            if (!consumer.isAlive() || !queue.offer(ChunkFileWriter.POISON, POISON_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.error("Chunk writer is not consuming; not waiting for it");
            } else {
                consumer.join();
            }
        }

        if (writer.failure().isPresent()) {
            LOGGER.error("Wrote {} chunks to {} before a write failed; {} chunks discarded",
                    writer.written(), config.outputDirectory().toAbsolutePath(), writer.discarded());
            return 1;
        }
        LOGGER.info("Wrote {} chunks to {}", writer.written(), config.outputDirectory().toAbsolutePath());
        return exitCode;
    }
}
