package com.example.circlecrawler;

import com.example.circlecrawler.metadata.Chunk;
import com.example.circlecrawler.metadata.SourceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumer side of the chunk queue for the command line runner. Chunks are written in batches of
 * {@code batchSize} to {@code chunks_000001.json}, {@code chunks_000002.json}, ... until
 * {@link #POISON} is taken.
 *
 * <p>After the first failed write the writer keeps taking chunks and discards them, so producers
 * blocked on a full queue always make progress. The failure is kept for {@link #failure()}.
 */
final class ChunkFileWriter implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkFileWriter.class);
    static final Chunk POISON = new Chunk(SourceType.CIRCLECI, "poison", -1L, -1L, new byte[0], null, false);
    static final String FILE_PATTERN = "chunks_%06d.json";

    private final BlockingQueue<Chunk> queue;
    private final ObjectMapper mapper;
    private final Path outputDirectory;
    private final int batchSize;
    private final List<Chunk> batch;
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private int filesWritten;
    private volatile IOException failure;

    ChunkFileWriter(BlockingQueue<Chunk> queue, ObjectMapper mapper, Path outputDirectory, int batchSize) {
        this.queue = queue;
        this.mapper = mapper;
        this.outputDirectory = outputDirectory;
        this.batchSize = Math.max(1, batchSize);
        this.batch = new ArrayList<>(this.batchSize);
    }

    @Override
    public void run() {
        try {
            while (true) {
                Chunk chunk = queue.take();
                if (chunk == POISON) {
                    writeBatch();
                    return;
                }
                if (failure != null) {
                    discarded.incrementAndGet();
                    continue;
                }
                batch.add(chunk);
                if (batch.size() >= batchSize) {
                    writeBatch();
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Chunk writer interrupted after {} chunks", written.get(), ex);
        }
    }

    private void writeBatch() {
        if (batch.isEmpty() || failure != null) {
            return;
        }
        Path file = outputDirectory.resolve(String.format(FILE_PATTERN, filesWritten + 1));
        try {
            Files.createDirectories(outputDirectory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), batch);
            filesWritten++;
            written.addAndGet(batch.size());
        } catch (IOException ex) {
            failure = ex;
            discarded.addAndGet(batch.size());
            LOGGER.error("Could not write {}; discarding chunks from now on", file, ex);
        }
        batch.clear();
    }

    /**
     * Chunks stored in files so far.
     */
    long written() {
        return written.get();
    }

    long discarded() {
        return discarded.get();
    }

    int filesWritten() {
        return filesWritten;
    }

    Optional<IOException> failure() {
        return Optional.ofNullable(failure);
    }
}
