package com.example.circlecrawler;

import com.example.circlecrawler.api.Action;
import com.example.circlecrawler.api.Build;
import com.example.circlecrawler.api.Project;
import com.example.circlecrawler.metadata.Chunk;
import com.example.circlecrawler.metadata.CircleCiMetadata;
import com.example.circlecrawler.metadata.SourceType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;

/**
 * Turns a sanitized action log into a {@link Chunk} and hands it to the shared queue.
 * {@link #emit} blocks while the queue is full.
 */
final class ChunkEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkEmitter.class);

    private final String sourceName;
    private final long sourceId;
    private final long jobId;
    private final boolean verify;
    private final String dashboardUrl;
    private final BlockingQueue<Chunk> chunks;

    ChunkEmitter(SourceConfig config, BlockingQueue<Chunk> chunks) {
        this.sourceName = config.name();
        this.sourceId = config.sourceId();
        this.jobId = config.jobId();
        this.verify = config.verify();
        this.dashboardUrl = config.dashboardUrl().replaceAll("/+$", "");
        this.chunks = chunks;
    }

    void emit(Project project, Build build, String stepName, Action action, byte[] sanitized) throws InterruptedException {
        CircleCiMetadata metadata = new CircleCiMetadata(
                project.vcsType(),
                project.username(),
                project.reponame(),
                build.buildNum(),
                stepName,
                linkFor(project, build)
        );
        chunks.put(new Chunk(SourceType.CIRCLECI, sourceName, sourceId, jobId, sanitized, metadata, verify));
        LOGGER.trace("Emitted {} bytes for {} build {} step '{}' action {}",
                sanitized.length, project, build.buildNum(), stepName, action.index());
    }

    String linkFor(Project project, Build build) {
        return String.format("%s/pipelines/%s/%s/%s/%d",
                dashboardUrl,
                project.vcsType(),
                project.username(),
                project.reponame(),
                build.buildNum());
    }
}
