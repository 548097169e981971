package com.example.circlecrawler;

import com.example.circlecrawler.api.Action;
import com.example.circlecrawler.api.Build;
import com.example.circlecrawler.api.BuildStep;
import com.example.circlecrawler.api.CircleCiClient;
import com.example.circlecrawler.api.CircleCiException;
import com.example.circlecrawler.api.Project;
import com.example.circlecrawler.api.RetryingHttpTransport;
import com.example.circlecrawler.metadata.Chunk;
import com.example.circlecrawler.metadata.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams the action logs of every project visible to a CircleCI token.
 *
 * <p>A run lists the projects once, then walks each project on its own task of a pool limited to
 * {@code concurrency} threads. Inside a task builds, steps and actions are visited strictly in the
 * order the API returns them. Any failure after the project listing ends only the walk of the
 * project it happened in; it is recorded and reported, and the run carries on.
 */
public final class CircleCiSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(CircleCiSource.class);

    private final SourceConfig config;
    private final CircleCiClient client;
    private final ScanProgress progress = new ScanProgress();

    public CircleCiSource(SourceConfig config) {
        this(config, clientFor(validate(config)));
    }

    CircleCiSource(SourceConfig config, CircleCiClient client) {
        this.config = validate(config);
        this.client = client;
    }

    /**
     * Creates a source for the public CircleCI API.
     *
     * @param token       personal or project API token, sent as {@code Circle-Token}
     * @param concurrency maximum number of projects walked at the same time
     */
    public static CircleCiSource init(String name, long jobId, long sourceId, boolean verify, String token, int concurrency) {
        return new CircleCiSource(SourceConfig.of(name, jobId, sourceId, verify, token, concurrency));
    }

    public SourceType type() {
        return SourceType.CIRCLECI;
    }

    public String name() {
        return config.name();
    }

    public long sourceId() {
        return config.sourceId();
    }

    public long jobId() {
        return config.jobId();
    }

    public ProgressSnapshot progress() {
        return ProgressSnapshot.from(progress);
    }

    /**
     * Runs a full crawl, putting one chunk per action log on {@code chunks}. Blocks until every
     * project has been walked. The queue is never read or closed here.
     *
     * @throws CircleCiException    if the projects cannot be listed; nothing has been emitted then
     * @throws InterruptedException if the calling thread is interrupted; running walks are cancelled
     */
    public ScanReport chunks(BlockingQueue<Chunk> chunks) throws CircleCiException, InterruptedException {
        List<Project> projects = client.listProjects();
        LOGGER.info("Found {} projects for source '{}'", projects.size(), config.name());

        ScanErrors errors = new ScanErrors(projects.size());
        progress.start(projects.size());
        ChunkEmitter emitter = new ChunkEmitter(config, chunks);

        List<ProjectScanResult> results = new ArrayList<>(projects.size());
        if (!projects.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(config.concurrency(), new ProjectThreadFactory());
            try {
                List<Future<ProjectScanResult>> futures = new ArrayList<>(projects.size());
                for (Project project : projects) {
                    futures.add(pool.submit(() -> scanProject(project, emitter, errors)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    results.add(await(futures.get(i), projects.get(i), errors));
                }
            } finally {
                // Cancels the remaining walks when we leave early on interrupt.
                pool.shutdownNow();
            }
        }

        if (errors.count() > 0) {
            LOGGER.debug("encountered {} errors while scanning; errors: {}", errors.count(), errors);
        }
        long emitted = results.stream().mapToLong(ProjectScanResult::chunksEmitted).sum();
        int completed = (int) results.stream().filter(ProjectScanResult::isSuccess).count();
        LOGGER.info("Scanned {} projects ({} completed, {} failed), emitted {} chunks",
                projects.size(), completed, errors.count(), emitted);
        return new ScanReport(projects.size(), completed, emitted, errors.snapshot());
    }

    private ProjectScanResult await(Future<ProjectScanResult> future, Project project, ScanErrors errors)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            // Only reachable when a worker was interrupted by something other than this run.
            BranchFailure failure = BranchFailure.atProject(project, ex.getCause());
            errors.add(failure);
            LOGGER.warn("Walk of {} aborted", project, ex.getCause());
            return ProjectScanResult.failed(failure, 0);
        }
    }

    private ProjectScanResult scanProject(Project project, ChunkEmitter emitter, ScanErrors errors)
            throws InterruptedException {
        ProjectScanResult result;
        try {
            result = walk(project, emitter);
        } catch (RuntimeException ex) {
            result = ProjectScanResult.failed(BranchFailure.atProject(project, ex), 0);
        }
        result.failure().ifPresent(failure -> {
            errors.add(failure);
            LOGGER.warn("Skipping rest of {}: {}", failure.context(), failure.cause().getMessage());
        });
        long scanned = progress.projectFinished();
        LOGGER.debug("scanned {}/{} projects", scanned, progress.projectsTotal());
        return result;
    }

    /**
     * Walks builds, steps and actions of one project. The first failure ends the walk.
     */
    ProjectScanResult walk(Project project, ChunkEmitter emitter) throws InterruptedException {
        long emitted = 0;
        List<Build> builds;
        try {
            builds = client.listBuilds(project);
        } catch (CircleCiException ex) {
            return ProjectScanResult.failed(BranchFailure.atProject(project, ex), emitted);
        }

        for (Build build : builds) {
            List<BuildStep> steps;
            try {
                steps = client.listSteps(project, build);
            } catch (CircleCiException ex) {
                return ProjectScanResult.failed(BranchFailure.atBuild(project, build, ex), emitted);
            }

            for (BuildStep step : steps) {
                for (Action action : step.actions()) {
                    byte[] body;
                    try {
                        body = client.fetchLogBody(action);
                    } catch (CircleCiException ex) {
                        return ProjectScanResult.failed(
                                BranchFailure.atAction(project, build, step.name(), action, ex), emitted);
                    }
                    emitter.emit(project, build, step.name(), action, LogSanitizer.sanitize(body));
                    emitted++;
                }
            }
        }
        return ProjectScanResult.ok(emitted);
    }

    private static CircleCiClient clientFor(SourceConfig config) {
        RetryingHttpTransport transport = new RetryingHttpTransport(
                Duration.ofSeconds(config.requestTimeoutSeconds()),
                config.requestMaxAttempts(),
                config.requestRetryBaseDelayMs());
        return new CircleCiClient(transport, config.apiBaseUrl(), config.token());
    }

    private static SourceConfig validate(SourceConfig config) {
        if (config.name() == null) {
            throw new IllegalArgumentException("Source name is required.");
        }
        if (config.token() == null || config.token().isBlank()) {
            throw new IllegalArgumentException("A CircleCI token is required.");
        }
        if (config.concurrency() < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + config.concurrency());
        }
        return config;
    }

    private static final class ProjectThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "circleci-project-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
