package com.example.circlecrawler;

import java.util.Optional;

/**
 * Outcome of walking one project: either every action was emitted, or the walk stopped at a
 * {@link BranchFailure}.
 */
public final class ProjectScanResult {
    private final long chunksEmitted;
    private final BranchFailure failure;

    private ProjectScanResult(long chunksEmitted, BranchFailure failure) {
        this.chunksEmitted = chunksEmitted;
        this.failure = failure;
    }

    public static ProjectScanResult ok(long chunksEmitted) {
        return new ProjectScanResult(chunksEmitted, null);
    }

    public static ProjectScanResult failed(BranchFailure failure, long chunksEmitted) {
        return new ProjectScanResult(chunksEmitted, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Chunks emitted before the walk finished or stopped.
     */
    public long chunksEmitted() {
        return chunksEmitted;
    }

    public Optional<BranchFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
