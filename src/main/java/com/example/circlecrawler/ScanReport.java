package com.example.circlecrawler;

import java.util.List;

/**
 * Summary of a completed run. A run with failures is still a completed run; callers decide
 * what to do with {@link #failures()}.
 */
public record ScanReport(
        int projectsListed,
        int projectsCompleted,
        long chunksEmitted,
        List<BranchFailure> failures
) {
    public long failureCount() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
