package com.example.circlecrawler;

import java.util.concurrent.atomic.AtomicLong;

public final class ScanProgress {
    private final AtomicLong projectsTotal = new AtomicLong();
    private final AtomicLong projectsScanned = new AtomicLong();

    void start(long total) {
        projectsScanned.set(0);
        projectsTotal.set(total);
    }

    /**
     * Marks one more project as finished and returns the new count.
     */
    long projectFinished() {
        return projectsScanned.incrementAndGet();
    }

    public long projectsScanned() {
        return projectsScanned.get();
    }

    public long projectsTotal() {
        return projectsTotal.get();
    }
}
