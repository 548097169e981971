package com.example.circlecrawler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Failures collected from all project walks of one run. Safe for concurrent use; the count can
 * be read without taking the lock.
 */
public final class ScanErrors {
    private final AtomicLong count = new AtomicLong();
    private final List<BranchFailure> failures;

    public ScanErrors(int expectedProjects) {
        this.failures = new ArrayList<>(Math.max(0, expectedProjects));
    }

    public void add(BranchFailure failure) {
        count.incrementAndGet();
        synchronized (failures) {
            failures.add(failure);
        }
    }

    public long count() {
        return count.get();
    }

    /**
     * Failures in the order they were recorded.
     */
    public List<BranchFailure> snapshot() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
