package com.example.circlecrawler;

public record ProgressSnapshot(
        long projectsScanned,
        long projectsTotal,
        int percentComplete,
        String message
) {
    /**
     * Creates an immutable view of the running project counters.
     */
    public static ProgressSnapshot from(ScanProgress progress) {
        long scanned = progress.projectsScanned();
        long total = progress.projectsTotal();
        int percent = total == 0 ? 0 : (int) (scanned * 100 / total);
        return new ProgressSnapshot(scanned, total, percent, String.format("scanned %d/%d projects", scanned, total));
    }
}
