package com.umitunal.dummyllm.core;

/**
 * Counts of jobs per state for monitoring.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final long queuedJobs;
    private final long runningJobs;
    private final long okJobs;
    private final long failedJobs;
    private final long timedOutJobs;
    private final long cancelledJobs;

    public StoreMetrics(long totalJobs, long queuedJobs, long runningJobs, long okJobs,
                        long failedJobs, long timedOutJobs, long cancelledJobs) {
        this.totalJobs = totalJobs;
        this.queuedJobs = queuedJobs;
        this.runningJobs = runningJobs;
        this.okJobs = okJobs;
        this.failedJobs = failedJobs;
        this.timedOutJobs = timedOutJobs;
        this.cancelledJobs = cancelledJobs;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getQueuedJobs() { return queuedJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getOkJobs() { return okJobs; }
    public long getFailedJobs() { return failedJobs; }
    public long getTimedOutJobs() { return timedOutJobs; }
    public long getCancelledJobs() { return cancelledJobs; }

    public long getTerminalJobs() {
        return okJobs + failedJobs + timedOutJobs + cancelledJobs;
    }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, queued=%d, running=%d, ok=%d, fail=%d, timeout=%d, cancelled=%d}",
            totalJobs, queuedJobs, runningJobs, okJobs, failedJobs, timedOutJobs, cancelledJobs
        );
    }
}
