package com.arccatalog.service.backup;

/**
 * Progress snapshot of a running archive operation.
 */
public final class BackupProgress {

    public enum Phase {
        ARCHIVING,
        SPLITTING,
        MERGING,
        EXTRACTING,
        COPYING,
        DONE
    }

    private final Phase phase;
    private final long processedBytes;
    private final long totalBytes;

    public BackupProgress(Phase phase, long processedBytes, long totalBytes) {
        this.phase = phase;
        this.processedBytes = processedBytes;
        this.totalBytes = totalBytes;
    }

    public Phase getPhase() { return phase; }
    public long getProcessedBytes() { return processedBytes; }
    public long getTotalBytes() { return totalBytes; }

    /**
     * Completion in percent, 100 when there is nothing to process.
     */
    public int getPercent() {
        if (totalBytes <= 0) {
            return 100;
        }
        return (int) Math.min(100, processedBytes * 100 / totalBytes);
    }

    @Override
    public String toString() {
        return phase + " " + getPercent() + "% (" + processedBytes + "/" + totalBytes + ")";
    }
}
