package com.arccatalog.service.backup;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public final class BackupResult {
    private final long size;
    private final int fileCount;
    private final Duration duration;
    private final BackupManifest manifest;
    private final List<Path> outputFiles;

    public BackupResult(long size, int fileCount, Duration duration, BackupManifest manifest, List<Path> outputFiles) {
        this.size = size;
        this.fileCount = fileCount;
        this.duration = duration;
        this.manifest = manifest;
        this.outputFiles = List.copyOf(outputFiles);
    }

    /** Archive size in bytes, before any split. */
    public long getSize() { return size; }
    public int getFileCount() { return fileCount; }
    public Duration getDuration() { return duration; }
    public BackupManifest getManifest() { return manifest; }

    /** The single archive, or the part files in order. */
    public List<Path> getOutputFiles() { return outputFiles; }

    @Override
    public String toString() {
        return "BackupResult{size=" + size + ", fileCount=" + fileCount + ", duration=" + duration +
                ", outputs=" + outputFiles.size() + '}';
    }
}
