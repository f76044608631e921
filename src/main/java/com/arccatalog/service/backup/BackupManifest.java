package com.arccatalog.service.backup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Description of a finished backup, written next to the archive as {@code <base>.manifest.json}.
 * Informational only: restore never reads it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackupManifest {
    public static final String CURRENT_VERSION = "1.0";

    private String version = CURRENT_VERSION;
    private LocalDateTime date;
    private String workingDir;
    private long totalSize;      // Archive bytes before splitting
    private int filesCount;
    private int parts;
    private String archiveName;
    private List<String> partFiles = new ArrayList<>();

    public BackupManifest() {
    }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public LocalDateTime getDate() { return date; }
    public void setDate(LocalDateTime date) { this.date = date; }

    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }

    public long getTotalSize() { return totalSize; }
    public void setTotalSize(long totalSize) { this.totalSize = totalSize; }

    public int getFilesCount() { return filesCount; }
    public void setFilesCount(int filesCount) { this.filesCount = filesCount; }

    public int getParts() { return parts; }
    public void setParts(int parts) { this.parts = parts; }

    public String getArchiveName() { return archiveName; }
    public void setArchiveName(String archiveName) { this.archiveName = archiveName; }

    public List<String> getPartFiles() { return partFiles; }
    public void setPartFiles(List<String> partFiles) {
        this.partFiles = partFiles != null ? new ArrayList<>(partFiles) : new ArrayList<>();
    }
}
