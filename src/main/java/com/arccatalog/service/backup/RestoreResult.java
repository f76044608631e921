package com.arccatalog.service.backup;

import java.util.Optional;

public final class RestoreResult {
    private final boolean success;
    private final String serializedStore;
    private final int restoredFiles;
    private final long restoredBytes;

    public RestoreResult(boolean success, String serializedStore, int restoredFiles, long restoredBytes) {
        this.success = success;
        this.serializedStore = serializedStore;
        this.restoredFiles = restoredFiles;
        this.restoredBytes = restoredBytes;
    }

    public boolean isSuccess() { return success; }

    /**
     * The catalog payload found in the archive; empty for archives without one.
     */
    public Optional<String> getSerializedStore() { return Optional.ofNullable(serializedStore); }

    public int getRestoredFiles() { return restoredFiles; }
    public long getRestoredBytes() { return restoredBytes; }
}
