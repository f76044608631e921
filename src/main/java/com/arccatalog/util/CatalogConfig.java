package com.arccatalog.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable runtime configuration handed to every component through its constructor.
 * Built by {@link SettingsManager#toConfig(Path)} or directly in tests.
 */
public final class CatalogConfig {
    public static final String DB_NAME = "arc_catalog.sqlite";

    private final Path workingDirectory;
    private final Path tempDirectory;
    private final Path logDirectory;
    private final Path databaseFile;
    private final int defaultBackupParts;

    public CatalogConfig(Path workingDirectory, Path tempDirectory, Path logDirectory,
                         Path databaseFile, int defaultBackupParts) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        this.tempDirectory = Objects.requireNonNull(tempDirectory, "Temp directory cannot be null");
        this.logDirectory = Objects.requireNonNull(logDirectory, "Log directory cannot be null");
        this.databaseFile = Objects.requireNonNull(databaseFile, "Database file cannot be null");
        if (defaultBackupParts < 1) {
            throw new IllegalArgumentException("Backup part count must be at least 1: " + defaultBackupParts);
        }
        this.defaultBackupParts = defaultBackupParts;
    }

    /**
     * Lays out temp, log and database locations under a single application directory.
     */
    public static CatalogConfig forDirectories(Path workingDirectory, Path appDirectory) {
        return new CatalogConfig(
                workingDirectory,
                appDirectory.resolve("tmp"),
                appDirectory.resolve("logs"),
                appDirectory.resolve(DB_NAME),
                1
        );
    }

    public Path getWorkingDirectory() { return workingDirectory; }
    public Path getTempDirectory() { return tempDirectory; }
    public Path getLogDirectory() { return logDirectory; }
    public Path getDatabaseFile() { return databaseFile; }
    public int getDefaultBackupParts() { return defaultBackupParts; }

    public CatalogConfig withWorkingDirectory(Path newWorkingDirectory) {
        return new CatalogConfig(newWorkingDirectory, tempDirectory, logDirectory, databaseFile, defaultBackupParts);
    }

    @Override
    public String toString() {
        return "CatalogConfig{" +
                "workingDirectory=" + workingDirectory +
                ", tempDirectory=" + tempDirectory +
                ", databaseFile=" + databaseFile +
                '}';
    }
}
