package com.arccatalog.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Manages application settings stored in {@code settings.json} of the application directory.
 * Uses Jackson for JSON serialization/deserialization.
 * The values are turned into an immutable {@link CatalogConfig} for the rest of the application.
 */
public class SettingsManager {

    public static final String APP_DIR = ".arc";
    public static final String SETTINGS_FILE = "settings.json";

    private static final String KEY_WORKING_DIR = "working_directory";
    private static final String KEY_TEMP_DIR = "temp_directory";
    private static final String KEY_BACKUP_PARTS = "backup_parts";
    private static final String KEY_LAST_BACKUP = "last_backup";

    private final Path settingsFile;
    private final ObjectMapper mapper;
    private ObjectNode rootNode;

    public SettingsManager(Path settingsFile) {
        this.settingsFile = settingsFile;
        this.mapper = CatalogJson.newMapper();
        loadSettings();
    }

    private void loadSettings() {
        if (Files.exists(settingsFile)) {
            try {
                JsonNode node = mapper.readTree(settingsFile.toFile());
                if (node instanceof ObjectNode) {
                    rootNode = (ObjectNode) node;
                    return;
                }
                System.err.println("Ignoring malformed settings file: " + settingsFile);
            } catch (IOException e) {
                System.err.println("Could not read settings file " + settingsFile + ": " + e.getMessage());
            }
        }
        rootNode = mapper.createObjectNode();
    }

    public Optional<Path> getWorkingDirectory() {
        return getPath(KEY_WORKING_DIR);
    }

    public void setWorkingDirectory(Path workingDirectory) {
        rootNode.put(KEY_WORKING_DIR, workingDirectory.toAbsolutePath().toString());
        saveSettings();
    }

    public Optional<Path> getTempDirectory() {
        return getPath(KEY_TEMP_DIR);
    }

    public void setTempDirectory(Path tempDirectory) {
        rootNode.put(KEY_TEMP_DIR, tempDirectory.toAbsolutePath().toString());
        saveSettings();
    }

    public int getBackupParts() {
        if (rootNode.has(KEY_BACKUP_PARTS)) {
            return Math.max(1, rootNode.get(KEY_BACKUP_PARTS).asInt(1));
        }
        return 1;
    }

    public void setBackupParts(int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("Backup part count must be at least 1: " + parts);
        }
        rootNode.put(KEY_BACKUP_PARTS, parts);
        saveSettings();
    }

    public Optional<LocalDateTime> getLastBackup() {
        if (rootNode.hasNonNull(KEY_LAST_BACKUP)) {
            return Optional.of(LocalDateTime.parse(rootNode.get(KEY_LAST_BACKUP).asText()));
        }
        return Optional.empty();
    }

    public void setLastBackup(LocalDateTime date) {
        rootNode.put(KEY_LAST_BACKUP, date.toString());
        saveSettings();
    }

    /**
     * Builds the runtime configuration.
     *
     * @param appDirectory Directory holding the database, logs and default temp area
     * @throws IllegalStateException if no working directory has been chosen yet
     */
    public CatalogConfig toConfig(Path appDirectory) {
        Path workingDir = getWorkingDirectory()
                .orElseThrow(() -> new IllegalStateException("No working directory configured"));
        Path tempDir = getTempDirectory().orElse(appDirectory.resolve("tmp"));
        return new CatalogConfig(
                workingDir,
                tempDir,
                appDirectory.resolve("logs"),
                appDirectory.resolve(CatalogConfig.DB_NAME),
                getBackupParts()
        );
    }

    private Optional<Path> getPath(String key) {
        if (rootNode.hasNonNull(key)) {
            return Optional.of(Path.of(rootNode.get(key).asText()));
        }
        return Optional.empty();
    }

    private void saveSettings() {
        try {
            Path parent = settingsFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), rootNode);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write settings file " + settingsFile, e);
        }
    }
}
