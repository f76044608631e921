package com.arccatalog.service.backup;

import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.CatalogLogger;
import com.arccatalog.util.FileUtils;
import com.arccatalog.util.PartFiles;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Unpacks a backup archive (or a part sequence) into a target directory and hands back the
 * catalog payload. The catalog itself is not touched here; importing the payload is up to the caller.
 */
public class RestoreService {
    private static final String CONTEXT = "RestoreService";
    private static final String DATABASE_DIR = "_database";
    static final String EXTRACT_PREFIX = "arc_restore_";
    static final String MERGED_PREFIX = "arc_merged_";

    private final CatalogConfig config;
    private final ArchiveOperationLock lock;

    public RestoreService(CatalogConfig config, ArchiveOperationLock lock) {
        this.config = config;
        this.lock = lock;
    }

    public RestoreResult restoreBackup(Path archive, Path targetDir) throws BackupException {
        return restoreBackup(archive, targetDir, new ProgressChannel<>(1));
    }

    /**
     * Merges split archives and extracts into the configured temp directory, then copies every file
     * except the {@code _database} folder into {@code targetDir}, overwriting existing files.
     * Temporary data (extraction directory, merged archive) is removed on success and on failure.
     *
     * @param archive A single archive or any part of a split archive
     * @throws BackupException if the archive is missing, malformed, escapes the extraction directory,
     *                         the part sequence is incomplete, or copying fails
     */
    public RestoreResult restoreBackup(Path archive, Path targetDir, ProgressChannel<BackupProgress> progress)
            throws BackupException {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new BackupException("Archive not found: " + archive);
        }

        try (ArchiveOperationLock.Permit permit = lock.acquire("restore from " + archive.getFileName())) {
            CatalogLogger.logInfo(config.getLogDirectory(), CONTEXT, "Restoring " + archive + " into " + targetDir);

            Path mergedArchive = null;
            Path extractDir = null;
            try {
                Files.createDirectories(config.getTempDirectory());
                Path zipPath = archive;
                if (PartFiles.isPartFile(archive)) {
                    progress.publish(new BackupProgress(BackupProgress.Phase.MERGING, 0, 0));
                    mergedArchive = Files.createTempFile(config.getTempDirectory(), MERGED_PREFIX, ".zip");
                    mergeParts(archive, mergedArchive);
                    zipPath = mergedArchive;
                }

                extractDir = Files.createTempDirectory(config.getTempDirectory(), EXTRACT_PREFIX);
                extract(zipPath, extractDir, progress);

                String serializedStore = null;
                Path databaseFile = extractDir.resolve(DATABASE_DIR).resolve("arc_database.json");
                if (Files.isRegularFile(databaseFile)) {
                    serializedStore = Files.readString(databaseFile, StandardCharsets.UTF_8);
                } else {
                    CatalogLogger.logWarning(config.getLogDirectory(), CONTEXT, "Archive contains no catalog payload: " + archive);
                }

                Files.createDirectories(targetDir);
                FileUtils.TreeSize copied = copyTree(extractDir, targetDir, progress);

                progress.publish(new BackupProgress(BackupProgress.Phase.DONE, copied.getBytes(), copied.getBytes()));
                CatalogLogger.logInfo(config.getLogDirectory(), CONTEXT,
                        "Restore finished: " + copied.getFiles() + " files, " + copied.getBytes() + " bytes");
                return new RestoreResult(true, serializedStore, copied.getFiles(), copied.getBytes());
            } catch (IOException e) {
                CatalogLogger.logError(config.getLogDirectory(), CONTEXT, "Restore failed", e);
                throw new BackupException("Restore failed: " + e.getMessage(), e);
            } finally {
                cleanup(extractDir, mergedArchive);
            }
        }
    }

    private void mergeParts(Path part, Path target) throws BackupException {
        try {
            PartFiles.merge(part, target);
        } catch (IOException e) {
            throw new BackupException("Cannot merge archive parts: " + e.getMessage(), e);
        }
    }

    private void extract(Path zipPath, Path extractDir, ProgressChannel<BackupProgress> progress)
            throws IOException, BackupException {
        Path root = extractDir.toAbsolutePath().normalize();
        long total = Files.size(zipPath);

        try (ZipFile zipFile = ZipFile.builder().setFile(zipPath.toFile()).get()) {
            long processed = 0;
            Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root) || target.equals(root)) {
                    throw new BackupException("Archive entry escapes the extraction directory: " + entry.getName());
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                if (entry.getLastModifiedDate() != null) {
                    Files.setLastModifiedTime(target, FileTime.fromMillis(entry.getLastModifiedDate().getTime()));
                }
                processed += Math.max(0, entry.getCompressedSize());
                progress.publish(new BackupProgress(BackupProgress.Phase.EXTRACTING, Math.min(processed, total), total));
            }
        }
    }

    private FileUtils.TreeSize copyTree(Path source, Path targetDir, ProgressChannel<BackupProgress> progress) throws IOException {
        Path databaseDir = source.resolve(DATABASE_DIR);
        List<Path> files;
        try (Stream<Path> walk = Files.walk(source)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> !p.startsWith(databaseDir))
                    .sorted()
                    .collect(Collectors.toList());
        }
        long total = 0;
        for (Path file : files) {
            total += Files.size(file);
        }

        long copiedBytes = 0;
        for (Path file : files) {
            Path destination = targetDir.resolve(source.relativize(file));
            Files.createDirectories(destination.getParent());
            Files.copy(file, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            copiedBytes += Files.size(file);
            progress.publish(new BackupProgress(BackupProgress.Phase.COPYING, copiedBytes, total));
        }
        return FileUtils.TreeSize.of(copiedBytes, files.size());
    }

    private void cleanup(Path extractDir, Path mergedArchive) {
        try {
            FileUtils.deleteRecursively(extractDir);
        } catch (IOException e) {
            CatalogLogger.logWarning(config.getLogDirectory(), CONTEXT, "Could not delete temporary directory " + extractDir + ": " + e.getMessage());
        }
        if (mergedArchive != null) {
            try {
                Files.deleteIfExists(mergedArchive);
            } catch (IOException e) {
                CatalogLogger.logWarning(config.getLogDirectory(), CONTEXT, "Could not delete merged archive " + mergedArchive + ": " + e.getMessage());
            }
        }
    }
}
