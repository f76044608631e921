package com.arccatalog.service.backup;

import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.CatalogJson;
import com.arccatalog.util.CatalogLogger;
import com.arccatalog.util.FileUtils;
import com.arccatalog.util.PartFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Packs the working directory and the serialized catalog into one ZIP archive,
 * optionally split into numbered parts.
 */
public class BackupService {
    private static final String CONTEXT = "BackupService";

    public static final String DATABASE_ENTRY = "_database/arc_database.json";
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int COMPRESSION_LEVEL = 9;
    static final String STAGING_PREFIX = ".arc_backup_";

    private final CatalogConfig config;
    private final ArchiveOperationLock lock;
    private final ObjectMapper mapper = CatalogJson.newMapper();

    public BackupService(CatalogConfig config, ArchiveOperationLock lock) {
        this.config = config;
        this.lock = lock;
    }

    public BackupResult createBackup(Path outputPath, Path workingDir, int partCount, String serializedStore)
            throws BackupException {
        return createBackup(outputPath, workingDir, partCount, serializedStore, new ProgressChannel<>(1));
    }

    /**
     * Writes the archive, parts and manifest into a staging directory next to {@code outputPath} and moves
     * them into place once all of them are complete. A failed run removes its staging directory and leaves
     * files from earlier backups untouched. A successful split backup deletes higher-numbered parts left by an
     * earlier backup of the same name.
     *
     * @param outputPath      Archive path; with {@code partCount > 1} the parts are created next to it
     * @param serializedStore Catalog payload stored as {@value #DATABASE_ENTRY}
     * @throws IllegalArgumentException if {@code partCount < 1}
     * @throws BackupException          if the working directory is unavailable, the output path is a directory,
     *                                  another archive operation is running, or writing fails
     */
    public BackupResult createBackup(Path outputPath, Path workingDir, int partCount, String serializedStore,
                                     ProgressChannel<BackupProgress> progress) throws BackupException {
        if (partCount < 1) {
            throw new IllegalArgumentException("Part count must be at least 1: " + partCount);
        }
        if (workingDir == null || !Files.isDirectory(workingDir) || !Files.isReadable(workingDir)) {
            throw new BackupException("Working directory unavailable: " + workingDir);
        }
        if (Files.isDirectory(outputPath)) {
            throw new BackupException("Output path is a directory: " + outputPath);
        }

        try (ArchiveOperationLock.Permit permit = lock.acquire("backup to " + outputPath.getFileName())) {
            long start = System.nanoTime();
            CatalogLogger.logInfo(config.getLogDirectory(), CONTEXT, "Creating backup of " + workingDir + " into " + outputPath);

            List<Path> files;
            FileUtils.TreeSize treeSize;
            try {
                treeSize = FileUtils.measureTree(workingDir);
                files = listFiles(workingDir);
            } catch (IOException e) {
                throw new BackupException("Working directory unavailable: " + workingDir, e);
            }

            Path outputDir = outputPath.toAbsolutePath().getParent();
            String base = PartFiles.baseName(outputPath.getFileName().toString());
            Path stagingDir = null;
            try {
                Files.createDirectories(outputDir);
                stagingDir = Files.createTempDirectory(outputDir, STAGING_PREFIX);
                Path stagedArchive = stagingDir.resolve(outputPath.getFileName());
                writeArchive(stagedArchive, workingDir, files, serializedStore, treeSize.getBytes(), progress);
                long archiveSize = Files.size(stagedArchive);

                List<Path> staged = new ArrayList<>();
                if (partCount > 1) {
                    progress.publish(new BackupProgress(BackupProgress.Phase.SPLITTING, 0, archiveSize));
                    staged.addAll(PartFiles.split(stagedArchive, partCount));
                } else {
                    staged.add(stagedArchive);
                }

                BackupManifest manifest = buildManifest(workingDir, archiveSize, files.size(), partCount, staged);
                Path stagedManifest = stagingDir.resolve(manifestPath(outputPath).getFileName());
                mapper.writerWithDefaultPrettyPrinter().writeValue(stagedManifest.toFile(), manifest);

                List<Path> toPublish = new ArrayList<>(staged);
                toPublish.add(stagedManifest);
                List<Path> published = moveIntoPlace(toPublish, outputDir);
                List<Path> outputs = new ArrayList<>(published.subList(0, staged.size()));
                if (partCount > 1) {
                    for (Path stale : PartFiles.deletePartsAfter(outputDir, base, partCount)) {
                        CatalogLogger.logInfo(config.getLogDirectory(), CONTEXT, "Deleted stale part " + stale);
                    }
                }

                progress.publish(new BackupProgress(BackupProgress.Phase.DONE, archiveSize, archiveSize));
                Duration duration = Duration.ofNanos(System.nanoTime() - start);
                CatalogLogger.logInfo(config.getLogDirectory(), CONTEXT, String.format(
                        "Backup finished: %d files, %d bytes, %d part(s) in %d ms",
                        files.size(), archiveSize, partCount, duration.toMillis()));
                return new BackupResult(archiveSize, files.size(), duration, manifest, outputs);
            } catch (IOException e) {
                CatalogLogger.logError(config.getLogDirectory(), CONTEXT, "Backup failed", e);
                throw new BackupException("Backup failed: " + e.getMessage(), e);
            } finally {
                deleteStaging(stagingDir);
            }
        }
    }

    private List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    private void writeArchive(Path outputPath, Path workingDir, List<Path> files, String serializedStore,
                              long totalBytes, ProgressChannel<BackupProgress> progress) throws IOException {
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(outputPath.toFile())) {
            zos.setEncoding("UTF-8");
            zos.setLevel(COMPRESSION_LEVEL);

            byte[] payload = serializedStore.getBytes(StandardCharsets.UTF_8);
            ZipArchiveEntry databaseEntry = new ZipArchiveEntry(DATABASE_ENTRY);
            databaseEntry.setSize(payload.length);
            zos.putArchiveEntry(databaseEntry);
            zos.write(payload);
            zos.closeArchiveEntry();

            byte[] buffer = new byte[BUFFER_SIZE];
            long processed = 0;
            for (Path file : files) {
                ZipArchiveEntry entry = new ZipArchiveEntry(file.toFile(), FileUtils.toEntryName(workingDir, file));
                zos.putArchiveEntry(entry);
                try (InputStream in = Files.newInputStream(file)) {
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        zos.write(buffer, 0, read);
                        processed += read;
                        progress.publish(new BackupProgress(BackupProgress.Phase.ARCHIVING, processed, totalBytes));
                    }
                }
                zos.closeArchiveEntry();
            }
            zos.finish();
        }
    }

    private BackupManifest buildManifest(Path workingDir, long archiveSize, int fileCount, int partCount, List<Path> outputs) {
        BackupManifest manifest = new BackupManifest();
        manifest.setDate(LocalDateTime.now());
        manifest.setWorkingDir(workingDir.toAbsolutePath().toString());
        manifest.setTotalSize(archiveSize);
        manifest.setFilesCount(fileCount);
        manifest.setParts(partCount);
        manifest.setArchiveName(outputs.get(0).getFileName().toString());
        manifest.setPartFiles(outputs.stream().map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        return manifest;
    }

    static Path manifestPath(Path outputPath) {
        String base = PartFiles.baseName(outputPath.getFileName().toString());
        return outputPath.toAbsolutePath().resolveSibling(base + ".manifest.json");
    }

    /**
     * Fails before moving anything if one of the destinations is a directory.
     */
    private List<Path> moveIntoPlace(List<Path> staged, Path outputDir) throws IOException {
        for (Path file : staged) {
            Path destination = outputDir.resolve(file.getFileName());
            if (Files.isDirectory(destination)) {
                throw new IOException("Output target is a directory: " + destination);
            }
        }
        List<Path> moved = new ArrayList<>(staged.size());
        for (Path file : staged) {
            moved.add(Files.move(file, outputDir.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING));
        }
        return moved;
    }

    private void deleteStaging(Path stagingDir) {
        try {
            FileUtils.deleteRecursively(stagingDir);
        } catch (IOException e) {
            CatalogLogger.logWarning(config.getLogDirectory(), CONTEXT, "Could not delete staging directory " + stagingDir + ": " + e.getMessage());
        }
    }
}
