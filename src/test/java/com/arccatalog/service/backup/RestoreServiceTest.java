package com.arccatalog.service.backup;

import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.PartFiles;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RestoreServiceTest {

    @TempDir
    Path tempDir;

    private Path workingDir;
    private Path restoreDir;
    private CatalogConfig config;
    private BackupService backupService;
    private RestoreService restoreService;

    @BeforeEach
    void setUp() throws IOException {
        workingDir = Files.createDirectories(tempDir.resolve("work"));
        restoreDir = tempDir.resolve("restored");
        config = CatalogConfig.forDirectories(workingDir, tempDir.resolve("app"));
        ArchiveOperationLock lock = new ArchiveOperationLock();
        backupService = new BackupService(config, lock);
        restoreService = new RestoreService(config, lock);

        Files.createDirectories(workingDir.resolve("2024/05/17"));
        Files.createDirectories(workingDir.resolve("_cache/thumbs"));
        Files.write(workingDir.resolve("2024/05/17/photo.jpg"), new byte[]{(byte) 0xFF, (byte) 0xD8, 1, 2, 3});
        Files.writeString(workingDir.resolve("_cache/thumbs/photo.jpg"), "thumb");
        Files.writeString(workingDir.resolve("notes.txt"), "hello");
    }

    @Test
    void testRestore_RoundTrip_FilesAreByteIdentical() throws Exception {
        // Arrange
        Path archive = tempDir.resolve("backup.zip");
        backupService.createBackup(archive, workingDir, 1, "{\"version\":\"1.0\"}");

        // Act
        RestoreResult result = restoreService.restoreBackup(archive, restoreDir);

        // Assert
        assertTrue(result.isSuccess());
        assertEquals("{\"version\":\"1.0\"}", result.getSerializedStore().orElseThrow());
        assertEquals(3, result.getRestoredFiles());
        assertEquals(relativeFiles(workingDir), relativeFiles(restoreDir));
        for (Path relative : relativeFiles(workingDir)) {
            assertArrayEquals(Files.readAllBytes(workingDir.resolve(relative)), Files.readAllBytes(restoreDir.resolve(relative)));
        }
        assertFalse(Files.exists(restoreDir.resolve("_database")), "The catalog payload is not copied as a file");
    }

    @Test
    void testRestore_FromAnyPart_MergesSequence() throws Exception {
        Path archive = tempDir.resolve("media/split.zip");
        BackupResult backup = backupService.createBackup(archive, workingDir, 3, "{}");
        Path middlePart = backup.getOutputFiles().get(1);

        RestoreResult result = restoreService.restoreBackup(middlePart, restoreDir);

        assertEquals(3, result.getRestoredFiles());
        assertEquals("hello", Files.readString(restoreDir.resolve("notes.txt")));
        for (Path part : backup.getOutputFiles()) {
            assertTrue(Files.exists(part), "Parts are kept");
        }
        try (Stream<Path> siblings = Files.list(middlePart.getParent())) {
            assertTrue(siblings.allMatch(p -> PartFiles.isPartFile(p) || p.equals(BackupService.manifestPath(archive))),
                    "Nothing is written next to the parts");
        }
        assertNoRestoreDirectoriesLeft();
    }

    @Test
    void testRestore_MissingPart_Throws() throws Exception {
        Path archive = tempDir.resolve("split.zip");
        BackupResult backup = backupService.createBackup(archive, workingDir, 3, "{}");
        Files.delete(backup.getOutputFiles().get(1));

        BackupException e = assertThrows(BackupException.class,
                () -> restoreService.restoreBackup(backup.getOutputFiles().get(0), restoreDir));

        assertTrue(e.getMessage().startsWith("Cannot merge archive parts"));
        assertFalse(Files.exists(restoreDir));
        assertNoRestoreDirectoriesLeft();
    }

    @Test
    void testRestore_OverwritesExistingFiles() throws Exception {
        Path archive = tempDir.resolve("backup.zip");
        backupService.createBackup(archive, workingDir, 1, "{}");
        Files.createDirectories(restoreDir);
        Files.writeString(restoreDir.resolve("notes.txt"), "stale");
        Files.writeString(restoreDir.resolve("unrelated.txt"), "keep");

        restoreService.restoreBackup(archive, restoreDir);

        assertEquals("hello", Files.readString(restoreDir.resolve("notes.txt")));
        assertEquals("keep", Files.readString(restoreDir.resolve("unrelated.txt")));
    }

    @Test
    void testRestore_ArchiveWithoutPayload_RestoresFilesOnly() throws Exception {
        Path archive = tempDir.resolve("plain.zip");
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(archive.toFile())) {
            writeEntry(zos, "a/b.txt", "content");
            zos.finish();
        }

        RestoreResult result = restoreService.restoreBackup(archive, restoreDir);

        assertTrue(result.getSerializedStore().isEmpty());
        assertEquals("content", Files.readString(restoreDir.resolve("a/b.txt")));
    }

    @Test
    void testRestore_NestedDatabaseFolderIsCopied() throws Exception {
        Path archive = tempDir.resolve("nested.zip");
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(archive.toFile())) {
            writeEntry(zos, BackupService.DATABASE_ENTRY, "{}");
            writeEntry(zos, "project/_database/data.txt", "user file");
            zos.finish();
        }

        restoreService.restoreBackup(archive, restoreDir);

        assertEquals("user file", Files.readString(restoreDir.resolve("project/_database/data.txt")));
        assertFalse(Files.exists(restoreDir.resolve("_database")));
    }

    @Test
    void testRestore_EntryEscapingTarget_Throws() throws Exception {
        Path archive = tempDir.resolve("evil.zip");
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(archive.toFile())) {
            writeEntry(zos, "../../evil.txt", "pwned");
            zos.finish();
        }

        BackupException e = assertThrows(BackupException.class, () -> restoreService.restoreBackup(archive, restoreDir));

        assertTrue(e.getMessage().contains("escapes"));
        assertFalse(Files.exists(tempDir.resolve("evil.txt")));
        assertNoRestoreDirectoriesLeft();
    }

    @Test
    void testRestore_CorruptArchive_ThrowsAndCleansUp() throws Exception {
        Path archive = tempDir.resolve("corrupt.zip");
        Files.writeString(archive, "this is not a zip archive");

        assertThrows(BackupException.class, () -> restoreService.restoreBackup(archive, restoreDir));

        assertNoRestoreDirectoriesLeft();
    }

    @Test
    void testRestore_MissingArchive_Throws() {
        assertThrows(BackupException.class,
                () -> restoreService.restoreBackup(tempDir.resolve("absent.zip"), restoreDir));
    }

    @Test
    void testRestore_TemporaryDirectoryRemovedAfterSuccess() throws Exception {
        Path archive = tempDir.resolve("backup.zip");
        backupService.createBackup(archive, workingDir, 1, "{}");
        ProgressChannel<BackupProgress> progress = new ProgressChannel<>(1024);

        restoreService.restoreBackup(archive, restoreDir, progress);

        assertNoRestoreDirectoriesLeft();
        List<BackupProgress> events = progress.drain();
        assertEquals(BackupProgress.Phase.DONE, events.get(events.size() - 1).getPhase());
        assertTrue(events.stream().anyMatch(e -> e.getPhase() == BackupProgress.Phase.COPYING));
    }

    private void assertNoRestoreDirectoriesLeft() throws IOException {
        if (!Files.exists(config.getTempDirectory())) {
            return;
        }
        try (Stream<Path> entries = Files.list(config.getTempDirectory())) {
            assertEquals(0, entries.filter(p -> p.getFileName().toString().startsWith(RestoreService.EXTRACT_PREFIX)
                    || p.getFileName().toString().startsWith(RestoreService.MERGED_PREFIX)).count());
        }
    }

    private static void writeEntry(ZipArchiveOutputStream zos, String name, String content) throws IOException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        ZipArchiveEntry entry = new ZipArchiveEntry(name);
        entry.setSize(bytes.length);
        zos.putArchiveEntry(entry);
        zos.write(bytes);
        zos.closeArchiveEntry();
    }

    private static List<Path> relativeFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
