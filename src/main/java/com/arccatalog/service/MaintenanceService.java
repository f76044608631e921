package com.arccatalog.service;

import com.arccatalog.model.CatalogSnapshot;
import com.arccatalog.repository.EntityStore;
import com.arccatalog.service.backup.ArchiveOperationLock;
import com.arccatalog.service.backup.BackupException;
import com.arccatalog.service.backup.BackupProgress;
import com.arccatalog.service.backup.BackupResult;
import com.arccatalog.service.backup.BackupService;
import com.arccatalog.service.backup.CatalogSnapshotCodec;
import com.arccatalog.service.backup.ProgressChannel;
import com.arccatalog.service.backup.RestoreResult;
import com.arccatalog.service.backup.RestoreService;
import com.arccatalog.service.integrity.FileExistenceChecker;
import com.arccatalog.service.integrity.IntegrityReport;
import com.arccatalog.service.integrity.IntegrityRepairer;
import com.arccatalog.service.integrity.IntegrityValidator;
import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.CatalogLogger;
import com.arccatalog.util.SettingsManager;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Entry point for the rare, whole-catalog operations: backup, restore, integrity check and repair.
 * Connects the store with the archive services and the snapshot codec.
 */
public class MaintenanceService {
    private static final String CONTEXT = "MaintenanceService";

    private final CatalogConfig config;
    private final EntityStore store;
    private final SettingsManager settings;
    private final BackupService backupService;
    private final RestoreService restoreService;
    private final CatalogSnapshotCodec codec;
    private final IntegrityValidator validator;
    private final IntegrityRepairer repairer;

    public MaintenanceService(CatalogConfig config, EntityStore store, SettingsManager settings) {
        this(config, store, settings, FileExistenceChecker.local());
    }

    public MaintenanceService(CatalogConfig config, EntityStore store, SettingsManager settings,
                              FileExistenceChecker fileChecker) {
        ArchiveOperationLock lock = new ArchiveOperationLock();
        this.config = config;
        this.store = store;
        this.settings = settings;
        this.backupService = new BackupService(config, lock);
        this.restoreService = new RestoreService(config, lock);
        this.codec = new CatalogSnapshotCodec();
        this.validator = new IntegrityValidator(store, fileChecker, config.getLogDirectory());
        this.repairer = new IntegrityRepairer(store, config.getLogDirectory());
    }

    /**
     * Backs up the configured working directory with the configured part count.
     */
    public BackupResult backupCatalog(Path outputPath, ProgressChannel<BackupProgress> progress) throws BackupException {
        return backupCatalog(outputPath, config.getDefaultBackupParts(), progress);
    }

    public BackupResult backupCatalog(Path outputPath, int partCount, ProgressChannel<BackupProgress> progress)
            throws BackupException {
        CatalogSnapshot snapshot = store.exportSnapshot();
        String payload = codec.encode(snapshot);
        BackupResult result = backupService.createBackup(outputPath, config.getWorkingDirectory(), partCount, payload, progress);
        settings.setLastBackup(LocalDateTime.now());
        return result;
    }

    /**
     * Restores the files into {@code targetDir} and, when the archive carries a catalog payload,
     * replaces the catalog with it, rebasing card paths onto {@code targetDir}.
     *
     * @return the imported snapshot, empty for archives without a payload
     */
    public Optional<CatalogSnapshot> restoreCatalog(Path archive, Path targetDir, ProgressChannel<BackupProgress> progress)
            throws BackupException {
        RestoreResult result = restoreService.restoreBackup(archive, targetDir, progress);
        Optional<String> payload = result.getSerializedStore();
        if (payload.isEmpty()) {
            CatalogLogger.logWarning(config.getLogDirectory(), CONTEXT, "Restored files only, catalog left unchanged");
            return Optional.empty();
        }
        CatalogSnapshot snapshot = codec.decode(payload.get());
        store.importSnapshot(snapshot, targetDir);
        return Optional.of(snapshot);
    }

    public IntegrityReport checkIntegrity() {
        return validator.validate();
    }

    /**
     * Validates and repairs everything repairable.
     *
     * @return the number of fixed issues
     */
    public int repairIntegrity() {
        IntegrityReport report = validator.validate();
        return repairer.repair(report.getIssues());
    }
}
