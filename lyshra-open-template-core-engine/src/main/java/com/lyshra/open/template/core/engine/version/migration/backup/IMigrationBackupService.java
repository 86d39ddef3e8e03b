package com.lyshra.open.template.core.engine.version.migration.backup;

import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.migration.RollbackResult;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Service for snapshotting templates before migration and restoring them afterwards.
 *
 * <p>Backups are plain JSON files in a caller-supplied directory. A restore simply reads the
 * snapshot back; it does not run any migration in reverse.</p>
 */
public interface IMigrationBackupService {

    /**
     * Writes a backup of a template, creating the directory if needed.
     *
     * @param templateId template ID, used in the file name
     * @param template   template to snapshot
     * @param backupDir  directory to write to
     * @return backup result carrying the written file's path or the failure
     */
    Mono<BackupResult> createBackup(String templateId, TemplateDocument template, Path backupDir);

    /**
     * Reads a template back from a backup file.
     *
     * @param backupPath backup file
     * @return restore outcome; missing, oversized and malformed files are reported as failures
     */
    Mono<RollbackResult> restoreBackup(Path backupPath);

    // ==================== Records ====================

    /**
     * Result of a backup creation operation.
     */
    record BackupResult(
            String templateId,
            boolean success,
            Optional<Path> backupPath,
            long sizeBytes,
            Optional<String> errorMessage
    ) {
        public static BackupResult success(String templateId, Path backupPath, long sizeBytes) {
            return new BackupResult(templateId, true, Optional.of(backupPath), sizeBytes, Optional.empty());
        }

        public static BackupResult failed(String templateId, String error) {
            return new BackupResult(templateId, false, Optional.empty(), 0, Optional.of(error));
        }
    }
}
