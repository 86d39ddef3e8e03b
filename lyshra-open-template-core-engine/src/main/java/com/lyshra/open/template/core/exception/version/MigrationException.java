package com.lyshra.open.template.core.exception.version;

import com.lyshra.open.template.core.exception.codes.TemplateVersionErrorCodes;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Exception thrown when a template migration cannot be carried out.
 *
 * <p>Raised for a strict-mode step failure (with the 1-based step number and step ID), for a
 * missing migration path, for a template with no registered version, and for a backup that
 * could not be written. Any backup taken before the failure is left in place and reported
 * through {@link #getBackupPath()}.</p>
 */
public class MigrationException extends TemplateVersionException {

    private final Integer stepNumber;
    private final String stepId;
    private final List<String> stepErrors;
    private final Path backupPath;

    public MigrationException(String message, String templateId) {
        this(message, templateId, null, null, List.of(), null, null);
    }

    public MigrationException(String message, TemplateVersionErrorCodes errorCode, String templateId) {
        super(message, errorCode, templateId);
        this.stepNumber = null;
        this.stepId = null;
        this.stepErrors = List.of();
        this.backupPath = null;
    }

    public MigrationException(String message, String templateId, Path backupPath, Throwable cause) {
        this(message, templateId, null, null, List.of(), backupPath, cause);
    }

    public MigrationException(
            String message,
            String templateId,
            Integer stepNumber,
            String stepId,
            List<String> stepErrors,
            Path backupPath,
            Throwable cause) {
        super(message, TemplateVersionErrorCodes.MIGRATION_FAILED, templateId, cause);
        this.stepNumber = stepNumber;
        this.stepId = stepId;
        this.stepErrors = stepErrors == null ? List.of() : List.copyOf(stepErrors);
        this.backupPath = backupPath;
    }

    public Optional<Integer> getStepNumber() {
        return Optional.ofNullable(stepNumber);
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public List<String> getStepErrors() {
        return stepErrors;
    }

    public Optional<Path> getBackupPath() {
        return Optional.ofNullable(backupPath);
    }
}
