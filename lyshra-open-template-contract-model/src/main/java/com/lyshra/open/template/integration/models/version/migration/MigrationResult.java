package com.lyshra.open.template.integration.models.version.migration;

import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.document.TemplateDocument;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of a migration outcome.
 * Serves both as the result of a single step and of a whole migration path.
 */
@Data
@Builder(toBuilder = true)
public class MigrationResult implements IMigrationResult {

    private final boolean success;
    private final TemplateDocument migratedTemplate;
    @Builder.Default
    private final List<String> errors = new ArrayList<>();
    @Builder.Default
    private final List<String> warnings = new ArrayList<>();
    @Builder.Default
    private final Duration executionTime = Duration.ZERO;
    private final Path backupPath;

    @Override
    public Optional<TemplateDocument> getMigratedTemplate() {
        return Optional.ofNullable(migratedTemplate);
    }

    @Override
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public Optional<Path> getBackupPath() {
        return Optional.ofNullable(backupPath);
    }

    /**
     * Creates a successful result.
     */
    public static MigrationResult success(TemplateDocument migratedTemplate) {
        return success(migratedTemplate, Duration.ZERO);
    }

    public static MigrationResult success(TemplateDocument migratedTemplate, Duration executionTime) {
        return MigrationResult.builder()
                .success(true)
                .migratedTemplate(migratedTemplate)
                .executionTime(executionTime)
                .build();
    }

    /**
     * Creates a successful result carrying non-fatal warnings.
     */
    public static MigrationResult successWithWarnings(TemplateDocument migratedTemplate, List<String> warnings) {
        return MigrationResult.builder()
                .success(true)
                .migratedTemplate(migratedTemplate)
                .warnings(new ArrayList<>(warnings))
                .build();
    }

    /**
     * Creates a failed result.
     */
    public static MigrationResult failure(List<String> errors) {
        return failure(errors, Duration.ZERO);
    }

    public static MigrationResult failure(List<String> errors, Duration executionTime) {
        return MigrationResult.builder()
                .success(false)
                .errors(new ArrayList<>(errors))
                .executionTime(executionTime)
                .build();
    }
}
