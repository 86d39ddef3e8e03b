package com.lyshra.open.template.integration.models.version.migration;

import com.lyshra.open.template.integration.document.TemplateDocument;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of restoring a template from a backup snapshot.
 * Restore failures are reported here and never thrown.
 */
@Data
@Builder
public class RollbackResult {

    private final boolean success;
    private final Path backupPath;
    private final TemplateDocument template;
    private final String error;

    public Optional<TemplateDocument> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public static RollbackResult success(Path backupPath, TemplateDocument template) {
        return RollbackResult.builder()
                .success(true)
                .backupPath(backupPath)
                .template(template)
                .build();
    }

    public static RollbackResult failed(Path backupPath, String error) {
        return RollbackResult.builder()
                .success(false)
                .backupPath(backupPath)
                .error("Rollback failed: " + error)
                .build();
    }
}
