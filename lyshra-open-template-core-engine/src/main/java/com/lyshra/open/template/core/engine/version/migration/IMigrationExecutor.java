package com.lyshra.open.template.core.engine.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import com.lyshra.open.template.integration.models.version.migration.RollbackResult;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Executes migration paths against templates.
 *
 * <p>Steps run one at a time, each receiving the previous step's output. In strict mode the
 * first failing step aborts the run with a
 * {@link com.lyshra.open.template.core.exception.version.MigrationException}; otherwise failures
 * are collected and the run continues. A backup taken before the run is never restored
 * automatically.</p>
 */
public interface IMigrationExecutor {

    /**
     * Executes a migration path.
     *
     * @param templateId template ID
     * @param template   template to migrate
     * @param path       steps to run
     * @param backupDir  directory for a pre-migration backup, or null for none
     * @return migration result
     */
    Mono<IMigrationResult> migrate(String templateId, TemplateDocument template, IMigrationPath path, Path backupDir);

    default Mono<IMigrationResult> migrate(String templateId, TemplateDocument template, IMigrationPath path) {
        return migrate(templateId, template, path, null);
    }

    /**
     * Restores the template snapshot held in a backup file.
     *
     * @param backupPath backup file written by a previous migration
     * @return restore outcome
     */
    Mono<RollbackResult> rollback(Path backupPath);

    /**
     * Migrates a template to the latest stable registered version of its template.
     *
     * @param templateId     template ID
     * @param template       template to migrate
     * @param currentVersion version the template is at
     * @param backupDir      directory for a pre-migration backup, or null for none
     * @return migration result; a no-op success with a warning when already at the latest version
     */
    Mono<IMigrationResult> autoMigrate(
            String templateId, TemplateDocument template, ISemanticVersion currentVersion, Path backupDir);

    /**
     * Checks a migration script's declared versions and functions.
     *
     * @param script script to check
     * @return validation outcome
     */
    ValidationResult validateMigration(IMigrationScript script);
}
