package com.lyshra.open.template.core.engine.version;

import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.core.engine.version.migration.IMigrationExecutor;
import com.lyshra.open.template.core.engine.version.migration.IMigrationPathfinder;
import com.lyshra.open.template.core.engine.version.migration.IMigrationRegistry;
import com.lyshra.open.template.core.engine.version.migration.backup.IMigrationBackupService;
import com.lyshra.open.template.core.engine.version.resolution.IVersionConstraintResolver;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Facade for template versioning.
 * Provides access to every versioning component, all sharing one set of options.
 */
public interface ITemplateVersioningFacade {

    TemplateVersioningOptions getOptions();

    ITemplateVersionRegistry getVersionRegistry();

    ITemplateCompatibilityService getCompatibilityService();

    IVersionConstraintResolver getConstraintResolver();

    IMigrationRegistry getMigrationRegistry();

    IMigrationPathfinder getPathfinder();

    IMigrationBackupService getBackupService();

    IMigrationExecutor getMigrationExecutor();

    /**
     * Validates a migration script and registers it when valid.
     *
     * @param templateId template ID
     * @param script     migration script
     * @return validation outcome; invalid scripts are not registered
     */
    ValidationResult registerMigration(String templateId, IMigrationScript script);

    /**
     * Brings a loaded template up to date according to the auto-migrate option.
     *
     * <p>With auto-migration enabled this behaves like
     * {@link IMigrationExecutor#autoMigrate}. Otherwise the template is returned unchanged,
     * with a warning if a newer stable version is registered.</p>
     *
     * @param templateId     template ID
     * @param template       loaded template
     * @param currentVersion version the template is at
     * @param backupDir      directory for a pre-migration backup, or null for none
     * @return migration result
     */
    Mono<IMigrationResult> prepareTemplate(
            String templateId, TemplateDocument template, ISemanticVersion currentVersion, Path backupDir);
}
