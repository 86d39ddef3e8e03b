package com.lyshra.open.template.core.engine.version.impl;

import com.lyshra.open.template.core.engine.version.ITemplateCompatibilityService;
import com.lyshra.open.template.core.engine.version.ITemplateVersionRegistry;
import com.lyshra.open.template.core.engine.version.ITemplateVersioningFacade;
import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.core.engine.version.migration.IMigrationExecutor;
import com.lyshra.open.template.core.engine.version.migration.IMigrationPathfinder;
import com.lyshra.open.template.core.engine.version.migration.IMigrationRegistry;
import com.lyshra.open.template.core.engine.version.migration.backup.FileMigrationBackupServiceImpl;
import com.lyshra.open.template.core.engine.version.migration.backup.IMigrationBackupService;
import com.lyshra.open.template.core.engine.version.migration.impl.MigrationExecutorImpl;
import com.lyshra.open.template.core.engine.version.migration.impl.MigrationPathfinderImpl;
import com.lyshra.open.template.core.engine.version.migration.impl.MigrationRegistryImpl;
import com.lyshra.open.template.core.engine.version.resolution.IVersionConstraintResolver;
import com.lyshra.open.template.core.engine.version.resolution.impl.VersionConstraintResolverImpl;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import com.lyshra.open.template.integration.models.version.migration.MigrationResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of the template versioning facade.
 * Each instance owns its own registries.
 */
@Slf4j
public class TemplateVersioningFacadeImpl implements ITemplateVersioningFacade {

    private final TemplateVersioningOptions options;
    private final ITemplateVersionRegistry versionRegistry;
    private final ITemplateCompatibilityService compatibilityService;
    private final IVersionConstraintResolver constraintResolver;
    private final IMigrationRegistry migrationRegistry;
    private final IMigrationPathfinder pathfinder;
    private final IMigrationBackupService backupService;
    private final IMigrationExecutor migrationExecutor;

    public TemplateVersioningFacadeImpl() {
        this(TemplateVersioningOptions.load());
    }

    public TemplateVersioningFacadeImpl(TemplateVersioningOptions options) {
        this.options = options;
        this.versionRegistry = new TemplateVersionRegistryImpl(options);
        this.compatibilityService = new TemplateCompatibilityServiceImpl();
        this.constraintResolver = new VersionConstraintResolverImpl(versionRegistry, options);
        this.migrationRegistry = new MigrationRegistryImpl();
        this.pathfinder = new MigrationPathfinderImpl(migrationRegistry);
        this.backupService = new FileMigrationBackupServiceImpl(options);
        this.migrationExecutor = new MigrationExecutorImpl(versionRegistry, pathfinder, backupService, options);
        log.info("Template Versioning Facade initialized with {}", options);
    }

    @Override
    public TemplateVersioningOptions getOptions() {
        return options;
    }

    @Override
    public ITemplateVersionRegistry getVersionRegistry() {
        return versionRegistry;
    }

    @Override
    public ITemplateCompatibilityService getCompatibilityService() {
        return compatibilityService;
    }

    @Override
    public IVersionConstraintResolver getConstraintResolver() {
        return constraintResolver;
    }

    @Override
    public IMigrationRegistry getMigrationRegistry() {
        return migrationRegistry;
    }

    @Override
    public IMigrationPathfinder getPathfinder() {
        return pathfinder;
    }

    @Override
    public IMigrationBackupService getBackupService() {
        return backupService;
    }

    @Override
    public IMigrationExecutor getMigrationExecutor() {
        return migrationExecutor;
    }

    @Override
    public ValidationResult registerMigration(String templateId, IMigrationScript script) {
        ValidationResult validation = migrationExecutor.validateMigration(script);
        if (validation.isValid()) {
            migrationRegistry.register(templateId, script);
        } else {
            log.warn("Rejected migration [{}] for template [{}]: {}", script.getId(), templateId, validation.getErrors());
        }
        return validation;
    }

    @Override
    public Mono<IMigrationResult> prepareTemplate(
            String templateId, TemplateDocument template, ISemanticVersion currentVersion, Path backupDir) {
        if (options.isAutoMigrate()) {
            return migrationExecutor.autoMigrate(templateId, template, currentVersion, backupDir);
        }

        return Mono.fromSupplier(() -> {
            Optional<ISemanticVersion> latest = versionRegistry.getLatestVersion(templateId, false);
            if (latest.isPresent() && currentVersion.compareTo(latest.get()) < 0) {
                String warning = "Template " + templateId + " is at " + currentVersion.toVersionString()
                        + " but " + latest.get().toVersionString() + " is available; auto-migration is disabled";
                return MigrationResult.successWithWarnings(template, List.of(warning));
            }
            return MigrationResult.success(template);
        });
    }
}
