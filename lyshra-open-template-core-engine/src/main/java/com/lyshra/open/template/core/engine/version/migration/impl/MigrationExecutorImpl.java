package com.lyshra.open.template.core.engine.version.migration.impl;

import com.lyshra.open.template.core.engine.version.ITemplateVersionRegistry;
import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.core.engine.version.migration.IMigrationExecutor;
import com.lyshra.open.template.core.engine.version.migration.IMigrationPathfinder;
import com.lyshra.open.template.core.engine.version.migration.backup.IMigrationBackupService;
import com.lyshra.open.template.core.exception.codes.TemplateVersionErrorCodes;
import com.lyshra.open.template.core.exception.version.MigrationException;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import com.lyshra.open.template.integration.models.version.migration.MigrationResult;
import com.lyshra.open.template.integration.models.version.migration.RollbackResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of the template migration executor.
 * Handles backup, sequential step execution and failure accounting.
 */
@Slf4j
public class MigrationExecutorImpl implements IMigrationExecutor {

    public static final String ALREADY_AT_LATEST_WARNING = "Template is already at the latest version";

    private final ITemplateVersionRegistry versionRegistry;
    private final IMigrationPathfinder pathfinder;
    private final IMigrationBackupService backupService;
    private final TemplateVersioningOptions options;

    public MigrationExecutorImpl(
            ITemplateVersionRegistry versionRegistry,
            IMigrationPathfinder pathfinder,
            IMigrationBackupService backupService,
            TemplateVersioningOptions options) {
        this.versionRegistry = versionRegistry;
        this.pathfinder = pathfinder;
        this.backupService = backupService;
        this.options = options;
    }

    @Override
    public Mono<IMigrationResult> migrate(String templateId, TemplateDocument template, IMigrationPath path, Path backupDir) {
        return Mono.defer(() -> {
            Instant startTime = Instant.now();
            log.info("Starting migration of template [{}] from [{}] to [{}] in [{}] steps",
                    templateId, path.getFrom().toVersionString(), path.getTo().toVersionString(), path.getStepCount());

            return createBackupIfEnabled(templateId, template, backupDir)
                    .flatMap(backupPath -> runSteps(templateId, new MigrationRun(template, backupPath.orElse(null)), path))
                    .map(run -> buildResult(templateId, run, startTime));
        });
    }

    private Mono<Optional<Path>> createBackupIfEnabled(String templateId, TemplateDocument template, Path backupDir) {
        if (!options.isCreateBackups() || backupDir == null) {
            return Mono.just(Optional.empty());
        }
        return backupService.createBackup(templateId, template, backupDir)
                .onErrorMap(error -> new MigrationException(
                        "Migration failed: " + describe(error), templateId, null, error))
                .flatMap(result -> {
                    if (!result.success()) {
                        return Mono.error(new MigrationException(
                                "Migration failed: could not create backup: " + result.errorMessage().orElse("unknown error"),
                                templateId));
                    }
                    return Mono.just(result.backupPath());
                });
    }

    private Mono<MigrationRun> runSteps(String templateId, MigrationRun run, IMigrationPath path) {
        List<IMigrationScript> steps = path.getSteps();
        return Flux.range(0, steps.size())
                .concatMap(index -> executeStep(templateId, run, steps.get(index), index + 1, steps.size()))
                .then(Mono.just(run));
    }

    private Mono<MigrationRun> executeStep(
            String templateId, MigrationRun run, IMigrationScript step, int stepNumber, int totalSteps) {
        return Mono.defer(() -> {
            Instant stepStart = Instant.now();
            return invoke(step, run.current)
                    .map(StepOutcome::completed)
                    .switchIfEmpty(Mono.fromSupplier(() ->
                            StepOutcome.threw(new IllegalStateException("Migration produced no result"))))
                    .onErrorResume(error -> Mono.just(StepOutcome.threw(error)))
                    .flatMap(outcome -> outcome.error() != null
                            ? handleThrown(templateId, run, step, stepNumber, outcome.error())
                            : handleCompleted(templateId, run, step, stepNumber, totalSteps, outcome.result(), stepStart));
        });
    }

    private static Mono<IMigrationResult> invoke(IMigrationScript step, TemplateDocument template) {
        if (step.getMigrateFunction() == null) {
            return Mono.error(new IllegalStateException("Migration " + step.getId() + " has no migrate function"));
        }
        return Mono.defer(() -> step.migrate(template));
    }

    private Mono<MigrationRun> handleCompleted(
            String templateId,
            MigrationRun run,
            IMigrationScript step,
            int stepNumber,
            int totalSteps,
            IMigrationResult result,
            Instant stepStart) {

        if (!result.isSuccess()) {
            String message = "Migration step " + stepNumber + " (" + step.getId() + ") failed: "
                    + String.join(", ", result.getErrors());
            run.errors.add(message);
            log.warn("Template [{}]: {}", templateId, message);

            if (options.isStrict()) {
                return Mono.error(new MigrationException(
                        "Migration failed at step " + stepNumber + ": " + step.getId(),
                        templateId, stepNumber, step.getId(), result.getErrors(), run.backupPath, null));
            }
        }

        run.warnings.addAll(result.getWarnings());
        result.getMigratedTemplate().ifPresent(migrated -> run.current = migrated);

        log.info("Migration step {}/{} completed in {}ms",
                stepNumber, totalSteps, Duration.between(stepStart, Instant.now()).toMillis());
        return Mono.just(run);
    }

    private Mono<MigrationRun> handleThrown(
            String templateId, MigrationRun run, IMigrationScript step, int stepNumber, Throwable error) {
        String message = "Migration step " + stepNumber + " (" + step.getId() + ") threw error: " + describe(error);
        run.errors.add(message);
        log.warn("Template [{}]: {}", templateId, message, error);

        if (options.isStrict()) {
            return Mono.error(new MigrationException(
                    message, templateId, stepNumber, step.getId(), List.of(describe(error)), run.backupPath, error));
        }
        return Mono.just(run);
    }

    private IMigrationResult buildResult(String templateId, MigrationRun run, Instant startTime) {
        Duration executionTime = Duration.between(startTime, Instant.now());
        boolean success = run.errors.isEmpty();

        if (success) {
            log.info("Migrated template [{}] in {}ms", templateId, executionTime.toMillis());
        } else {
            log.warn("Migration of template [{}] finished with [{}] failed steps", templateId, run.errors.size());
        }

        return MigrationResult.builder()
                .success(success)
                .migratedTemplate(run.current)
                .errors(new ArrayList<>(run.errors))
                .warnings(new ArrayList<>(run.warnings))
                .executionTime(executionTime)
                .backupPath(run.backupPath)
                .build();
    }

    @Override
    public Mono<RollbackResult> rollback(Path backupPath) {
        return backupService.restoreBackup(backupPath)
                .doOnNext(result -> {
                    if (!result.isSuccess()) {
                        log.warn("Rollback from [{}] failed: {}", backupPath, result.getError().orElse(""));
                    }
                });
    }

    @Override
    public Mono<IMigrationResult> autoMigrate(
            String templateId, TemplateDocument template, ISemanticVersion currentVersion, Path backupDir) {
        return Mono.defer(() -> {
            Optional<ISemanticVersion> latest = versionRegistry.getLatestVersion(templateId, false);
            if (latest.isEmpty()) {
                return Mono.error(new MigrationException(
                        "No versions registered for template: " + templateId,
                        TemplateVersionErrorCodes.VERSION_NOT_FOUND,
                        templateId));
            }

            ISemanticVersion target = latest.get();
            if (currentVersion.compareTo(target) == 0) {
                log.debug("Template [{}] already at latest version [{}]", templateId, target.toVersionString());
                return Mono.just(MigrationResult.successWithWarnings(template, List.of(ALREADY_AT_LATEST_WARNING)));
            }

            Optional<IMigrationPath> path = pathfinder.findMigrationPath(templateId, currentVersion, target);
            if (path.isEmpty()) {
                return Mono.error(new MigrationException(
                        "No migration path found from " + currentVersion.toVersionString()
                                + " to " + target.toVersionString(), templateId));
            }
            return migrate(templateId, template, path.get(), backupDir);
        });
    }

    @Override
    public ValidationResult validateMigration(IMigrationScript script) {
        List<String> errors = new ArrayList<>();
        ISemanticVersion from = script.getFromVersion();
        ISemanticVersion to = script.getToVersion();

        if (from == null || to == null) {
            errors.add("Migration must declare fromVersion and toVersion");
        } else {
            int comparison = from.compareTo(to);
            if (comparison == 0) {
                errors.add("Migration fromVersion and toVersion must be different");
            } else if (comparison > 0) {
                errors.add("Migration toVersion must be greater than fromVersion (no downgrades)");
            }
        }
        if (script.getMigrateFunction() == null) {
            errors.add("Migration must have a migrate function");
        }
        if (script.isReversible() && script.getRollbackFunction().isEmpty()) {
            errors.add("Reversible migrations must have a rollback function");
        }
        return ValidationResult.of(errors);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Mutable state of one run; steps execute strictly in sequence.
     */
    private static final class MigrationRun {
        private final Path backupPath;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private TemplateDocument current;

        private MigrationRun(TemplateDocument template, Path backupPath) {
            this.current = template;
            this.backupPath = backupPath;
        }
    }

    private record StepOutcome(IMigrationResult result, Throwable error) {

        static StepOutcome completed(IMigrationResult result) {
            return new StepOutcome(result, null);
        }

        static StepOutcome threw(Throwable error) {
            return new StepOutcome(null, error);
        }
    }
}
