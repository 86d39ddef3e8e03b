package com.lyshra.open.template.integration.models.version.migration;

import com.lyshra.open.template.integration.contract.version.migration.IMigrationResult;
import com.lyshra.open.template.integration.contract.version.migration.IRollbackFunction;
import com.lyshra.open.template.integration.document.TemplateDocument;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Factory for migration scripts built from a plain document transformation.
 *
 * <p>The transformation's error signal, or an exception it throws, is turned into an
 * unsuccessful {@link IMigrationResult}, so the executor sees a reported failure rather than
 * an error. A script is reversible exactly when a rollback function is supplied.</p>
 */
public final class MigrationScripts {

    private MigrationScripts() {
        // Utility class
    }

    public static MigrationScript create(
            String id,
            String fromVersion,
            String toVersion,
            String description,
            Function<TemplateDocument, Mono<TemplateDocument>> transform) {
        return create(id, fromVersion, toVersion, description, transform, null, null);
    }

    /**
     * Creates a migration script.
     *
     * @param id                migration ID
     * @param fromVersion       source version string
     * @param toVersion         target version string
     * @param description       what the migration does
     * @param transform         document transformation
     * @param rollback          reverse transformation, may be null
     * @param estimatedDuration estimated duration, may be null
     * @return migration script
     */
    public static MigrationScript create(
            String id,
            String fromVersion,
            String toVersion,
            String description,
            Function<TemplateDocument, Mono<TemplateDocument>> transform,
            IRollbackFunction rollback,
            Duration estimatedDuration) {

        return MigrationScript.builder()
                .id(id)
                .fromVersion(SemanticVersion.parse(fromVersion))
                .toVersion(SemanticVersion.parse(toVersion))
                .description(description)
                .migrateFunction(template -> {
                    Instant startTime = Instant.now();
                    return Mono.defer(() -> transform.apply(template))
                            .<IMigrationResult>map(migrated -> MigrationResult.success(
                                    migrated, Duration.between(startTime, Instant.now())))
                            .switchIfEmpty(Mono.fromSupplier(() -> MigrationResult.failure(
                                    List.of("Migration " + id + " produced no template"),
                                    Duration.between(startTime, Instant.now()))))
                            .onErrorResume(error -> Mono.just(MigrationResult.failure(
                                    List.of(describe(error)), Duration.between(startTime, Instant.now()))));
                })
                .rollbackFunction(rollback)
                .estimatedDuration(estimatedDuration)
                .reversible(rollback != null)
                .build();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
