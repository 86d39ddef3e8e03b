package com.lyshra.open.template.integration.models.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationFunction;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.contract.version.migration.IRollbackFunction;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Optional;

/**
 * Implementation of a migration step between two template versions.
 */
@Data
@Builder
public class MigrationScript implements IMigrationScript {

    private final String id;
    private final ISemanticVersion fromVersion;
    private final ISemanticVersion toVersion;
    @Builder.Default
    private final String description = "";
    private final IMigrationFunction migrateFunction;
    private final IRollbackFunction rollbackFunction;
    private final Duration estimatedDuration;
    private final boolean reversible;

    @Override
    public Optional<IRollbackFunction> getRollbackFunction() {
        return Optional.ofNullable(rollbackFunction);
    }

    @Override
    public Optional<Duration> getEstimatedDuration() {
        return Optional.ofNullable(estimatedDuration);
    }

    @Override
    public String toString() {
        return id + " (" + fromVersion + " -> " + toVersion + ")";
    }
}
