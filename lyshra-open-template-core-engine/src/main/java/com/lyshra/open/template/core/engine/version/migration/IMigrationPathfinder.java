package com.lyshra.open.template.core.engine.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;

import java.util.Optional;

/**
 * Finds chains of registered migrations between two versions of a template.
 */
public interface IMigrationPathfinder {

    /**
     * Walks forward from {@code from}, each time taking the first registered migration whose
     * source version equals the current version, until {@code to} is reached.
     *
     * <p>Returns empty when the template has no migrations, no migration leaves the current
     * version, a version is revisited, or the walk passes beyond {@code to}. When
     * {@code from} equals {@code to} the path has no steps.</p>
     *
     * @param templateId template ID
     * @param from       starting version
     * @param to         target version
     * @return migration path, or empty
     */
    Optional<IMigrationPath> findMigrationPath(String templateId, ISemanticVersion from, ISemanticVersion to);

    default boolean canMigrate(String templateId, ISemanticVersion from, ISemanticVersion to) {
        return findMigrationPath(templateId, from, to).isPresent();
    }
}
