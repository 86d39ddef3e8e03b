package com.lyshra.open.template.core.engine.version.migration.impl;

import com.lyshra.open.template.core.engine.version.migration.IMigrationPathfinder;
import com.lyshra.open.template.core.engine.version.migration.IMigrationRegistry;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.models.version.migration.MigrationPath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic forward walk over the migration registry.
 * When several migrations leave the same version, the first registered one is taken.
 */
@Slf4j
public class MigrationPathfinderImpl implements IMigrationPathfinder {

    private final IMigrationRegistry migrationRegistry;

    public MigrationPathfinderImpl(IMigrationRegistry migrationRegistry) {
        this.migrationRegistry = migrationRegistry;
    }

    @Override
    public Optional<IMigrationPath> findMigrationPath(String templateId, ISemanticVersion from, ISemanticVersion to) {
        List<IMigrationScript> migrations = migrationRegistry.getMigrations(templateId);
        if (migrations.isEmpty()) {
            log.debug("No migrations registered for template [{}]", templateId);
            return Optional.empty();
        }

        List<IMigrationScript> steps = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        ISemanticVersion current = from;

        while (current.compareTo(to) != 0) {
            // Build metadata is ignored by comparison, so key on the version without it
            String key = versionKey(current);
            if (!visited.add(key)) {
                log.debug("Cycle at [{}] while searching path [{}] -> [{}] for template [{}]",
                        key, from.toVersionString(), to.toVersionString(), templateId);
                return Optional.empty();
            }

            Optional<IMigrationScript> next = findFrom(migrations, current);
            if (next.isEmpty()) {
                log.debug("No migration leaves [{}] for template [{}]", current.toVersionString(), templateId);
                return Optional.empty();
            }

            steps.add(next.get());
            current = next.get().getToVersion();

            if (current.compareTo(to) > 0) {
                log.debug("Path for template [{}] overshoots [{}] at [{}]",
                        templateId, to.toVersionString(), current.toVersionString());
                return Optional.empty();
            }
        }

        log.debug("Found [{}]-step path [{}] -> [{}] for template [{}]",
                steps.size(), from.toVersionString(), to.toVersionString(), templateId);
        return Optional.of(MigrationPath.of(from, to, steps));
    }

    private static Optional<IMigrationScript> findFrom(List<IMigrationScript> migrations, ISemanticVersion version) {
        return migrations.stream()
                .filter(script -> script.getFromVersion().compareTo(version) == 0)
                .findFirst();
    }

    private static String versionKey(ISemanticVersion version) {
        return version.getMajor() + "." + version.getMinor() + "." + version.getPatch()
                + version.getPreRelease().map(pre -> "-" + pre).orElse("");
    }
}
