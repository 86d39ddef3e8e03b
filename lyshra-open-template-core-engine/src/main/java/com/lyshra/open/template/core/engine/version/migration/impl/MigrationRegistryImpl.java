package com.lyshra.open.template.core.engine.version.migration.impl;

import com.lyshra.open.template.core.engine.version.migration.IMigrationRegistry;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory migration registry.
 */
@Slf4j
public class MigrationRegistryImpl implements IMigrationRegistry {

    private static final Comparator<IMigrationScript> BY_FROM_VERSION =
            Comparator.comparing(IMigrationScript::getFromVersion);

    private final Map<String, List<IMigrationScript>> migrations = new LinkedHashMap<>();

    @Override
    public void register(String templateId, IMigrationScript script) {
        List<IMigrationScript> scripts = migrations.computeIfAbsent(templateId, k -> new ArrayList<>());
        scripts.add(script);
        scripts.sort(BY_FROM_VERSION);
        log.info("Registered migration [{}] for template [{}]: [{}] -> [{}]",
                script.getId(), templateId,
                script.getFromVersion().toVersionString(), script.getToVersion().toVersionString());
    }

    @Override
    public List<IMigrationScript> getMigrations(String templateId) {
        List<IMigrationScript> scripts = migrations.get(templateId);
        return scripts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(scripts));
    }

    @Override
    public MigrationStatistics getStatistics(String templateId) {
        List<IMigrationScript> scripts = getMigrations(templateId);
        if (scripts.isEmpty()) {
            return MigrationStatistics.empty();
        }

        int reversibleCount = (int) scripts.stream().filter(IMigrationScript::isReversible).count();
        Duration totalDuration = scripts.stream()
                .map(script -> script.getEstimatedDuration().orElse(Duration.ZERO))
                .reduce(Duration.ZERO, Duration::plus);
        List<VersionCoverage> coverage = scripts.stream()
                .map(script -> new VersionCoverage(
                        script.getFromVersion().toVersionString(), script.getToVersion().toVersionString()))
                .collect(Collectors.toList());

        return new MigrationStatistics(
                scripts.size(), reversibleCount, totalDuration.dividedBy(scripts.size()), coverage);
    }

    @Override
    public void clear() {
        migrations.clear();
        log.info("Cleared migration registry");
    }
}
