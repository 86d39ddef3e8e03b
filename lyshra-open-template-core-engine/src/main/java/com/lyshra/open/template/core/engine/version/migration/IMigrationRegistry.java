package com.lyshra.open.template.core.engine.version.migration;

import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;

import java.time.Duration;
import java.util.List;

/**
 * Registry of migration scripts per template, ordered ascending by source version.
 * Scripts with equal source versions keep their registration order.
 */
public interface IMigrationRegistry {

    /**
     * Registers a migration script for a template.
     *
     * @param templateId template ID
     * @param script     migration script
     */
    void register(String templateId, IMigrationScript script);

    /**
     * Gets the registered migrations of a template.
     *
     * @param templateId template ID
     * @return migrations in ascending source-version order, empty if none
     */
    List<IMigrationScript> getMigrations(String templateId);

    /**
     * Summarizes the migrations registered for a template.
     *
     * @param templateId template ID
     * @return statistics, all zero for an unknown template
     */
    MigrationStatistics getStatistics(String templateId);

    void clear();

    // ==================== Records ====================

    /**
     * Summary of the migrations registered for a template.
     */
    record MigrationStatistics(
            int totalMigrations,
            int reversibleCount,
            Duration averageDuration,
            List<VersionCoverage> versionCoverage
    ) {
        public static MigrationStatistics empty() {
            return new MigrationStatistics(0, 0, Duration.ZERO, List.of());
        }
    }

    /**
     * Source and target version strings covered by one migration.
     */
    record VersionCoverage(String from, String to) {
    }
}
