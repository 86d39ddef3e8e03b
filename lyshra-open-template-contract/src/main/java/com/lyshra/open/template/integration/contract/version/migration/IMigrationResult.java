package com.lyshra.open.template.integration.contract.version.migration;

import com.lyshra.open.template.integration.document.TemplateDocument;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a migration step or of a whole migration path.
 *
 * <p>A successful result always carries the migrated template. A failed result carries at
 * least one error and, where one was produced, the partially migrated template.</p>
 */
public interface IMigrationResult {

    /**
     * Indicates whether the migration succeeded.
     *
     * @return true if no error was reported
     */
    boolean isSuccess();

    /**
     * Returns the migrated template.
     *
     * @return migrated template if one was produced
     */
    Optional<TemplateDocument> getMigratedTemplate();

    /**
     * Returns the errors encountered.
     *
     * @return errors, empty on success
     */
    List<String> getErrors();

    /**
     * Returns the non-fatal issues encountered.
     *
     * @return warnings
     */
    List<String> getWarnings();

    /**
     * Returns the time spent executing.
     *
     * @return execution time
     */
    Duration getExecutionTime();

    /**
     * Returns the backup written before the migration started.
     *
     * @return backup file if one was taken
     */
    Optional<Path> getBackupPath();
}
