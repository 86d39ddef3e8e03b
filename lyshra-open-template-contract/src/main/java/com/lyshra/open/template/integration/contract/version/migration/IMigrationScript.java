package com.lyshra.open.template.integration.contract.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.document.TemplateDocument;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * A single registered migration step, one edge of a template's migration graph.
 *
 * <p>Well-formedness is checked by validation rather than at construction:</p>
 * <ul>
 *   <li>from and to versions differ</li>
 *   <li>the target version is greater than the source version</li>
 *   <li>a migrate function is present</li>
 *   <li>reversible scripts declare a rollback function</li>
 * </ul>
 */
public interface IMigrationScript {

    /**
     * Returns the unique identifier of this migration.
     *
     * @return migration ID
     */
    String getId();

    /**
     * Returns the version this migration upgrades from.
     *
     * @return source version
     */
    ISemanticVersion getFromVersion();

    /**
     * Returns the version this migration upgrades to.
     *
     * @return target version
     */
    ISemanticVersion getToVersion();

    /**
     * Returns a description of what this migration does.
     *
     * @return description
     */
    String getDescription();

    /**
     * Returns the forward transformation.
     * May be null for a malformed script; validation reports it.
     *
     * @return migrate function
     */
    IMigrationFunction getMigrateFunction();

    /**
     * Returns the reverse transformation, if declared.
     *
     * @return rollback function
     */
    Optional<IRollbackFunction> getRollbackFunction();

    /**
     * Returns the estimated time this step takes.
     *
     * @return estimated duration if known
     */
    Optional<Duration> getEstimatedDuration();

    /**
     * Indicates whether this migration can be reversed.
     *
     * @return true if reversible
     */
    boolean isReversible();

    /**
     * Applies the forward transformation to the template.
     *
     * @param template template at {@link #getFromVersion()}
     * @return step outcome
     */
    default Mono<IMigrationResult> migrate(TemplateDocument template) {
        return getMigrateFunction().apply(template);
    }
}
