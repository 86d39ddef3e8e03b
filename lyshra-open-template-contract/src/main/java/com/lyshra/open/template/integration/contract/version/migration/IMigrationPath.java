package com.lyshra.open.template.integration.contract.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;

import java.time.Duration;
import java.util.List;

/**
 * Ordered sequence of migration steps connecting a source version to a target version.
 */
public interface IMigrationPath {

    /**
     * Returns the version the path starts from.
     *
     * @return source version
     */
    ISemanticVersion getFrom();

    /**
     * Returns the version the path ends at.
     *
     * @return target version
     */
    ISemanticVersion getTo();

    /**
     * Returns the steps in execution order.
     *
     * @return ordered steps
     */
    List<IMigrationScript> getSteps();

    /**
     * Indicates whether every step of the path is reversible.
     *
     * @return true if all steps are reversible
     */
    boolean isReversible();

    /**
     * Returns the sum of the steps' estimated durations; steps without an estimate count as zero.
     *
     * @return total estimated duration
     */
    Duration getTotalDuration();

    /**
     * Returns the number of steps in the path.
     *
     * @return step count
     */
    default int getStepCount() {
        return getSteps().size();
    }
}
