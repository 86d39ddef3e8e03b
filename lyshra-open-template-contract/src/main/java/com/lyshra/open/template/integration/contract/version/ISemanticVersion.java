package com.lyshra.open.template.integration.contract.version;

import java.util.Optional;

/**
 * Semantic version of a template.
 * Follows the SemVer 2.0.0 precedence rules; build metadata is carried but never
 * participates in ordering or equality.
 *
 * <p>Version format: MAJOR.MINOR.PATCH[-PRERELEASE][+BUILD]</p>
 *
 * <ul>
 *   <li>MAJOR: Incompatible template changes that require a migration</li>
 *   <li>MINOR: Backward-compatible additions</li>
 *   <li>PATCH: Backward-compatible fixes</li>
 * </ul>
 */
public interface ISemanticVersion extends Comparable<ISemanticVersion> {

    /**
     * Returns the major version component.
     *
     * @return major version number
     */
    int getMajor();

    /**
     * Returns the minor version component.
     *
     * @return minor version number
     */
    int getMinor();

    /**
     * Returns the patch version component.
     *
     * @return patch version number
     */
    int getPatch();

    /**
     * Returns optional pre-release identifier (e.g., "alpha", "beta.2", "rc.1").
     *
     * @return pre-release identifier if present
     */
    Optional<String> getPreRelease();

    /**
     * Returns optional build metadata (e.g., "build.123").
     *
     * @return build metadata if present
     */
    Optional<String> getBuildMetadata();

    /**
     * Returns the canonical version string, the exact inverse of parsing.
     *
     * @return version string (e.g., "1.2.3-beta+build.456")
     */
    String toVersionString();

    /**
     * Checks if this version is a pre-release version.
     *
     * @return true if pre-release
     */
    default boolean isPreRelease() {
        return getPreRelease().isPresent();
    }

    /**
     * Checks if this version is stable (not pre-release).
     *
     * @return true if stable
     */
    default boolean isStable() {
        return !isPreRelease();
    }
}
