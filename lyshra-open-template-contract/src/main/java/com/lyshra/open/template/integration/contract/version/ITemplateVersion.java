package com.lyshra.open.template.integration.contract.version;

import java.util.Map;
import java.util.Optional;

/**
 * One registered version of one template.
 * Instances are immutable once handed to the version registry.
 */
public interface ITemplateVersion {

    /**
     * Returns the template identifier.
     *
     * @return template ID
     */
    String getTemplateId();

    /**
     * Returns the semantic version of this template version.
     *
     * @return version
     */
    ISemanticVersion getVersion();

    /**
     * Returns the range of versions this version declares itself compatible with.
     *
     * @return compatibility range if declared
     */
    Optional<IVersionRange> getCompatibleWith();

    /**
     * Returns the deprecation notice if this version is deprecated.
     *
     * @return deprecation notice
     */
    Optional<Deprecation> getDeprecation();

    /**
     * Returns migration identifiers keyed by version string.
     *
     * @return version string to migration identifier
     */
    Map<String, String> getMigrationFrom();

    /**
     * Returns the release timestamp as ISO-8601 text.
     *
     * @return release date
     */
    String getReleaseDate();

    /**
     * Returns the human-readable changelog entry for this version.
     *
     * @return changelog if present
     */
    Optional<String> getChangelog();

    /**
     * Returns the required versions of other templates, keyed by template ID.
     *
     * @return dependency ranges
     */
    Map<String, IVersionRange> getDependencies();

    /**
     * Checks whether this version carries a deprecation notice.
     *
     * @return true if deprecated
     */
    default boolean isDeprecated() {
        return getDeprecation().isPresent();
    }

    /**
     * Deprecation notice attached to a template version.
     *
     * @param message    why the version is deprecated
     * @param replacedBy suggested replacement version string
     */
    record Deprecation(String message, Optional<String> replacedBy) {

        public static Deprecation of(String message) {
            return new Deprecation(message, Optional.empty());
        }

        public static Deprecation of(String message, String replacedBy) {
            return new Deprecation(message, Optional.ofNullable(replacedBy));
        }
    }
}
