package com.lyshra.open.template.integration.contract.version;

import java.util.List;
import java.util.Optional;

/**
 * All registered versions of a single template.
 *
 * <p>The version list is always ordered newest first. {@link #getLatest()} is the head of
 * that list and {@link #getLatestStable()} the newest version without a pre-release tag.</p>
 */
public interface IVersionRegistryEntry {

    /**
     * Returns the template identifier.
     *
     * @return template ID
     */
    String getTemplateId();

    /**
     * Returns the registered versions, newest first.
     *
     * @return registered versions
     */
    List<ITemplateVersion> getVersions();

    /**
     * Returns the newest registered version, pre-releases included.
     *
     * @return latest version
     */
    ISemanticVersion getLatest();

    /**
     * Returns the newest stable version.
     * Empty while only pre-release versions have been registered.
     *
     * @return latest stable version
     */
    Optional<ISemanticVersion> getLatestStable();
}
