package com.lyshra.open.template.core.engine.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRegistryEntry;

import java.util.Optional;
import java.util.Set;

/**
 * Registry of template versions, keyed by template ID.
 *
 * <p>Per template, versions are held in descending order and re-sorted after every
 * registration. Registering the same version twice keeps both entries; lookups return the
 * first match. The registry is owned by a single caller and is not internally synchronized.</p>
 */
public interface ITemplateVersionRegistry {

    /**
     * Registers a template version and recomputes the template's latest versions.
     *
     * @param templateVersion version to register
     */
    void register(ITemplateVersion templateVersion);

    /**
     * Looks up a registered version.
     *
     * @param templateId template ID
     * @param version    version to find
     * @return first registered entry comparing equal, or empty
     */
    Optional<ITemplateVersion> getVersion(String templateId, ISemanticVersion version);

    /**
     * Looks up a registered version by its version string.
     *
     * @param templateId    template ID
     * @param versionString version string
     * @return first registered entry comparing equal, or empty
     * @throws com.lyshra.open.template.integration.exception.InvalidVersionFormatException if the string is malformed
     */
    Optional<ITemplateVersion> getVersion(String templateId, String versionString);

    /**
     * Gets the registered entry at the template's latest version.
     *
     * @param templateId        template ID
     * @param includePreRelease whether a pre-release entry may be returned; the registry's
     *                          allow-prerelease option also enables them
     * @return latest entry, or empty if none qualifies
     */
    Optional<ITemplateVersion> getLatest(String templateId, boolean includePreRelease);

    /**
     * Gets the latest version of a template.
     *
     * @param templateId        template ID
     * @param includePreRelease whether pre-releases may be returned; the registry's
     *                          allow-prerelease option also enables them
     * @return latest version, or empty if none qualifies
     */
    Optional<ISemanticVersion> getLatestVersion(String templateId, boolean includePreRelease);

    /**
     * Gets a snapshot of a template's registry entry.
     *
     * @param templateId template ID
     * @return entry snapshot, or empty if the template is unknown
     */
    Optional<IVersionRegistryEntry> getRegistryEntry(String templateId);

    Set<String> getTemplateIds();

    void clear();
}
