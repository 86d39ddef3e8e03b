package com.lyshra.open.template.core.engine.version.resolution;

import com.lyshra.open.template.integration.contract.version.IVersionRange;
import com.lyshra.open.template.integration.models.version.resolution.VersionResolutionResult;

import java.util.List;
import java.util.Map;

/**
 * Picks one version per template so that every requested range is satisfied.
 */
public interface IVersionConstraintResolver {

    /**
     * Resolves the highest registered version of each template satisfying all of its ranges.
     *
     * <p>Templates are processed in the map's iteration order. A template that is unknown or
     * has no satisfying version becomes a conflict; resolved versions are only reported when
     * there are no conflicts. Deprecated winners add a warning.</p>
     *
     * @param requirements ranges requested per template ID
     * @return resolution outcome
     */
    VersionResolutionResult resolveVersions(Map<String, ? extends List<? extends IVersionRange>> requirements);
}
