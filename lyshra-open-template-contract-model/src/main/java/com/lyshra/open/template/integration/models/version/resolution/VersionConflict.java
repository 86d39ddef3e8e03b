package com.lyshra.open.template.integration.models.version.resolution;

import com.lyshra.open.template.integration.contract.version.IVersionRange;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A template whose version requirements could not be satisfied together.
 */
@Data
@Builder
public class VersionConflict {

    public static final String UNKNOWN_REQUESTER = "unknown";

    private final String templateId;
    @Builder.Default
    private final List<Requirement> requirements = new ArrayList<>();

    public List<Requirement> getRequirements() {
        return Collections.unmodifiableList(requirements);
    }

    /**
     * Builds a conflict over the given ranges without requester attribution.
     *
     * @param templateId template ID
     * @param ranges     unsatisfied ranges
     * @return conflict
     */
    public static VersionConflict unattributed(String templateId, List<? extends IVersionRange> ranges) {
        List<Requirement> requirements = new ArrayList<>();
        for (IVersionRange range : ranges) {
            requirements.add(new Requirement(UNKNOWN_REQUESTER, range));
        }
        return VersionConflict.builder()
                .templateId(templateId)
                .requirements(requirements)
                .build();
    }

    /**
     * One requested range and who requested it.
     */
    public record Requirement(String requiredBy, IVersionRange versionRange) {
    }
}
