package com.lyshra.open.template.integration.models.version.migration;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implementation of a discovered migration path.
 * Built fresh for every pathfinding call and never stored.
 */
@Data
@Builder
public class MigrationPath implements IMigrationPath {

    private final ISemanticVersion from;
    private final ISemanticVersion to;
    @Builder.Default
    private final List<IMigrationScript> steps = new ArrayList<>();
    private final boolean reversible;
    @Builder.Default
    private final Duration totalDuration = Duration.ZERO;

    @Override
    public List<IMigrationScript> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Creates a path over the given steps, deriving reversibility and total duration.
     *
     * @param from  source version
     * @param to    target version
     * @param steps ordered steps
     * @return migration path
     */
    public static MigrationPath of(ISemanticVersion from, ISemanticVersion to, List<? extends IMigrationScript> steps) {
        Duration totalDuration = Duration.ZERO;
        boolean reversible = true;
        for (IMigrationScript step : steps) {
            totalDuration = totalDuration.plus(step.getEstimatedDuration().orElse(Duration.ZERO));
            reversible &= step.isReversible();
        }
        return MigrationPath.builder()
                .from(from)
                .to(to)
                .steps(new ArrayList<>(steps))
                .reversible(reversible)
                .totalDuration(totalDuration)
                .build();
    }
}
