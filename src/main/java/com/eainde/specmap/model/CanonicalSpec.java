package com.eainde.specmap.model;

import java.util.List;
import java.util.Objects;

/**
 * A specification after cross-vendor terminology unification.
 *
 * <p>Derived data: recomputable from the contributing instances at any time. The resolved
 * value and unit come from the highest-confidence instance; {@code resolvedConfidence} is
 * always the maximum contributing confidence.</p>
 *
 * @param standardName           canonical name (raw name for non-standard specs)
 * @param unitFamily             unit family of the standard term or of the resolved unit
 * @param contributingInstances  every merged instance in deterministic source order, never empty
 * @param resolvedValue          value of the winning instance
 * @param resolvedUnit           unit of the winning instance
 * @param resolvedConfidence     max confidence across contributing instances
 * @param resolution             how the name was resolved
 * @param unitConflict           true when contributing instances disagree on the unit
 */
public record CanonicalSpec(
        String standardName,
        UnitFamily unitFamily,
        List<ExtractedSpecInstance> contributingInstances,
        double resolvedValue,
        String resolvedUnit,
        double resolvedConfidence,
        CanonicalResolution resolution,
        boolean unitConflict
) {

    public CanonicalSpec {
        Objects.requireNonNull(standardName, "standardName");
        Objects.requireNonNull(contributingInstances, "contributingInstances");
        if (contributingInstances.isEmpty()) {
            throw new IllegalArgumentException("CanonicalSpec '" + standardName + "' has no contributing instances");
        }
        contributingInstances = List.copyOf(contributingInstances);
    }

    public boolean isNonStandard() {
        return resolution == CanonicalResolution.SINGLETON;
    }
}
