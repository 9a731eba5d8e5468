package com.eainde.specmap.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One validated finding reported by the extraction model for one fragment.
 *
 * <p>Never mutated after extraction; canonicalization only aggregates instances.</p>
 *
 * @param fragmentKey   fragment the finding came from
 * @param rawSpecName   spec name as reported by the model
 * @param value         numeric value
 * @param unit          measurement unit, may be empty for dimensionless values
 * @param condition     test condition, or null
 * @param confidence    model-reported confidence in [0, 1]
 * @param sourceExcerpt text snippet the model quoted as evidence, may be empty
 */
public record ExtractedSpecInstance(
        FragmentKey fragmentKey,
        String rawSpecName,
        double value,
        String unit,
        String condition,
        double confidence,
        String sourceExcerpt
) {

    /** Deterministic total order: fragment first, then name, value, unit and confidence. */
    public static final Comparator<ExtractedSpecInstance> SOURCE_ORDER =
            Comparator.comparing(ExtractedSpecInstance::fragmentKey)
                    .thenComparing(ExtractedSpecInstance::rawSpecName)
                    .thenComparingDouble(ExtractedSpecInstance::value)
                    .thenComparing(ExtractedSpecInstance::unit)
                    .thenComparing(Comparator.comparingDouble(ExtractedSpecInstance::confidence).reversed())
                    .thenComparing(ExtractedSpecInstance::sourceExcerpt);

    public ExtractedSpecInstance {
        Objects.requireNonNull(fragmentKey, "fragmentKey");
        Objects.requireNonNull(rawSpecName, "rawSpecName");
        unit = unit == null ? "" : unit;
        sourceExcerpt = sourceExcerpt == null ? "" : sourceExcerpt;
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }
}
