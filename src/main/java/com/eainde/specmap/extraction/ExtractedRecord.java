package com.eainde.specmap.extraction;

/**
 * One validated finding from an extraction response, before it is bound to a fragment.
 */
public record ExtractedRecord(
        String specName,
        double value,
        String unit,
        String condition,
        double confidence,
        String sourceText
) {
}
