package com.eainde.specmap.model;

import java.util.Objects;

/**
 * Audit-trail entry binding one contributing instance to its source text.
 *
 * @param standardName      canonical spec the instance was merged into
 * @param instance          the contributing instance
 * @param sourceFile        source document
 * @param locator           page/slide/row in the source document
 * @param originalText      original-language evidence, never empty
 * @param translatedText    working-language evidence
 * @param confidence        instance confidence
 * @param mappingStatus     inherited from the canonical spec's mapping result
 * @param translationStatus status of the fragment's language normalization
 */
public record ReferenceRecord(
        String standardName,
        ExtractedSpecInstance instance,
        String sourceFile,
        FragmentLocator locator,
        String originalText,
        String translatedText,
        double confidence,
        MappingStatus mappingStatus,
        TranslationStatus translationStatus
) {

    public ReferenceRecord {
        Objects.requireNonNull(standardName, "standardName");
        Objects.requireNonNull(instance, "instance");
        if (originalText == null || originalText.isBlank()) {
            throw new IllegalArgumentException("ReferenceRecord for " + instance.fragmentKey() + " has no original text");
        }
    }

    /** True when the fragment needs manual follow-up (its translation failed). */
    public boolean isFlagged() {
        return translationStatus == TranslationStatus.FAILED;
    }
}
