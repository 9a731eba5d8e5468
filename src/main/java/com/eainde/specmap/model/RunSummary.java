package com.eainde.specmap.model;

/**
 * Counts reported at the end of a run.
 */
public record RunSummary(
        int documents,
        int fragments,
        int translatedFragments,
        int failedTranslations,
        int failedExtractions,
        int extractedInstances,
        int canonicalSpecs,
        int mappedSpecs,
        int unmatchedSpecs,
        int issues
) {

    @Override
    public String toString() {
        return String.format("documents=%d, fragments=%d (translated=%d, translation failed=%d, extraction failed=%d), "
                        + "instances=%d, canonical specs=%d (mapped=%d, unmatched=%d), issues=%d",
                documents, fragments, translatedFragments, failedTranslations, failedExtractions,
                extractedInstances, canonicalSpecs, mappedSpecs, unmatchedSpecs, issues);
    }
}
