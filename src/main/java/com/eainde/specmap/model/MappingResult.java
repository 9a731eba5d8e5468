package com.eainde.specmap.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of template mapping for one canonical spec: a claimed slot, or unmatched.
 *
 * @param canonicalSpec   the spec being placed
 * @param slot            claimed slot, null when unmatched
 * @param similarityScore score of the accepted pair, or the best score seen when unmatched
 */
public record MappingResult(CanonicalSpec canonicalSpec, TemplateSlot slot, double similarityScore) {

    public MappingResult {
        Objects.requireNonNull(canonicalSpec, "canonicalSpec");
    }

    public static MappingResult mapped(CanonicalSpec spec, TemplateSlot slot, double score) {
        return new MappingResult(spec, Objects.requireNonNull(slot, "slot"), score);
    }

    public static MappingResult unmatched(CanonicalSpec spec, double bestScore) {
        return new MappingResult(spec, null, bestScore);
    }

    public boolean isMapped() {
        return slot != null;
    }

    public Optional<TemplateSlot> slotRef() {
        return Optional.ofNullable(slot);
    }

    public MappingStatus status() {
        return isMapped() ? MappingStatus.MAPPED : MappingStatus.UNMATCHED;
    }
}
