package com.eainde.specmap.terminology;

/**
 * A terminology lookup hit.
 *
 * @param learned true when the hit came from an alias learned through similarity
 */
public record TermMatch(CanonicalTerm term, boolean learned) {
}
