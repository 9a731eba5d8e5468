package com.eainde.specmap.terminology;

import java.util.List;
import java.util.Optional;

/**
 * Cross-vendor terminology table shared by all fragment pipelines of a run.
 *
 * <p>Implementations must be safe for concurrent readers and writers; alias upserts are atomic.</p>
 */
public interface TerminologyRepository {

    /** Exact lookup by standard name, curated alias or learned alias (normalized, diacritics folded). */
    Optional<TermMatch> lookup(String name);

    Optional<CanonicalTerm> find(String standardName);

    /** All terms sorted by standard name. */
    List<CanonicalTerm> terms();

    /**
     * Records {@code alias} as a learned alias of {@code standardName}. An alias already bound
     * to a term is left untouched.
     *
     * @return true if the alias was added
     */
    boolean learnAlias(String standardName, String alias);
}
