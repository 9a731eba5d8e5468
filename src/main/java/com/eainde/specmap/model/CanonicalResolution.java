package com.eainde.specmap.model;

/** How a raw spec name was resolved to its standard name. */
public enum CanonicalResolution {
    /** Exact standard name or a known alias in the terminology table. */
    TABLE,
    /** Accepted similarity match above the configured threshold. */
    SIMILARITY,
    /** No match; the raw name became its own non-standard spec. */
    SINGLETON
}
