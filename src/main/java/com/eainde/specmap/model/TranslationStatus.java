package com.eainde.specmap.model;

public enum TranslationStatus {
    /** Fragment was already in the working language. */
    NATIVE,
    TRANSLATED,
    /** Every translation attempt failed; the original text is used and the fragment is flagged. */
    FAILED
}
