package com.eainde.specmap.model;

/**
 * A per-document or per-fragment failure recorded during a run. Failures never abort the run;
 * they surface in the output instead.
 *
 * @param kind        failure category
 * @param sourceFile  affected document
 * @param locator     affected fragment, null for whole-document failures
 * @param message     short explanation
 */
public record FragmentIssue(Kind kind, String sourceFile, FragmentLocator locator, String message) {

    public enum Kind {
        PARSE_FAILURE,
        TRANSLATION_FAILURE,
        EXTRACTION_FAILURE,
        FILTERED_OUT
    }

    public static FragmentIssue of(Kind kind, FragmentKey key, String message) {
        return new FragmentIssue(kind, key.sourceFile(), key.locator(), message);
    }

    public static FragmentIssue document(Kind kind, String sourceFile, String message) {
        return new FragmentIssue(kind, sourceFile, null, message);
    }

    public String location() {
        return locator == null ? sourceFile : sourceFile + " / " + locator.label();
    }
}
