package com.eainde.specmap.filter;

/**
 * Outcome of screening a document.
 */
public record RelevanceVerdict(boolean relevant, String reason, double confidence) {

    public static RelevanceVerdict keep(String reason) {
        return new RelevanceVerdict(true, reason, 1.0);
    }

    public static RelevanceVerdict reject(String reason) {
        return new RelevanceVerdict(false, reason, 1.0);
    }
}
