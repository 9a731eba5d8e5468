package com.eainde.specmap.translation;

/**
 * Detects the language of a text fragment.
 */
public interface LanguageDetector {

    /**
     * @return ISO 639-1 code (e.g. "en", "de"), or the fallback language when undecidable
     */
    String detect(String text);

    /** Display name for prompts and logs, e.g. "German". */
    String displayName(String languageCode);
}
