package com.eainde.specmap.model;

import java.util.Objects;

/**
 * A fragment in the working language. The original fragment is always retained.
 *
 * @param fragment          the source fragment, with its detected language set
 * @param translatedText    working-language text; equals the raw text for NATIVE and FAILED
 * @param translationStatus outcome of language normalization
 */
public record TranslatedFragment(
        DocumentFragment fragment,
        String translatedText,
        TranslationStatus translationStatus
) {

    public TranslatedFragment {
        Objects.requireNonNull(fragment, "fragment");
        Objects.requireNonNull(translatedText, "translatedText");
        Objects.requireNonNull(translationStatus, "translationStatus");
    }

    public static TranslatedFragment nativeText(DocumentFragment fragment) {
        return new TranslatedFragment(fragment, fragment.rawText(), TranslationStatus.NATIVE);
    }

    public static TranslatedFragment translated(DocumentFragment fragment, String translatedText) {
        return new TranslatedFragment(fragment, translatedText, TranslationStatus.TRANSLATED);
    }

    public static TranslatedFragment failed(DocumentFragment fragment) {
        return new TranslatedFragment(fragment, fragment.rawText(), TranslationStatus.FAILED);
    }

    public FragmentKey key() {
        return fragment.key();
    }

    public boolean isFlagged() {
        return translationStatus == TranslationStatus.FAILED;
    }
}
