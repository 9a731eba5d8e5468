package com.eainde.specmap.model;

import java.util.Objects;

/**
 * A locatable unit of source text (one page, slide or row) produced by a parsing adapter.
 *
 * <p>Immutable. {@code detectedLanguage} is null until the language normalizer has run;
 * {@link #withDetectedLanguage(String)} returns a copy rather than changing this instance.</p>
 *
 * @param sourceFile       file name the text came from
 * @param locator          page/slide/row position
 * @param rawText          text exactly as parsed, never blank
 * @param detectedLanguage ISO 639-1 code, or null when not yet detected
 */
public record DocumentFragment(
        String sourceFile,
        FragmentLocator locator,
        String rawText,
        String detectedLanguage
) {

    public DocumentFragment {
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(rawText, "rawText");
        if (rawText.isBlank()) {
            throw new IllegalArgumentException("Fragment " + sourceFile + "#" + locator + " has no text");
        }
    }

    public static DocumentFragment of(String sourceFile, FragmentLocator locator, String rawText) {
        return new DocumentFragment(sourceFile, locator, rawText, null);
    }

    public DocumentFragment withDetectedLanguage(String language) {
        return new DocumentFragment(sourceFile, locator, rawText, language);
    }

    public FragmentKey key() {
        return new FragmentKey(sourceFile, locator);
    }
}
