package com.eainde.specmap.translation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Shared store of translations keyed by (text, target language).
 *
 * <p>Implementations are safe for concurrent use. A reader either sees a complete entry or
 * none; entries are never invalidated within a run.</p>
 */
public interface TranslationCache {

    Optional<String> get(String key);

    /** Inserts or replaces the entry atomically. */
    void put(String key, String originalText, String translatedText);

    int size();

    /**
     * Stable key: SHA-256 over the text and the target language.
     */
    static String keyOf(String text, String targetLanguage) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(targetLanguage.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
