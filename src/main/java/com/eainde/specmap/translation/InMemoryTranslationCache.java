package com.eainde.specmap.translation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped translation cache.
 */
public class InMemoryTranslationCache implements TranslationCache {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, String originalText, String translatedText) {
        entries.put(key, translatedText);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
