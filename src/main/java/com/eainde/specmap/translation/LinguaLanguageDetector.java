package com.eainde.specmap.translation;

import com.eainde.specmap.exception.ConfigurationException;
import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Statistical detection with Lingua, restricted to the languages suppliers write in.
 * Text with almost no letters (pure value rows) falls back to the working language.
 */
@Slf4j
public class LinguaLanguageDetector implements LanguageDetector {

    static final int MIN_LETTERS = 4;

    private final String fallbackLanguage;
    private final com.github.pemistahl.lingua.api.LanguageDetector detector;

    public LinguaLanguageDetector(String fallbackLanguage, Collection<String> languageCodes) {
        List<Language> languages = new ArrayList<>();
        for (String code : languageCodes) {
            languages.add(languageOf(code.strip()));
        }
        if (languages.size() < 2) {
            throw new ConfigurationException("Language detection needs at least two candidate languages: " + languageCodes);
        }
        this.fallbackLanguage = fallbackLanguage;
        this.detector = LanguageDetectorBuilder.fromLanguages(languages.toArray(new Language[0])).build();
    }

    @Override
    public String detect(String text) {
        if (text == null || letters(text) < MIN_LETTERS) {
            return fallbackLanguage;
        }
        Language language = detector.detectLanguageOf(text);
        if (language == Language.UNKNOWN) {
            return fallbackLanguage;
        }
        String code = language.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
        log.debug("Detected language {}", code);
        return code;
    }

    @Override
    public String displayName(String languageCode) {
        String name = Locale.forLanguageTag(languageCode).getDisplayLanguage(Locale.ENGLISH);
        return name.isEmpty() ? languageCode : name;
    }

    private static Language languageOf(String code) {
        for (Language language : Language.values()) {
            if (language != Language.UNKNOWN && language.getIsoCode639_1().name().equalsIgnoreCase(code)) {
                return language;
            }
        }
        throw new ConfigurationException("Unsupported language for detection: " + code);
    }

    private static int letters(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
