package com.eainde.specmap.translation;

import com.eainde.specmap.terminology.AliasLanguageIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Second opinion for text the delegate judged to be in the working language: when the
 * terminology table's foreign terms outnumber its working-language terms, the foreign
 * language wins. A foreign verdict from the delegate is never overridden.
 */
@Slf4j
public class TermAwareLanguageDetector implements LanguageDetector {

    private final LanguageDetector delegate;
    private final AliasLanguageIndex terms;
    private final String workingLanguage;

    public TermAwareLanguageDetector(LanguageDetector delegate, AliasLanguageIndex terms, String workingLanguage) {
        this.delegate = delegate;
        this.terms = terms;
        this.workingLanguage = workingLanguage;
    }

    @Override
    public String detect(String text) {
        String detected = delegate.detect(text);
        if (!workingLanguage.equalsIgnoreCase(detected) || text == null) {
            return detected;
        }
        Optional<String> byTerms = terms.dominantLanguage(text);
        if (byTerms.isPresent() && !workingLanguage.equalsIgnoreCase(byTerms.get())) {
            log.debug("Terminology marks text as {} despite detector verdict {}", byTerms.get(), detected);
            return byTerms.get();
        }
        return detected;
    }

    @Override
    public String displayName(String languageCode) {
        return delegate.displayName(languageCode);
    }
}
