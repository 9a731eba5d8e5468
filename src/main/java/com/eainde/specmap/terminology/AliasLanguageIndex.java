package com.eainde.specmap.terminology;

import com.eainde.specmap.exception.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Which language a spec term belongs to, from the locale keys of the terminology table.
 * Standard names count as English.
 * Used for short table rows such as {@code "Glasdicke: 1,1 mm"}.
 */
@Slf4j
public class AliasLanguageIndex {

    static final String STANDARD_NAME_LANGUAGE = "en";
    static final int MIN_TERM_LENGTH = 4;

    record Term(String folded, Pattern pattern, String language) {
    }

    private final List<Term> terms;

    /**
     * @param namesByLanguage terms per ISO 639-1 code; terms listed under more than one language are ignored
     */
    public AliasLanguageIndex(Map<String, ? extends Iterable<String>> namesByLanguage) {
        Map<String, Set<String>> languagesByTerm = new TreeMap<>();
        namesByLanguage.forEach((language, names) -> names.forEach(name -> {
            String folded = TermNormalizer.fold(name);
            if (folded.length() >= MIN_TERM_LENGTH) {
                languagesByTerm.computeIfAbsent(folded, k -> new TreeSet<>()).add(language);
            }
        }));
        List<Term> unique = new ArrayList<>();
        languagesByTerm.forEach((folded, languages) -> {
            if (languages.size() == 1) {
                unique.add(new Term(folded, wordPattern(folded), languages.iterator().next()));
            }
        });
        this.terms = List.copyOf(unique);
    }

    public static AliasLanguageIndex fromClasspath(String resource, ObjectMapper objectMapper) {
        try (InputStream in = AliasLanguageIndex.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Terminology resource not found: " + resource);
            }
            AliasLanguageIndex index = parse(objectMapper.readTree(in));
            log.info("Indexed {} language-specific term(s) from {}", index.size(), resource);
            return index;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read terminology resource: " + resource, e);
        }
    }

    static AliasLanguageIndex parse(JsonNode root) {
        Map<String, List<String>> byLanguage = new HashMap<>();
        for (JsonNode node : root.path("terms")) {
            byLanguage.computeIfAbsent(STANDARD_NAME_LANGUAGE, k -> new ArrayList<>())
                    .add(node.path("standard_name").asText(""));
            node.path("aliases").fields().forEachRemaining(locale -> {
                List<String> names = byLanguage.computeIfAbsent(locale.getKey(), k -> new ArrayList<>());
                locale.getValue().forEach(alias -> names.add(alias.asText()));
            });
        }
        return new AliasLanguageIndex(byLanguage);
    }

    public int size() {
        return terms.size();
    }

    /** Number of whole-word term occurrences per language. */
    public Map<String, Integer> hits(String text) {
        String folded = TermNormalizer.fold(text);
        Map<String, Integer> hits = new TreeMap<>();
        for (Term term : terms) {
            if (folded.contains(term.folded()) && term.pattern().matcher(folded).find()) {
                hits.merge(term.language(), 1, Integer::sum);
            }
        }
        return hits;
    }

    /** The language with strictly the most term hits, if any. */
    public Optional<String> dominantLanguage(String text) {
        String best = null;
        int bestCount = 0;
        boolean tie = false;
        for (Map.Entry<String, Integer> e : hits(text).entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
                tie = false;
            } else if (e.getValue() == bestCount) {
                tie = true;
            }
        }
        return tie ? Optional.empty() : Optional.ofNullable(best);
    }

    private static Pattern wordPattern(String folded) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(folded) + "(?![\\p{L}\\p{N}])");
    }
}
