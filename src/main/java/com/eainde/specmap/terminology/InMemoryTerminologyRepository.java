package com.eainde.specmap.terminology;

import com.eainde.specmap.exception.ConfigurationException;
import com.eainde.specmap.model.UnitFamily;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Terminology table held in memory, seeded from a JSON resource:
 * <pre>
 * { "terms": [
 *     { "standard_name": "Luminance", "unit_family": "LUMINANCE",
 *       "aliases": { "de": ["Leuchtdichte"], "fr": ["Luminosité"], "en": ["Brightness"] } }
 * ] }
 * </pre>
 *
 * <p>The alias index maps folded names to standard names. Index entries are inserted with
 * {@code putIfAbsent}, so a name never changes owner once bound.</p>
 */
@Slf4j
public class InMemoryTerminologyRepository implements TerminologyRepository {

    private final Map<String, CanonicalTerm> terms = new ConcurrentHashMap<>();
    private final Map<String, String> index = new ConcurrentHashMap<>();

    public InMemoryTerminologyRepository(Collection<CanonicalTerm> seed) {
        for (CanonicalTerm term : seed) {
            if (terms.putIfAbsent(term.standardName(), term) != null) {
                throw new ConfigurationException("Duplicate standard name in terminology table: " + term.standardName());
            }
        }
        for (CanonicalTerm term : seed) {
            bind(term.standardName(), term.standardName());
            term.aliases().forEach(alias -> {
                String owner = index.putIfAbsent(TermNormalizer.fold(alias), term.standardName());
                if (owner != null && !owner.equals(term.standardName())) {
                    log.warn("Alias '{}' of '{}' already belongs to '{}', ignored", alias, term.standardName(), owner);
                }
            });
        }
    }

    public static InMemoryTerminologyRepository fromClasspath(String resource, ObjectMapper objectMapper) {
        try (InputStream in = InMemoryTerminologyRepository.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Terminology resource not found: " + resource);
            }
            List<CanonicalTerm> seed = parse(objectMapper.readTree(in));
            log.info("Loaded {} canonical terms from {}", seed.size(), resource);
            return new InMemoryTerminologyRepository(seed);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read terminology resource: " + resource, e);
        }
    }

    static List<CanonicalTerm> parse(JsonNode root) {
        JsonNode array = root.path("terms");
        if (!array.isArray()) {
            throw new ConfigurationException("Terminology table must contain a 'terms' array");
        }
        List<CanonicalTerm> result = new ArrayList<>();
        for (JsonNode node : array) {
            String name = node.path("standard_name").asText("").strip();
            if (name.isEmpty()) {
                throw new ConfigurationException("Terminology entry without standard_name: " + node);
            }
            UnitFamily family = parseFamily(node.path("unit_family").asText("UNKNOWN"), name);
            Set<String> aliases = new LinkedHashSet<>();
            node.path("aliases").fields().forEachRemaining(locale ->
                    locale.getValue().forEach(alias -> aliases.add(alias.asText())));
            result.add(new CanonicalTerm(name, family, aliases));
        }
        return result;
    }

    private static UnitFamily parseFamily(String value, String term) {
        try {
            return UnitFamily.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown unit family '" + value + "' for term " + term, e);
        }
    }

    @Override
    public Optional<TermMatch> lookup(String name) {
        String owner = index.get(TermNormalizer.fold(name));
        if (owner == null) {
            return Optional.empty();
        }
        CanonicalTerm term = terms.get(owner);
        if (term == null) {
            return Optional.empty();
        }
        boolean learned = term.learnedAliases().stream()
                .anyMatch(a -> TermNormalizer.fold(a).equals(TermNormalizer.fold(name)));
        return Optional.of(new TermMatch(term, learned));
    }

    @Override
    public Optional<CanonicalTerm> find(String standardName) {
        return Optional.ofNullable(terms.get(standardName));
    }

    @Override
    public List<CanonicalTerm> terms() {
        List<CanonicalTerm> snapshot = new ArrayList<>(terms.values());
        snapshot.sort(Comparator.comparing(CanonicalTerm::standardName));
        return snapshot;
    }

    @Override
    public boolean learnAlias(String standardName, String alias) {
        if (!terms.containsKey(standardName)) {
            throw new IllegalArgumentException("Unknown standard name: " + standardName);
        }
        String key = TermNormalizer.fold(alias);
        if (key.isEmpty() || index.containsKey(key)) {
            return false;
        }
        // term first, index second: a reader that finds the index entry also finds the learned alias
        terms.computeIfPresent(standardName, (k, term) -> term.withLearnedAlias(alias));
        if (!bind(key, standardName)) {
            return false;
        }
        log.info("Learned alias '{}' for '{}'", alias, standardName);
        return true;
    }

    private boolean bind(String name, String standardName) {
        return index.putIfAbsent(TermNormalizer.fold(name), standardName) == null;
    }
}
