package com.eainde.specmap.terminology;

import com.eainde.specmap.model.CanonicalResolution;
import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.UnitFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Unifies vendor spec names into canonical specs.
 *
 * <h3>Resolution per instance:</h3>
 * <ol>
 *   <li>exact or alias lookup in the {@link TerminologyRepository}</li>
 *   <li>similarity against curated standard names and aliases, accepted above the threshold;
 *       the raw name is then learned as an alias</li>
 *   <li>otherwise a non-standard singleton named by the raw name</li>
 * </ol>
 *
 * <h3>Merge:</h3>
 * Value and unit come from the most confident instance, ties going to the earliest fragment.
 * Every instance is kept as a contributor. Input order never affects the result: instances are
 * processed in {@link ExtractedSpecInstance#SOURCE_ORDER} and similarity only consults curated
 * names, so learned aliases can't change an outcome.
 */
@Slf4j
public class TerminologyNormalizer {

    private final TerminologyRepository repository;
    private final SimilarityScorer scorer;
    private final double similarityThreshold;

    public TerminologyNormalizer(TerminologyRepository repository, SimilarityScorer scorer, double similarityThreshold) {
        this.repository = repository;
        this.scorer = scorer;
        this.similarityThreshold = similarityThreshold;
    }

    /** How a raw name resolved; {@code term} is null for singletons. */
    record Resolution(String groupKey, String standardName, CanonicalTerm term, CanonicalResolution kind, double score) {
    }

    public List<CanonicalSpec> canonicalize(List<ExtractedSpecInstance> instances) {
        List<ExtractedSpecInstance> ordered = new ArrayList<>(instances);
        ordered.sort(ExtractedSpecInstance.SOURCE_ORDER);

        Map<String, Resolution> byRawName = new LinkedHashMap<>();
        Map<String, List<ExtractedSpecInstance>> groups = new TreeMap<>();
        Map<String, List<Resolution>> groupResolutions = new TreeMap<>();

        for (ExtractedSpecInstance instance : ordered) {
            Resolution r = byRawName.computeIfAbsent(
                    TermNormalizer.fold(instance.rawSpecName()), k -> resolve(instance.rawSpecName()));
            groups.computeIfAbsent(r.groupKey(), k -> new ArrayList<>()).add(instance);
            groupResolutions.computeIfAbsent(r.groupKey(), k -> new ArrayList<>()).add(r);
        }

        List<CanonicalSpec> result = new ArrayList<>();
        groups.forEach((key, members) -> result.add(merge(members, groupResolutions.get(key))));
        result.sort(Comparator.comparing(CanonicalSpec::standardName).thenComparing(s -> s.resolution().name()));

        long nonStandard = result.stream().filter(CanonicalSpec::isNonStandard).count();
        log.info("Canonicalized {} instance(s) into {} spec(s), {} non-standard",
                instances.size(), result.size(), nonStandard);
        return result;
    }

    Resolution resolve(String rawName) {
        Optional<TermMatch> match = repository.lookup(rawName);
        if (match.isPresent()) {
            CanonicalTerm term = match.get().term();
            CanonicalResolution kind = match.get().learned() ? CanonicalResolution.SIMILARITY : CanonicalResolution.TABLE;
            return termResolution(term, kind, 1.0);
        }

        CanonicalTerm bestTerm = null;
        double bestScore = 0.0;
        for (CanonicalTerm term : repository.terms()) {
            double s = scorer.bestScore(rawName, term.curatedNames());
            if (s > bestScore) {
                bestScore = s;
                bestTerm = term;
            }
        }
        if (bestTerm != null && bestScore >= similarityThreshold) {
            log.debug("'{}' resolved to '{}' by similarity {}", rawName, bestTerm.standardName(), bestScore);
            repository.learnAlias(bestTerm.standardName(), rawName);
            return termResolution(bestTerm, CanonicalResolution.SIMILARITY, bestScore);
        }

        log.debug("'{}' has no standard term (best similarity {})", rawName, bestScore);
        return new Resolution("S:" + TermNormalizer.fold(rawName), rawName.strip(), null, CanonicalResolution.SINGLETON, bestScore);
    }

    private static Resolution termResolution(CanonicalTerm term, CanonicalResolution kind, double score) {
        return new Resolution("T:" + term.standardName(), term.standardName(), term, kind, score);
    }

    private static CanonicalSpec merge(List<ExtractedSpecInstance> members, List<Resolution> resolutions) {
        // members arrive in SOURCE_ORDER, so the first maximum is the earliest fragment
        ExtractedSpecInstance winner = members.get(0);
        double maxConfidence = winner.confidence();
        for (ExtractedSpecInstance candidate : members) {
            if (candidate.confidence() > winner.confidence()) {
                winner = candidate;
            }
            maxConfidence = Math.max(maxConfidence, candidate.confidence());
        }

        Resolution first = resolutions.get(0);
        CanonicalResolution kind = resolutions.stream().anyMatch(r -> r.kind() == CanonicalResolution.TABLE)
                ? CanonicalResolution.TABLE
                : first.kind();

        UnitFamily family = first.term() != null ? first.term().unitFamily() : UnitFamily.classify(winner.unit());
        boolean unitConflict = members.stream()
                .map(i -> TermNormalizer.normalize(i.unit()))
                .distinct()
                .count() > 1;

        return new CanonicalSpec(
                first.standardName(),
                family,
                members,
                winner.value(),
                winner.unit(),
                maxConfidence,
                kind,
                unitConflict);
    }
}
