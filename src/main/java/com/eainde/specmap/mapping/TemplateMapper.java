package com.eainde.specmap.mapping;

import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.MappingResult;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.model.UnitFamily;
import com.eainde.specmap.terminology.CanonicalTerm;
import com.eainde.specmap.terminology.SimilarityScorer;
import com.eainde.specmap.terminology.TermMatch;
import com.eainde.specmap.terminology.TermNormalizer;
import com.eainde.specmap.terminology.TerminologyRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Greedy best-first assignment of canonical specs to template slots.
 *
 * <p>Every (spec, slot) pair is scored; pairs are taken in descending score, ties broken by
 * higher resolved confidence, then standard name, then slot position. A pair is accepted when
 * both sides are free and the score is strictly above the acceptance threshold. Specs left
 * over are unmatched; they are never forced into a weak slot.</p>
 */
@Slf4j
public class TemplateMapper {

    static final double EXACT_SCORE = 1.0;

    private final TerminologyRepository repository;
    private final SimilarityScorer scorer;
    private final double acceptanceThreshold;
    private final double unitMismatchPenalty;

    public TemplateMapper(TerminologyRepository repository,
                          SimilarityScorer scorer,
                          double acceptanceThreshold,
                          double unitMismatchPenalty) {
        this.repository = repository;
        this.scorer = scorer;
        this.acceptanceThreshold = acceptanceThreshold;
        this.unitMismatchPenalty = unitMismatchPenalty;
    }

    record Candidate(CanonicalSpec spec, TemplateSlot slot, double score) {
    }

    private static final Comparator<Candidate> GREEDY_ORDER =
            Comparator.comparingDouble(Candidate::score).reversed()
                    .thenComparing(Comparator.comparingDouble((Candidate c) -> c.spec().resolvedConfidence()).reversed())
                    .thenComparing(c -> c.spec().standardName())
                    .thenComparing(c -> c.slot().cellCoordinate());

    /**
     * @return one result per spec, in the order of {@code specs}
     */
    public List<MappingResult> map(List<CanonicalSpec> specs, List<TemplateSlot> slots) {
        List<Candidate> candidates = new ArrayList<>();
        Map<CanonicalSpec, Double> bestScore = new IdentityHashMap<>();
        for (CanonicalSpec spec : specs) {
            bestScore.put(spec, 0.0);
            for (TemplateSlot slot : slots) {
                double score = score(spec, slot);
                bestScore.merge(spec, score, Math::max);
                candidates.add(new Candidate(spec, slot, score));
            }
        }
        candidates.sort(GREEDY_ORDER);

        Map<CanonicalSpec, MappingResult> assigned = new IdentityHashMap<>();
        Set<TemplateSlot> claimed = new HashSet<>();
        for (Candidate c : candidates) {
            if (c.score() <= acceptanceThreshold) {
                break;
            }
            if (assigned.containsKey(c.spec()) || claimed.contains(c.slot())) {
                continue;
            }
            assigned.put(c.spec(), MappingResult.mapped(c.spec(), c.slot(), c.score()));
            claimed.add(c.slot());
            log.debug("Mapped '{}' to {} (score {})", c.spec().standardName(), c.slot().cellCoordinate(), c.score());
        }

        List<MappingResult> results = new ArrayList<>();
        for (CanonicalSpec spec : specs) {
            MappingResult result = assigned.get(spec);
            if (result == null) {
                result = MappingResult.unmatched(spec, bestScore.get(spec));
                log.info("No template slot for '{}' (best score {})", spec.standardName(),
                        String.format("%.2f", bestScore.get(spec)));
            }
            results.add(result);
        }
        log.info("Mapped {} of {} spec(s) onto {} slot(s)", assigned.size(), specs.size(), slots.size());
        return results;
    }

    /**
     * Exact or alias match scores 1.0; otherwise the best similarity between the slot label and
     * the spec's names. A unit family clash with the slot's expected unit applies the penalty.
     */
    double score(CanonicalSpec spec, TemplateSlot slot) {
        String label = TermNormalizer.stripUnitSuffix(slot.labelText());
        double score = isExactMatch(spec, label) ? EXACT_SCORE : scorer.bestScore(label, namesOf(spec));

        if (slot.hasExpectedUnit()) {
            UnitFamily expected = UnitFamily.classify(slot.expectedUnit());
            if (!spec.unitFamily().isCompatibleWith(expected)) {
                score *= unitMismatchPenalty;
            }
        }
        return score;
    }

    private boolean isExactMatch(CanonicalSpec spec, String label) {
        String folded = TermNormalizer.fold(label);
        if (folded.equals(TermNormalizer.fold(spec.standardName()))) {
            return true;
        }
        if (spec.isNonStandard()) {
            return spec.contributingInstances().stream()
                    .map(ExtractedSpecInstance::rawSpecName)
                    .anyMatch(raw -> TermNormalizer.fold(raw).equals(folded));
        }
        Optional<TermMatch> match = repository.lookup(label);
        return match.isPresent() && match.get().term().standardName().equals(spec.standardName());
    }

    private List<String> namesOf(CanonicalSpec spec) {
        Set<String> names = new TreeSet<>();
        names.add(spec.standardName());
        if (!spec.isNonStandard()) {
            repository.find(spec.standardName())
                    .map(CanonicalTerm::curatedNames)
                    .ifPresent(names::addAll);
        }
        return List.copyOf(names);
    }
}
