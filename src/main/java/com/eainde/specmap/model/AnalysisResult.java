package com.eainde.specmap.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a run produced, ready for output assembly.
 */
public record AnalysisResult(
        List<CanonicalSpec> canonicalSpecs,
        List<MappingResult> mappings,
        List<ReferenceRecord> references,
        List<FragmentIssue> issues,
        RunSummary summary
) {

    public AnalysisResult {
        canonicalSpecs = List.copyOf(canonicalSpecs);
        mappings = List.copyOf(mappings);
        references = List.copyOf(references);
        issues = List.copyOf(issues);
    }

    public List<MappingResult> mapped() {
        return mappings.stream().filter(MappingResult::isMapped).collect(Collectors.toList());
    }

    public List<MappingResult> unmatched() {
        return mappings.stream().filter(m -> !m.isMapped()).collect(Collectors.toList());
    }

    /** References of one spec, in recorded order. */
    public List<ReferenceRecord> referencesOf(CanonicalSpec spec) {
        return references.stream()
                .filter(r -> r.standardName().equals(spec.standardName()))
                .collect(Collectors.toList());
    }
}
