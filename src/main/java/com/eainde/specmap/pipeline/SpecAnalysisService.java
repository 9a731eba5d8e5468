package com.eainde.specmap.pipeline;

import com.eainde.specmap.extraction.ExtractionOutcome;
import com.eainde.specmap.extraction.SpecExtractionEngine;
import com.eainde.specmap.mapping.TemplateMapper;
import com.eainde.specmap.model.AnalysisResult;
import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentIssue;
import com.eainde.specmap.model.FragmentKey;
import com.eainde.specmap.model.MappingResult;
import com.eainde.specmap.model.ReferenceRecord;
import com.eainde.specmap.model.RunSummary;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.model.TranslatedFragment;
import com.eainde.specmap.model.TranslationStatus;
import com.eainde.specmap.provenance.ProvenanceTracker;
import com.eainde.specmap.terminology.CanonicalTerm;
import com.eainde.specmap.terminology.TermNormalizer;
import com.eainde.specmap.terminology.TerminologyNormalizer;
import com.eainde.specmap.terminology.TerminologyRepository;
import com.eainde.specmap.translation.LanguageNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs the core pipeline over parsed fragments.
 *
 * <pre>
 * per fragment, concurrently:   translate ─► extract        (failures become issues)
 * then, on the joined results:  canonicalize ─► map ─► provenance
 * </pre>
 *
 * <p>Fragment results are collected in fragment order, and every later stage sorts its input,
 * so completion order never changes the outcome.</p>
 */
@Slf4j
public class SpecAnalysisService {

    static final String MDC_DOCUMENT = "document";
    static final String MDC_FRAGMENT = "fragment";

    private final LanguageNormalizer languageNormalizer;
    private final SpecExtractionEngine extractionEngine;
    private final TerminologyNormalizer terminologyNormalizer;
    private final TemplateMapper templateMapper;
    private final ProvenanceTracker provenanceTracker;
    private final TerminologyRepository terminologyRepository;
    private final Executor executor;

    public SpecAnalysisService(LanguageNormalizer languageNormalizer,
                               SpecExtractionEngine extractionEngine,
                               TerminologyNormalizer terminologyNormalizer,
                               TemplateMapper templateMapper,
                               ProvenanceTracker provenanceTracker,
                               TerminologyRepository terminologyRepository,
                               Executor executor) {
        this.languageNormalizer = languageNormalizer;
        this.extractionEngine = extractionEngine;
        this.terminologyNormalizer = terminologyNormalizer;
        this.templateMapper = templateMapper;
        this.provenanceTracker = provenanceTracker;
        this.terminologyRepository = terminologyRepository;
        this.executor = executor;
    }

    /** Per-fragment result of the concurrent stage. */
    record FragmentResult(TranslatedFragment translated, ExtractionOutcome extraction, List<FragmentIssue> issues) {
    }

    /**
     * @param documents   fragments per document
     * @param slots       template slots
     * @param priorIssues issues found before analysis (parse failures, filtered documents)
     */
    public AnalysisResult analyze(Map<String, List<DocumentFragment>> documents,
                                  List<TemplateSlot> slots,
                                  List<FragmentIssue> priorIssues) {
        List<DocumentFragment> fragments = documents.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(DocumentFragment::key))
                .collect(Collectors.toList());
        List<String> vocabulary = targetVocabulary(slots);
        log.info("Analyzing {} fragment(s) from {} document(s)", fragments.size(), documents.size());

        List<CompletableFuture<FragmentResult>> futures = new ArrayList<>(fragments.size());
        for (DocumentFragment fragment : fragments) {
            futures.add(CompletableFuture.supplyAsync(() -> process(fragment, vocabulary), executor));
        }

        Map<FragmentKey, TranslatedFragment> translated = new LinkedHashMap<>();
        List<ExtractedSpecInstance> instances = new ArrayList<>();
        List<FragmentIssue> issues = new ArrayList<>(priorIssues);
        int translatedCount = 0;
        int failedTranslations = 0;
        int failedExtractions = 0;

        for (CompletableFuture<FragmentResult> future : futures) {
            FragmentResult result = future.join();
            translated.put(result.translated().key(), result.translated());
            instances.addAll(result.extraction().instances());
            issues.addAll(result.issues());
            if (result.translated().translationStatus() == TranslationStatus.TRANSLATED) translatedCount++;
            if (result.translated().translationStatus() == TranslationStatus.FAILED) failedTranslations++;
            if (!result.extraction().isSuccess()) failedExtractions++;
        }

        List<CanonicalSpec> specs = terminologyNormalizer.canonicalize(instances);
        List<MappingResult> mappings = templateMapper.map(specs, slots);
        List<ReferenceRecord> references = provenanceTracker.track(specs, mappings, translated);

        int mapped = (int) mappings.stream().filter(MappingResult::isMapped).count();
        RunSummary summary = new RunSummary(
                documents.size(),
                fragments.size(),
                translatedCount,
                failedTranslations,
                failedExtractions,
                instances.size(),
                specs.size(),
                mapped,
                mappings.size() - mapped,
                issues.size());
        log.info("Analysis complete: {}", summary);
        return new AnalysisResult(specs, mappings, references, issues, summary);
    }

    private FragmentResult process(DocumentFragment fragment, List<String> vocabulary) {
        FragmentKey key = fragment.key();
        MDC.put(MDC_DOCUMENT, key.sourceFile());
        MDC.put(MDC_FRAGMENT, key.locator().label());
        List<FragmentIssue> issues = new ArrayList<>();
        try {
            TranslatedFragment translated;
            try {
                translated = languageNormalizer.normalize(fragment);
            } catch (RuntimeException e) {
                log.error("Unexpected translation error for {}", key, e);
                translated = TranslatedFragment.failed(fragment);
            }
            if (translated.isFlagged()) {
                issues.add(FragmentIssue.of(FragmentIssue.Kind.TRANSLATION_FAILURE, key,
                        "Translation failed, original text used"));
            }

            ExtractionOutcome extraction;
            try {
                extraction = extractionEngine.extract(translated, vocabulary);
            } catch (RuntimeException e) {
                log.error("Unexpected extraction error for {}", key, e);
                extraction = ExtractionOutcome.failure(key, e.getMessage());
            }
            if (!extraction.isSuccess()) {
                issues.add(FragmentIssue.of(FragmentIssue.Kind.EXTRACTION_FAILURE, key, extraction.failureReason()));
            }
            return new FragmentResult(translated, extraction, issues);
        } finally {
            MDC.remove(MDC_DOCUMENT);
            MDC.remove(MDC_FRAGMENT);
        }
    }

    /** Template labels without unit suffix plus every standard name, sorted. */
    private List<String> targetVocabulary(List<TemplateSlot> slots) {
        TreeSet<String> vocabulary = new TreeSet<>();
        slots.forEach(s -> vocabulary.add(TermNormalizer.stripUnitSuffix(s.labelText())));
        terminologyRepository.terms().stream().map(CanonicalTerm::standardName).forEach(vocabulary::add);
        vocabulary.remove("");
        return List.copyOf(vocabulary);
    }
}
