package com.eainde.specmap.pipeline;

import com.eainde.specmap.filter.DocumentRelevanceFilter;
import com.eainde.specmap.filter.RelevanceVerdict;
import com.eainde.specmap.mapping.TemplateReader;
import com.eainde.specmap.model.AnalysisResult;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentIssue;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.output.ExcelOutputAssembler;
import com.eainde.specmap.source.FragmentSourceRegistry;
import com.eainde.specmap.source.SourceScan;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-to-end run: template → input folder → relevance filter → analysis → result workbook.
 * Template and input-folder problems abort before any model call.
 */
@Slf4j
public class SpecMapperJob {

    private final TemplateReader templateReader;
    private final FragmentSourceRegistry sourceRegistry;
    private final DocumentRelevanceFilter relevanceFilter;
    private final SpecAnalysisService analysisService;
    private final ExcelOutputAssembler outputAssembler;
    private final Clock clock;

    public SpecMapperJob(TemplateReader templateReader,
                         FragmentSourceRegistry sourceRegistry,
                         DocumentRelevanceFilter relevanceFilter,
                         SpecAnalysisService analysisService,
                         ExcelOutputAssembler outputAssembler,
                         Clock clock) {
        this.templateReader = templateReader;
        this.sourceRegistry = sourceRegistry;
        this.relevanceFilter = relevanceFilter;
        this.analysisService = analysisService;
        this.outputAssembler = outputAssembler;
        this.clock = clock;
    }

    /**
     * @return the written result workbook
     */
    public Path run(Path inputFolder, Path templateFile, Path outputFolder) {
        List<TemplateSlot> slots = templateReader.read(templateFile);
        SourceScan scan = sourceRegistry.scan(inputFolder, templateFile);

        List<FragmentIssue> issues = new ArrayList<>(scan.issues());
        Map<String, List<DocumentFragment>> kept = new LinkedHashMap<>();
        scan.fragmentsByDocument().forEach((document, fragments) -> {
            RelevanceVerdict verdict = relevanceFilter.assess(document, fragments);
            if (verdict.relevant()) {
                kept.put(document, fragments);
            } else {
                issues.add(FragmentIssue.document(FragmentIssue.Kind.FILTERED_OUT, document, verdict.reason()));
            }
        });
        if (kept.isEmpty()) {
            log.warn("No documents left to analyze in {}", inputFolder);
        }

        AnalysisResult result = analysisService.analyze(kept, slots, issues);
        Path output = outputFolder.resolve(ExcelOutputAssembler.outputFileName(LocalDateTime.now(clock)));
        outputAssembler.write(templateFile, output, result);

        log.info("Run summary: {}", result.summary());
        result.issues().forEach(issue -> log.info("  {} {}: {}", issue.kind(), issue.location(), issue.message()));
        return output;
    }
}
