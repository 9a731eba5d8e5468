package com.eainde.specmap.config;

import com.eainde.specmap.exception.ConfigurationException;
import com.eainde.specmap.extraction.ExtractionResponseParser;
import com.eainde.specmap.extraction.SpecExtractionEngine;
import com.eainde.specmap.filter.DocumentRelevanceFilter;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.LoggingChatModelListener;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.llm.RateLimitGovernor;
import com.eainde.specmap.llm.RetryPolicy;
import com.eainde.specmap.mapping.TemplateMapper;
import com.eainde.specmap.mapping.TemplateReader;
import com.eainde.specmap.output.ExcelOutputAssembler;
import com.eainde.specmap.pipeline.SpecAnalysisService;
import com.eainde.specmap.pipeline.SpecMapperJob;
import com.eainde.specmap.provenance.ProvenanceTracker;
import com.eainde.specmap.source.FragmentSourceRegistry;
import com.eainde.specmap.source.PdfFragmentSource;
import com.eainde.specmap.source.PptxFragmentSource;
import com.eainde.specmap.source.XlsxFragmentSource;
import com.eainde.specmap.terminology.AliasLanguageIndex;
import com.eainde.specmap.terminology.EmbeddingSimilarityScorer;
import com.eainde.specmap.terminology.InMemoryTerminologyRepository;
import com.eainde.specmap.terminology.LexicalSimilarityScorer;
import com.eainde.specmap.terminology.SimilarityScorer;
import com.eainde.specmap.terminology.TerminologyNormalizer;
import com.eainde.specmap.terminology.TerminologyRepository;
import com.eainde.specmap.thread.MdcAwareExecutor;
import com.eainde.specmap.translation.FileBackedTranslationCache;
import com.eainde.specmap.translation.InMemoryTranslationCache;
import com.eainde.specmap.translation.LanguageDetector;
import com.eainde.specmap.translation.LanguageNormalizer;
import com.eainde.specmap.translation.LinguaLanguageDetector;
import com.eainde.specmap.translation.TermAwareLanguageDetector;
import com.eainde.specmap.translation.TranslationCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Wires the pipeline from {@code specmap.*} properties (defaults in application.yml).
 * A missing API key fails context startup, so nothing runs without credentials.
 */
@Slf4j
@Configuration
public class SpecMapConfig {

    private static final String TERMINOLOGY_RESOURCE = "terminology/canonical-terms.json";

    // ── Model ──────────────────────────────────────────────────────────────
    @Value("${specmap.gemini.api-key:}")
    private String apiKey;

    @Value("${specmap.gemini.model:gemini-2.0-flash}")
    private String modelName;

    @Value("${specmap.gemini.temperature:0.0}")
    private double temperature;

    @Value("${specmap.gemini.timeout-seconds:120}")
    private int timeoutSeconds;

    @Value("${specmap.working-language:en}")
    private String workingLanguage;

    @Value("${specmap.language.candidates:en,de,fr,es,it,ja,ko,zh}")
    private String[] candidateLanguages;

    // ── Translation cache ──────────────────────────────────────────────────
    @Value("${specmap.translation.cache-enabled:true}")
    private boolean cacheEnabled;

    @Value("${specmap.translation.cache-folder:translation_cache}")
    private String cacheFolder;

    // ── Retry / rate limit ─────────────────────────────────────────────────
    @Value("${specmap.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${specmap.retry.initial-delay-ms:2000}")
    private long retryInitialDelayMs;

    @Value("${specmap.retry.multiplier:2.0}")
    private double retryMultiplier;

    @Value("${specmap.retry.max-delay-ms:30000}")
    private long retryMaxDelayMs;

    @Value("${specmap.rate-limit.max-concurrent:4}")
    private int maxConcurrentCalls;

    @Value("${specmap.rate-limit.requests-per-minute:60}")
    private int requestsPerMinute;

    @Value("${specmap.rate-limit.max-backoff-attempts:6}")
    private int maxBackoffAttempts;

    // ── Extraction / terminology / mapping ─────────────────────────────────
    @Value("${specmap.extraction.max-corrective-attempts:2}")
    private int maxCorrectiveAttempts;

    @Value("${specmap.extraction.max-chars-per-request:12000}")
    private int maxCharsPerRequest;

    @Value("${specmap.terminology.similarity-threshold:0.82}")
    private double similarityThreshold;

    @Value("${specmap.terminology.similarity:lexical}")
    private String similarityKind;

    @Value("${specmap.mapping.acceptance-threshold:0.75}")
    private double acceptanceThreshold;

    @Value("${specmap.mapping.unit-mismatch-penalty:0.5}")
    private double unitMismatchPenalty;

    // ── Pipeline / filter ──────────────────────────────────────────────────
    @Value("${specmap.pipeline.parallelism:4}")
    private int parallelism;

    @Value("${specmap.filter.enabled:false}")
    private boolean filterEnabled;

    @Value("${specmap.filter.keywords:specification,spec,datasheet,luminance,hardness,thickness}")
    private String[] filterKeywords;

    @Bean
    public ObjectMapper specMapObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public ChatModel chatModel() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(
                    "Gemini API key missing: set specmap.gemini.api-key (or GEMINI_API_KEY)");
        }
        log.info("Using Gemini model {} (temperature {})", modelName, temperature);
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(0)
                .listeners(List.of(new LoggingChatModelListener()))
                .build();
    }

    @Bean
    public RateLimitGovernor rateLimitGovernor() {
        return new RateLimitGovernor(maxConcurrentCalls, requestsPerMinute);
    }

    /** Shared by translation and extraction for non-rate-limit failures. */
    @Bean
    public RetryPolicy retryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(retryMaxAttempts)
                .initialDelay(Duration.ofMillis(retryInitialDelayMs))
                .multiplier(retryMultiplier)
                .maxDelay(Duration.ofMillis(retryMaxDelayMs))
                .build();
    }

    @Bean
    public LlmGateway llmGateway(ChatModel chatModel, RateLimitGovernor governor) {
        RetryPolicy rateLimitBackoff = RetryPolicy.builder()
                .maxAttempts(maxBackoffAttempts)
                .initialDelay(Duration.ofMillis(retryInitialDelayMs))
                .multiplier(retryMultiplier)
                .maxDelay(Duration.ofMillis(Math.max(retryMaxDelayMs, retryInitialDelayMs)))
                .build();
        return new LlmGateway(chatModel, governor, rateLimitBackoff);
    }

    @Bean
    public PromptLoader promptLoader() {
        return new PromptLoader();
    }

    // ── Translation ────────────────────────────────────────────────────────

    @Bean
    public LanguageDetector languageDetector(ObjectMapper specMapObjectMapper) {
        AliasLanguageIndex terms = AliasLanguageIndex.fromClasspath(TERMINOLOGY_RESOURCE, specMapObjectMapper);
        return new TermAwareLanguageDetector(
                new LinguaLanguageDetector(workingLanguage, Arrays.asList(candidateLanguages)), terms, workingLanguage);
    }

    @Bean
    public TranslationCache translationCache(ObjectMapper specMapObjectMapper) {
        if (!cacheEnabled) {
            return new InMemoryTranslationCache();
        }
        return new FileBackedTranslationCache(Path.of(cacheFolder), specMapObjectMapper);
    }

    @Bean
    public LanguageNormalizer languageNormalizer(LanguageDetector detector, TranslationCache cache,
                                                 LlmGateway gateway, RetryPolicy retryPolicy, PromptLoader prompts) {
        return new LanguageNormalizer(detector, cache, gateway, retryPolicy, prompts, workingLanguage);
    }

    // ── Extraction ─────────────────────────────────────────────────────────

    @Bean
    public SpecExtractionEngine specExtractionEngine(LlmGateway gateway, ObjectMapper specMapObjectMapper,
                                                     PromptLoader prompts, RetryPolicy retryPolicy) {
        return new SpecExtractionEngine(gateway, new ExtractionResponseParser(specMapObjectMapper), prompts,
                retryPolicy, maxCorrectiveAttempts, maxCharsPerRequest);
    }

    // ── Terminology / mapping / provenance ─────────────────────────────────

    @Bean
    public TerminologyRepository terminologyRepository(ObjectMapper specMapObjectMapper) {
        return InMemoryTerminologyRepository.fromClasspath(TERMINOLOGY_RESOURCE, specMapObjectMapper);
    }

    @Bean
    public SimilarityScorer similarityScorer() {
        if ("embedding".equalsIgnoreCase(similarityKind)) {
            log.info("Using embedding similarity (all-MiniLM-L6-v2)");
            return new EmbeddingSimilarityScorer(new AllMiniLmL6V2QuantizedEmbeddingModel());
        }
        if (!"lexical".equalsIgnoreCase(similarityKind)) {
            throw new ConfigurationException("Unknown specmap.terminology.similarity: " + similarityKind);
        }
        return new LexicalSimilarityScorer();
    }

    @Bean
    public TerminologyNormalizer terminologyNormalizer(TerminologyRepository repository, SimilarityScorer scorer) {
        return new TerminologyNormalizer(repository, scorer, similarityThreshold);
    }

    @Bean
    public TemplateMapper templateMapper(TerminologyRepository repository, SimilarityScorer scorer) {
        return new TemplateMapper(repository, scorer, acceptanceThreshold, unitMismatchPenalty);
    }

    @Bean
    public ProvenanceTracker provenanceTracker() {
        return new ProvenanceTracker();
    }

    // ── Sources / filter / output ──────────────────────────────────────────

    @Bean
    public FragmentSourceRegistry fragmentSourceRegistry() {
        return new FragmentSourceRegistry(List.of(
                new PdfFragmentSource(), new PptxFragmentSource(), new XlsxFragmentSource()));
    }

    @Bean
    public DocumentRelevanceFilter documentRelevanceFilter(LlmGateway gateway, PromptLoader prompts,
                                                           ObjectMapper specMapObjectMapper) {
        return new DocumentRelevanceFilter(gateway, prompts, specMapObjectMapper,
                Arrays.asList(filterKeywords), filterEnabled);
    }

    @Bean
    public TemplateReader templateReader() {
        return new TemplateReader();
    }

    @Bean
    public ExcelOutputAssembler excelOutputAssembler() {
        return new ExcelOutputAssembler();
    }

    // ── Pipeline ───────────────────────────────────────────────────────────

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor pipelineExecutor() {
        return new MdcAwareExecutor(parallelism);
    }

    @Bean
    public SpecAnalysisService specAnalysisService(LanguageNormalizer languageNormalizer,
                                                   SpecExtractionEngine extractionEngine,
                                                   TerminologyNormalizer terminologyNormalizer,
                                                   TemplateMapper templateMapper,
                                                   ProvenanceTracker provenanceTracker,
                                                   TerminologyRepository terminologyRepository,
                                                   MdcAwareExecutor pipelineExecutor) {
        return new SpecAnalysisService(languageNormalizer, extractionEngine, terminologyNormalizer,
                templateMapper, provenanceTracker, terminologyRepository, pipelineExecutor);
    }

    @Bean
    public SpecMapperJob specMapperJob(TemplateReader templateReader, FragmentSourceRegistry registry,
                                       DocumentRelevanceFilter relevanceFilter, SpecAnalysisService analysisService,
                                       ExcelOutputAssembler outputAssembler) {
        return new SpecMapperJob(templateReader, registry, relevanceFilter, analysisService, outputAssembler,
                Clock.systemDefaultZone());
    }
}
