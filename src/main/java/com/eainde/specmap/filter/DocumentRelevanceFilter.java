package com.eainde.specmap.filter;

import com.eainde.specmap.extraction.ExtractionResponseParser;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.model.DocumentFragment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Screens documents before extraction so brochures and certificates don't cost model calls.
 *
 * <pre>
 * disabled ─────────────────────────► keep
 * no keyword in any fragment ───────► reject
 * LLM verdict on the first fragments ► keep / reject
 * LLM call or parse failed ─────────► keep (a keyword matched)
 * </pre>
 */
@Slf4j
public class DocumentRelevanceFilter {

    private static final String PROMPT = "relevance.txt";

    static final int SAMPLE_FRAGMENTS = 3;
    static final int SAMPLE_CHARS = 4000;

    private final LlmGateway gateway;
    private final PromptLoader prompts;
    private final ObjectMapper objectMapper;
    private final List<String> keywords;
    private final boolean enabled;

    public DocumentRelevanceFilter(LlmGateway gateway,
                                   PromptLoader prompts,
                                   ObjectMapper objectMapper,
                                   List<String> keywords,
                                   boolean enabled) {
        this.gateway = gateway;
        this.prompts = prompts;
        this.objectMapper = objectMapper;
        this.keywords = keywords.stream()
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public RelevanceVerdict assess(String sourceFile, List<DocumentFragment> fragments) {
        if (!enabled) {
            return RelevanceVerdict.keep("filter disabled");
        }
        String matched = firstKeyword(fragments);
        if (matched == null) {
            log.info("{}: no specification keyword found, skipped", sourceFile);
            return RelevanceVerdict.reject("no specification keyword found");
        }

        try {
            String prompt = prompts.render(PROMPT, Map.of("sourceFile", sourceFile, "sample", sample(fragments)));
            String response = gateway.completeJson(List.of(UserMessage.from(prompt)));
            JsonNode node = objectMapper.readTree(ExtractionResponseParser.stripFence(response.strip()));
            JsonNode relevant = node.get("is_relevant");
            if (relevant == null || !relevant.isBoolean()) {
                log.warn("{}: relevance answer without is_relevant, keeping document", sourceFile);
                return RelevanceVerdict.keep("keyword '" + matched + "' matched, relevance answer unusable");
            }
            RelevanceVerdict verdict = new RelevanceVerdict(
                    relevant.asBoolean(),
                    node.path("reason").asText(""),
                    node.path("confidence").asDouble(0.0));
            log.info("{}: relevant={} ({})", sourceFile, verdict.relevant(), verdict.reason());
            return verdict;
        } catch (Exception e) {
            log.warn("{}: relevance check failed, keeping document: {}", sourceFile, e.getMessage());
            return RelevanceVerdict.keep("keyword '" + matched + "' matched, relevance check failed");
        }
    }

    private String firstKeyword(List<DocumentFragment> fragments) {
        if (keywords.isEmpty()) {
            return "*";
        }
        for (DocumentFragment fragment : fragments) {
            String text = fragment.rawText().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    return keyword;
                }
            }
        }
        return null;
    }

    private static String sample(List<DocumentFragment> fragments) {
        String joined = fragments.stream()
                .limit(SAMPLE_FRAGMENTS)
                .map(DocumentFragment::rawText)
                .collect(Collectors.joining("\n\n"));
        return joined.length() > SAMPLE_CHARS ? joined.substring(0, SAMPLE_CHARS) : joined;
    }
}
