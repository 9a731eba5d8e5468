package com.eainde.specmap.extraction;

import com.eainde.specmap.exception.MalformedResponseException;
import com.eainde.specmap.exception.RateLimitExhaustedException;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.llm.RetryPolicy;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentKey;
import com.eainde.specmap.model.TranslatedFragment;
import com.eainde.specmap.terminology.TermNormalizer;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured spec extraction from translated fragments.
 *
 * <h3>Per segment:</h3>
 * <pre>
 * system (instructions + few-shot + target vocabulary) + user (fragment text)
 *   → completeJson → ExtractionResponseParser
 *       accepted → records
 *       rejected → append model answer + corrective message, ask again
 *                  (at most maxCorrectiveAttempts times, then the fragment fails)
 * </pre>
 *
 * <p>Rate limiting is absorbed by {@link LlmGateway} and never touches the corrective budget.
 * Other call failures are retried by the {@link RetryPolicy}. Long fragments are split on line
 * boundaries so each request stays within {@code maxCharsPerRequest}. Results from all segments
 * are deduplicated by normalized name and value, keeping the highest confidence.</p>
 */
@Slf4j
public class SpecExtractionEngine {

    private static final String SYSTEM_PROMPT = "extraction-system.txt";
    private static final String USER_PROMPT = "extraction-user.txt";
    private static final String CORRECTIVE_PROMPT = "extraction-corrective.txt";

    private final LlmGateway gateway;
    private final ExtractionResponseParser parser;
    private final PromptLoader prompts;
    private final RetryPolicy retryPolicy;
    private final int maxCorrectiveAttempts;
    private final int maxCharsPerRequest;

    public SpecExtractionEngine(LlmGateway gateway,
                                ExtractionResponseParser parser,
                                PromptLoader prompts,
                                RetryPolicy retryPolicy,
                                int maxCorrectiveAttempts,
                                int maxCharsPerRequest) {
        if (maxCorrectiveAttempts < 0) {
            throw new IllegalArgumentException("maxCorrectiveAttempts must be >= 0");
        }
        if (maxCharsPerRequest < 1) {
            throw new IllegalArgumentException("maxCharsPerRequest must be >= 1");
        }
        this.gateway = gateway;
        this.parser = parser;
        this.prompts = prompts;
        this.retryPolicy = retryPolicy;
        this.maxCorrectiveAttempts = maxCorrectiveAttempts;
        this.maxCharsPerRequest = maxCharsPerRequest;
    }

    public ExtractionOutcome extract(TranslatedFragment fragment) {
        return extract(fragment, List.of());
    }

    /**
     * @param targetVocabulary names the model should prefer when reporting spec_name
     *                         (template labels and standard terms); may be empty
     */
    public ExtractionOutcome extract(TranslatedFragment fragment, Collection<String> targetVocabulary) {
        FragmentKey key = fragment.key();
        String system = prompts.render(SYSTEM_PROMPT, Map.of("targetVocabulary", vocabularyBlock(targetVocabulary)));

        List<ExtractedSpecInstance> instances = new ArrayList<>();
        List<String> segments = segment(fragment.translatedText(), maxCharsPerRequest);
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            String user = prompts.render(USER_PROMPT, Map.of(
                    "sourceFile", key.sourceFile(),
                    "location", key.locator().label(),
                    "text", segment));
            try {
                for (ExtractedRecord record : extractSegment(key, system, user)) {
                    instances.add(toInstance(key, record));
                }
            } catch (RuntimeException e) {
                log.warn("Extraction failed for {} (segment {}/{}): {}", key, i + 1, segments.size(), e.getMessage());
                return ExtractionOutcome.failure(key, e.getMessage());
            }
        }

        List<ExtractedSpecInstance> unique = deduplicate(instances);
        log.info("Extracted {} spec(s) from {}", unique.size(), key);
        return ExtractionOutcome.success(key, unique);
    }

    private List<ExtractedRecord> extractSegment(FragmentKey key, String system, String user) {
        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(SystemMessage.from(system));
        conversation.add(UserMessage.from(user));

        List<String> lastViolations = List.of();
        for (int attempt = 0; attempt <= maxCorrectiveAttempts; attempt++) {
            List<ChatMessage> request = List.copyOf(conversation);
            String response = retryPolicy.execute(
                    "Extract " + key,
                    () -> gateway.completeJson(request),
                    e -> !(e instanceof RateLimitExhaustedException));

            ParsedResponse parsed = parser.parse(response);
            if (parsed.isAccepted()) {
                return parsed.records();
            }

            lastViolations = parsed.violations();
            log.warn("Malformed extraction response for {} (attempt {}/{}): {}",
                    key, attempt + 1, maxCorrectiveAttempts + 1, lastViolations);
            conversation.add(AiMessage.from(response));
            conversation.add(UserMessage.from(prompts.render(CORRECTIVE_PROMPT,
                    Map.of("violations", String.join("\n- ", lastViolations)))));
        }
        throw new MalformedResponseException(lastViolations);
    }

    private static ExtractedSpecInstance toInstance(FragmentKey key, ExtractedRecord record) {
        return new ExtractedSpecInstance(
                key,
                record.specName(),
                record.value(),
                record.unit(),
                record.condition(),
                record.confidence(),
                record.sourceText());
    }

    /**
     * Collapses instances with the same normalized name and value, keeping the most confident.
     * Result is in source order.
     */
    static List<ExtractedSpecInstance> deduplicate(List<ExtractedSpecInstance> instances) {
        Map<String, ExtractedSpecInstance> best = new LinkedHashMap<>();
        for (ExtractedSpecInstance instance : instances) {
            String dedupeKey = TermNormalizer.normalize(instance.rawSpecName()) + "\u0000" + instance.value();
            best.merge(dedupeKey, instance, (a, b) -> b.confidence() > a.confidence() ? b : a);
        }
        List<ExtractedSpecInstance> result = new ArrayList<>(best.values());
        result.sort(ExtractedSpecInstance.SOURCE_ORDER);
        return result;
    }

    /**
     * Splits text into chunks of at most {@code maxChars}, breaking on line boundaries.
     * A single line longer than the window is cut hard.
     */
    static List<String> segment(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return List.of(text);
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : text.split("\\R")) {
            while (line.length() > maxChars) {
                flush(current, segments);
                segments.add(line.substring(0, maxChars));
                line = line.substring(maxChars);
            }
            int needed = current.length() == 0 ? line.length() : current.length() + 1 + line.length();
            if (needed > maxChars) {
                flush(current, segments);
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            current.append(line);
        }
        flush(current, segments);
        return segments;
    }

    private static void flush(StringBuilder current, List<String> segments) {
        if (current.length() > 0 && !current.toString().isBlank()) {
            segments.add(current.toString());
        }
        current.setLength(0);
    }

    private static String vocabularyBlock(Collection<String> vocabulary) {
        if (vocabulary == null || vocabulary.isEmpty()) {
            return "(none provided)";
        }
        return vocabulary.stream()
                .distinct()
                .sorted()
                .map(v -> "- " + v)
                .collect(Collectors.joining("\n"));
    }
}
