package com.eainde.specmap.translation;

import com.eainde.specmap.exception.LlmCallException;
import com.eainde.specmap.exception.RateLimitExhaustedException;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.llm.RetryPolicy;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.TranslatedFragment;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brings every fragment into the working language.
 *
 * <h3>Flow per fragment:</h3>
 * <pre>
 * detect language ─┬─ working language ──────────────► NATIVE (raw text)
 *                  └─ other ─► cache hit? ─ yes ─────► TRANSLATED (cached text)
 *                                        └─ no ─► LLM (retry/backoff)
 *                                                  ├─ ok ────────► TRANSLATED (+ cache put)
 *                                                  └─ exhausted ─► FAILED (raw text kept)
 * </pre>
 *
 * <p>The original fragment always travels with the result. Concurrent fragments with identical
 * text share one in-flight call.</p>
 */
@Slf4j
public class LanguageNormalizer {

    private static final String PROMPT = "translation.txt";

    private final LanguageDetector detector;
    private final TranslationCache cache;
    private final LlmGateway gateway;
    private final RetryPolicy retryPolicy;
    private final PromptLoader prompts;
    private final String workingLanguage;
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public LanguageNormalizer(LanguageDetector detector,
                              TranslationCache cache,
                              LlmGateway gateway,
                              RetryPolicy retryPolicy,
                              PromptLoader prompts,
                              String workingLanguage) {
        this.detector = detector;
        this.cache = cache;
        this.gateway = gateway;
        this.retryPolicy = retryPolicy;
        this.prompts = prompts;
        this.workingLanguage = workingLanguage;
    }

    public TranslatedFragment normalize(DocumentFragment fragment) {
        String language = fragment.detectedLanguage() != null
                ? fragment.detectedLanguage()
                : detector.detect(fragment.rawText());
        DocumentFragment detected = fragment.withDetectedLanguage(language);

        if (workingLanguage.equalsIgnoreCase(language)) {
            return TranslatedFragment.nativeText(detected);
        }

        String key = TranslationCache.keyOf(detected.rawText(), workingLanguage);
        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Translation cache hit for {}", detected.key());
            return TranslatedFragment.translated(detected, cached.get());
        }

        CompletableFuture<String> call = new CompletableFuture<>();
        CompletableFuture<String> running = inFlight.putIfAbsent(key, call);
        if (running != null) {
            log.debug("Identical text already being translated, waiting for it: {}", detected.key());
            return await(detected, running);
        }
        try {
            // the previous owner may have filled the cache between our miss and putIfAbsent
            Optional<String> late = cache.get(key);
            String translated;
            if (late.isPresent()) {
                translated = late.get();
            } else {
                translated = retryPolicy.execute(
                        "Translate " + detected.key(),
                        () -> translate(detected.rawText(), language),
                        LanguageNormalizer::isRetryable);
                cache.put(key, detected.rawText(), translated);
                log.info("Translated {} from {} ({} chars)", detected.key(), language, translated.length());
            }
            call.complete(translated);
            return TranslatedFragment.translated(detected, translated);
        } catch (RuntimeException e) {
            call.completeExceptionally(e);
            log.warn("Translation failed for {}, continuing with original text: {}", detected.key(), e.getMessage());
            return TranslatedFragment.failed(detected);
        } finally {
            inFlight.remove(key, call);
        }
    }

    private static TranslatedFragment await(DocumentFragment detected, CompletableFuture<String> running) {
        try {
            return TranslatedFragment.translated(detected, running.join());
        } catch (CompletionException | CancellationException e) {
            log.warn("Translation failed for {}, continuing with original text: {}", detected.key(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return TranslatedFragment.failed(detected);
        }
    }

    private String translate(String text, String sourceLanguage) {
        String system = prompts.render(PROMPT, Map.of(
                "sourceLanguage", detector.displayName(sourceLanguage),
                "targetLanguage", detector.displayName(workingLanguage)));
        List<ChatMessage> messages = List.of(SystemMessage.from(system), UserMessage.from(text));
        String result = gateway.complete(messages);
        if (result.isBlank()) {
            throw new LlmCallException("Empty translation returned", null);
        }
        return result;
    }

    /** Rate-limit exhaustion already waited out the gateway ceiling; everything else is retried. */
    private static boolean isRetryable(Exception e) {
        return !(e instanceof RateLimitExhaustedException);
    }
}
