package com.eainde.specmap.llm;

import com.eainde.specmap.exception.LlmCallException;
import com.eainde.specmap.exception.RateLimitExhaustedException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Single door for every outbound model call.
 *
 * <p>Each call is admitted by the shared {@link RateLimitGovernor}. Rate-limit signals are
 * not failures here: the gateway backs off per {@code rateLimitBackoff} and resends the same
 * request, and only when that ceiling is exhausted throws {@link RateLimitExhaustedException}.
 * Any other failure is thrown immediately as {@link LlmCallException}; retrying those is the
 * caller's decision.</p>
 */
public class LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmGateway.class);

    private final ChatModel chatModel;
    private final RateLimitGovernor governor;
    private final RetryPolicy rateLimitBackoff;

    public LlmGateway(ChatModel chatModel, RateLimitGovernor governor, RetryPolicy rateLimitBackoff) {
        this.chatModel = chatModel;
        this.governor = governor;
        this.rateLimitBackoff = rateLimitBackoff;
    }

    /** Plain-text completion. */
    public String complete(List<ChatMessage> messages) {
        return send(ChatRequest.builder().messages(messages).build());
    }

    /** Completion constrained to JSON output. */
    public String completeJson(List<ChatMessage> messages) {
        return send(ChatRequest.builder()
                .messages(messages)
                .responseFormat(ResponseFormat.JSON)
                .build());
    }

    private String send(ChatRequest request) {
        int ceiling = rateLimitBackoff.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return callOnce(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmCallException("Interrupted while waiting for model admission", e);
            } catch (RuntimeException e) {
                if (!RateLimitSignals.isRateLimit(e)) {
                    throw e instanceof LlmCallException lce ? lce : new LlmCallException("Model call failed: " + e.getMessage(), e);
                }
                if (attempt >= ceiling) {
                    log.error("Rate limit persisted after {} attempts, giving up on this request", attempt);
                    throw new RateLimitExhaustedException(attempt, e);
                }
                Duration delay = rateLimitBackoff.delayAfterAttempt(attempt);
                log.warn("Rate limited (attempt {}/{}), backing off {} ms", attempt, ceiling, delay.toMillis());
                governor.penalize(delay);
                if (!rateLimitBackoff.backoff(attempt)) {
                    throw new LlmCallException("Interrupted during rate-limit backoff", e);
                }
            }
        }
    }

    private String callOnce(ChatRequest request) throws InterruptedException {
        governor.acquire();
        try {
            ChatResponse response = chatModel.chat(request);
            if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
                throw new LlmCallException("Model returned no text", null);
            }
            return response.aiMessage().text().strip();
        } finally {
            governor.release();
        }
    }
}
