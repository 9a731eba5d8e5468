package com.eainde.specmap.llm;

import dev.langchain4j.exception.RateLimitException;

import java.util.Locale;

/**
 * Recognises provider rate-limit signals in exceptions thrown by model clients.
 */
public final class RateLimitSignals {

    private RateLimitSignals() {}

    public static boolean isRateLimit(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String m = message.toLowerCase(Locale.ROOT);
                if (m.contains("429") || m.contains("resource_exhausted")
                        || m.contains("rate limit") || m.contains("quota exceeded")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
