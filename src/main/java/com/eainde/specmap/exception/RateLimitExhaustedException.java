package com.eainde.specmap.exception;

/**
 * The provider kept signalling rate limits past the configured backoff ceiling.
 */
public class RateLimitExhaustedException extends LlmCallException {

    private final int attempts;

    public RateLimitExhaustedException(int attempts, Throwable cause) {
        super("Rate limit persisted after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
