package com.eainde.specmap.exception;

/**
 * A model call failed for a reason other than rate limiting.
 */
public class LlmCallException extends SpecMapException {

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
