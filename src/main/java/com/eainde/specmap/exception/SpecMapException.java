package com.eainde.specmap.exception;

/**
 * Root of the application's unchecked exceptions.
 */
public class SpecMapException extends RuntimeException {

    public SpecMapException(String message) {
        super(message);
    }

    public SpecMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
