package com.eainde.specmap.exception;

/**
 * Fatal setup problem (missing credentials, missing template, unreadable input folder).
 * Thrown before any fragment work starts and aborts the run.
 */
public class ConfigurationException extends SpecMapException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
