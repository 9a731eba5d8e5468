package com.eainde.specmap.exception;

import java.util.List;

/**
 * The model answered, but the payload failed schema validation.
 */
public class MalformedResponseException extends SpecMapException {

    private final List<String> violations;

    public MalformedResponseException(List<String> violations) {
        super("Model response rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
