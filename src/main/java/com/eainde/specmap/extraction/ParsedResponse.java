package com.eainde.specmap.extraction;

import java.util.List;

/**
 * Tagged result of validating an extraction response: either every record was accepted,
 * or the response was rejected with the reasons.
 */
public record ParsedResponse(List<ExtractedRecord> records, List<String> violations) {

    public ParsedResponse {
        records = List.copyOf(records);
        violations = List.copyOf(violations);
    }

    public static ParsedResponse accepted(List<ExtractedRecord> records) {
        return new ParsedResponse(records, List.of());
    }

    public static ParsedResponse rejected(List<String> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A rejected response needs at least one violation");
        }
        return new ParsedResponse(List.of(), violations);
    }

    public boolean isAccepted() {
        return violations.isEmpty();
    }
}
