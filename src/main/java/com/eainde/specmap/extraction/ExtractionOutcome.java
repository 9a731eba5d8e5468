package com.eainde.specmap.extraction;

import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentKey;

import java.util.List;

/**
 * Per-fragment extraction result. A failed outcome carries no instances.
 */
public record ExtractionOutcome(FragmentKey fragmentKey, List<ExtractedSpecInstance> instances, String failureReason) {

    public ExtractionOutcome {
        instances = List.copyOf(instances);
    }

    public static ExtractionOutcome success(FragmentKey key, List<ExtractedSpecInstance> instances) {
        return new ExtractionOutcome(key, instances, null);
    }

    public static ExtractionOutcome failure(FragmentKey key, String reason) {
        return new ExtractionOutcome(key, List.of(), reason == null || reason.isBlank() ? "extraction failed" : reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
