package com.eainde.specmap.terminology;

import java.util.Collection;

/**
 * Similarity between two spec names, in [0,1].
 */
public interface SimilarityScorer {

    double score(String a, String b);

    default double bestScore(String name, Collection<String> candidates) {
        double best = 0.0;
        for (String candidate : candidates) {
            best = Math.max(best, score(name, candidate));
        }
        return best;
    }
}
