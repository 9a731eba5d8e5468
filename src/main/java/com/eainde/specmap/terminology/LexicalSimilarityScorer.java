package com.eainde.specmap.terminology;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic string similarity: the better of token Jaccard and normalized Levenshtein over
 * folded names. Catches spelling variants ("Colour Temperature") and reordered words
 * ("Ratio Contrast") without any model call.
 */
public class LexicalSimilarityScorer implements SimilarityScorer {

    @Override
    public double score(String a, String b) {
        String x = TermNormalizer.fold(a);
        String y = TermNormalizer.fold(b);
        if (x.isEmpty() || y.isEmpty()) {
            return 0.0;
        }
        if (x.equals(y)) {
            return 1.0;
        }
        return Math.max(jaccard(x, y), levenshteinRatio(x, y));
    }

    static double jaccard(String x, String y) {
        Set<String> a = tokens(x);
        Set<String> b = tokens(y);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        a.retainAll(b);
        return (double) a.size() / union.size();
    }

    static double levenshteinRatio(String x, String y) {
        int max = Math.max(x.length(), y.length());
        return max == 0 ? 1.0 : 1.0 - (double) levenshtein(x, y) / max;
    }

    static int levenshtein(String x, String y) {
        int[] prev = new int[y.length() + 1];
        int[] curr = new int[y.length() + 1];
        for (int j = 0; j <= y.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= x.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= y.length(); j++) {
                int cost = x.charAt(i - 1) == y.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[y.length()];
    }

    private static Set<String> tokens(String s) {
        return Arrays.stream(s.split("[^\\p{L}\\p{N}]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }
}
