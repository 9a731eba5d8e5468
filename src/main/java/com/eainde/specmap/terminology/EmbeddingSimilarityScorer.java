package com.eainde.specmap.terminology;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Semantic similarity via sentence embeddings (cosine, clamped to [0,1]).
 * Embeddings are memoized per folded name for the lifetime of the scorer.
 */
public class EmbeddingSimilarityScorer implements SimilarityScorer {

    private final EmbeddingModel embeddingModel;
    private final Map<String, Embedding> embeddings = new ConcurrentHashMap<>();

    public EmbeddingSimilarityScorer(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

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
        double cosine = CosineSimilarity.between(embed(x), embed(y));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    private Embedding embed(String text) {
        return embeddings.computeIfAbsent(text, t -> embeddingModel.embed(t).content());
    }
}
