package com.vivek.core.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vivek.core.context.ContextItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Semantic scorer backed by a Spring AI {@link EmbeddingModel}.
 *
 * <p>Cosine similarity of the query and item embeddings is mapped to [0, 1] via
 * {@code (cos + 1) / 2}. Embeddings are kept in a Caffeine cache keyed by text and bounded to
 * {@code vivek.retrieval.embedding-cache-size} entries.
 * An embedding failure degrades the item to a semantic score of 0.0 and is logged.
 */
@Component
@ConditionalOnProperty(prefix = "vivek.retrieval", name = "semantic-enabled", havingValue = "true")
public class EmbeddingSemanticScorer implements SemanticScorer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSemanticScorer.class);

    private final EmbeddingModel embeddingModel;
    private final Cache<String, float[]> cache;

    @Autowired
    public EmbeddingSemanticScorer(EmbeddingModel embeddingModel, RetrievalProperties properties) {
        this(embeddingModel, properties.getEmbeddingCacheSize());
    }

    public EmbeddingSemanticScorer(EmbeddingModel embeddingModel, long maxCachedEmbeddings) {
        if (maxCachedEmbeddings < 0) {
            throw new IllegalArgumentException("maxCachedEmbeddings must not be negative, got " + maxCachedEmbeddings);
        }
        this.embeddingModel = embeddingModel;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCachedEmbeddings)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public double score(String queryDescription, ContextItem item) {
        if (queryDescription == null || queryDescription.isBlank() || item.content().isBlank()) {
            return 0.0;
        }
        try {
            float[] query = embed(queryDescription);
            float[] candidate = embed(item.content());
            double cosine = cosine(query, candidate);
            return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
        } catch (RuntimeException e) {
            log.warn("Embedding failed for context item #{}; using semantic score 0.0", item.sequence(), e);
            return 0.0;
        }
    }

    long cachedEmbeddings() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private float[] embed(String text) {
        return cache.get(text, embeddingModel::embed);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
