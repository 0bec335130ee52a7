package com.vivek.core.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "vivek.retrieval")
public class RetrievalProperties {

    private boolean semanticEnabled = false;
    private int maxResults = 5;
    private double minScore = 0.0;
    private int promptTokenBudget = 2000;
    private long embeddingCacheSize = 1000;

    /** Extra synonyms, keyed by canonical tag. Merged into the built-in vocabulary. */
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    public boolean isSemanticEnabled() {
        return semanticEnabled;
    }

    public void setSemanticEnabled(boolean semanticEnabled) {
        this.semanticEnabled = semanticEnabled;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getPromptTokenBudget() {
        return promptTokenBudget;
    }

    public void setPromptTokenBudget(int promptTokenBudget) {
        this.promptTokenBudget = promptTokenBudget;
    }

    public long getEmbeddingCacheSize() {
        return embeddingCacheSize;
    }

    public void setEmbeddingCacheSize(long embeddingCacheSize) {
        this.embeddingCacheSize = embeddingCacheSize;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms;
    }
}
