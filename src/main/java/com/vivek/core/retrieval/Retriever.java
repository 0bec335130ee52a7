package com.vivek.core.retrieval;

import com.vivek.core.context.ContextItem;
import com.vivek.core.context.ContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks stored context items against a query of tags and a free-text description.
 *
 * <p>Tag score is the fraction of distinct normalized query tags present on an item. When a
 * {@link SemanticScorer} is configured and semantic retrieval is enabled, the final score is
 * the mean of the tag score and the semantic score. Only items sharing at least one normalized
 * tag are considered; an empty tag query skips that filter in semantic mode and returns
 * nothing otherwise. Results are sorted by score, then by recency.
 */
@Service
public class Retriever {

    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    private static final Comparator<ScoredItem> RANKING =
            Comparator.comparingDouble(ScoredItem::score).reversed()
                    .thenComparing(Comparator.comparingLong((ScoredItem s) -> s.item().sequence()).reversed());

    private final TagNormalizer tagNormalizer;
    private final RetrievalProperties properties;
    private final SemanticScorer semanticScorer;

    public Retriever(TagNormalizer tagNormalizer, RetrievalProperties properties,
                     Optional<SemanticScorer> semanticScorer) {
        this.tagNormalizer = tagNormalizer;
        this.properties = properties;
        this.semanticScorer = semanticScorer.orElse(null);
    }

    public boolean semanticMode() {
        return properties.isSemanticEnabled() && semanticScorer != null;
    }

    public List<ScoredItem> retrieve(ContextStore store, Collection<String> queryTags, String queryDescription) {
        return retrieve(store, queryTags, queryDescription, properties.getMaxResults());
    }

    /**
     * @return at most {@code maxResults} items, best first
     */
    public List<ScoredItem> retrieve(ContextStore store, Collection<String> queryTags, String queryDescription,
                                     int maxResults) {
        if (maxResults <= 0) {
            return List.of();
        }
        Set<String> query = tagNormalizer.normalizeAll(queryTags);
        boolean semantic = semanticMode();
        if (query.isEmpty() && !semantic) {
            log.debug("No query tags and semantic scoring disabled; nothing to retrieve");
            return List.of();
        }

        List<ContextItem> candidates = query.isEmpty() ? store.allItems() : store.getItemsByTags(query);
        var scored = new ArrayList<ScoredItem>(candidates.size());
        for (ContextItem item : candidates) {
            double tagScore = tagScore(query, item);
            double score = tagScore;
            if (semantic) {
                double semanticScore = semanticScorer.score(queryDescription, item);
                score = (tagScore + semanticScore) / 2.0;
            }
            if (score >= properties.getMinScore()) {
                scored.add(new ScoredItem(item, score));
            }
        }
        scored.sort(RANKING);
        var results = scored.size() > maxResults ? List.copyOf(scored.subList(0, maxResults)) : List.copyOf(scored);
        log.debug("Retrieved {} of {} candidates for tags {} (semantic={})",
                results.size(), candidates.size(), query, semantic);
        return results;
    }

    static double tagScore(Set<String> normalizedQuery, ContextItem item) {
        int present = 0;
        for (String tag : normalizedQuery) {
            if (item.tags().contains(tag)) {
                present++;
            }
        }
        return (double) present / Math.max(normalizedQuery.size(), 1);
    }
}
