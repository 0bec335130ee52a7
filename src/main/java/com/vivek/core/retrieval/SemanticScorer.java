package com.vivek.core.retrieval;

import com.vivek.core.context.ContextItem;

/**
 * Scores the semantic closeness of a query description and a context item.
 */
public interface SemanticScorer {

    /**
     * @return similarity in [0, 1]; implementations return 0.0 when scoring is unavailable
     */
    double score(String queryDescription, ContextItem item);
}
