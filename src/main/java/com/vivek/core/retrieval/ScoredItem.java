package com.vivek.core.retrieval;

import com.vivek.core.context.ContextItem;

/**
 * A retrieved context item with its relevance score in [0, 1].
 */
public record ScoredItem(ContextItem item, double score) {}
