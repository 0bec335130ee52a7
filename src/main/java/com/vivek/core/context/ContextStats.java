package com.vivek.core.context;

import java.util.Map;

/**
 * Record and item counts of a context store.
 */
public record ContextStats(
    int sessions,
    int activities,
    int tasks,
    int items,
    Map<ContextCategory, Long> itemsByCategory
) {
    public ContextStats {
        itemsByCategory = itemsByCategory != null ? Map.copyOf(itemsByCategory) : Map.of();
    }
}
