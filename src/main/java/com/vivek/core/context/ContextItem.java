package com.vivek.core.context;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * An append-only fact in the context store.
 *
 * @param sequence  append index, strictly increasing within a store
 * @param content   free text
 * @param category  kind of fact
 * @param tags      normalized tags
 * @param parentId  id of the owning session, activity or task (nullable)
 * @param createdAt append time
 */
public record ContextItem(
    long sequence,
    String content,
    ContextCategory category,
    List<String> tags,
    String parentId,
    Instant createdAt
) {
    public ContextItem {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean sharesTag(Set<String> normalizedTags) {
        for (String tag : tags) {
            if (normalizedTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
