package com.vivek.core.iteration;

import com.vivek.core.context.ContextCursor;
import com.vivek.core.context.ContextStore;
import com.vivek.core.model.WorkItem;
import com.vivek.core.retrieval.RetrievalProperties;
import com.vivek.core.retrieval.Retriever;
import com.vivek.core.retrieval.ScoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Assembles the generation prompt for a work item: the session request, the item header and
 * description, then retrieved history in rank order for as long as the token budget allows.
 * Output depends only on the inputs; no clock or randomness is involved.
 */
@Component
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    public record Prompt(String text, List<ScoredItem> history, int estimatedTokens) {}

    private final Retriever retriever;
    private final RetrievalProperties properties;

    public PromptBuilder(Retriever retriever, RetrievalProperties properties) {
        this.retriever = retriever;
        this.properties = properties;
    }

    public Prompt build(WorkItem item, ContextStore store, ContextCursor cursor) {
        var text = new StringBuilder();

        store.getSession(cursor.sessionId()).ifPresent(session -> {
            text.append("=== REQUEST ===\n");
            text.append(session.originalRequest()).append('\n');
            if (!session.highLevelPlan().isBlank()) {
                text.append("Plan:\n").append(session.highLevelPlan()).append('\n');
            }
            text.append('\n');
        });

        text.append("=== WORK ITEM ===\n");
        text.append("File: ").append(item.filePath())
                .append(" (").append(item.fileStatus().name().toLowerCase(Locale.ROOT)).append(")\n");
        text.append("Mode: ").append(item.mode().label()).append('\n');
        if (!item.language().isBlank()) {
            text.append("Language: ").append(item.language()).append('\n');
        }
        text.append("Description: ").append(item.description()).append('\n');

        int budget = properties.getPromptTokenBudget();
        int tokens = TokenEstimator.estimate(text.toString());
        var included = new ArrayList<ScoredItem>();
        List<ScoredItem> ranked = retriever.retrieve(store, item.effectiveTags(), item.description());
        if (!ranked.isEmpty()) {
            var history = new StringBuilder("\n=== RELEVANT HISTORY ===\n");
            tokens += TokenEstimator.estimate(history.toString());
            for (ScoredItem scored : ranked) {
                String entry = "[" + (included.size() + 1) + "] ("
                        + scored.item().category().label() + ", score "
                        + String.format(Locale.ROOT, "%.2f", scored.score()) + ")\n"
                        + scored.item().content() + '\n';
                int entryTokens = TokenEstimator.estimate(entry);
                if (tokens + entryTokens > budget) {
                    log.debug("Prompt budget {} reached after {} history entries", budget, included.size());
                    break;
                }
                history.append(entry);
                tokens += entryTokens;
                included.add(scored);
            }
            if (!included.isEmpty()) {
                text.append(history);
            }
        }
        return new Prompt(text.toString(), List.copyOf(included), TokenEstimator.estimate(text.toString()));
    }
}
