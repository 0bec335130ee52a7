package com.vivek.core.iteration;

import com.vivek.core.context.ContextCategory;
import com.vivek.core.context.ContextStore;
import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.FileStatus;
import com.vivek.core.model.WorkItem;
import com.vivek.core.retrieval.RetrievalProperties;
import com.vivek.core.retrieval.Retriever;
import com.vivek.core.retrieval.TagNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private RetrievalProperties properties;
    private PromptBuilder builder;
    private ContextStore store;
    private WorkItem item;

    @BeforeEach
    void setUp() {
        var normalizer = TagNormalizer.withDefaults();
        properties = new RetrievalProperties();
        builder = new PromptBuilder(new Retriever(normalizer, properties, Optional.empty()), properties);
        store = new ContextStore(normalizer);
        item = new WorkItem("ITEM-001", "src/Auth.java", FileStatus.EXISTING, ExecutionMode.CODER,
                "Add JWT validation", List.of(), List.of("jwt"), "java");
        store.createSession("S1", "Secure the API", "1. JWT filter");
        store.createActivity("S1/coder", "S1", "coder", List.of(), "coder", "", "");
        store.createTask("ITEM-001", "S1/coder", item.description(), item.effectiveTags());
    }

    @Test
    void includesRequestAndWorkItem() {
        var prompt = builder.build(item, store, store.cursor());

        assertTrue(prompt.text().startsWith("=== REQUEST ===\nSecure the API\nPlan:\n1. JWT filter\n"));
        assertTrue(prompt.text().contains("File: src/Auth.java (existing)\n"));
        assertTrue(prompt.text().contains("Mode: coder\n"));
        assertTrue(prompt.text().contains("Language: java\n"));
        assertTrue(prompt.text().contains("Description: Add JWT validation\n"));
        assertFalse(prompt.text().contains("RELEVANT HISTORY"));
        assertTrue(prompt.history().isEmpty());
        assertEquals(TokenEstimator.estimate(prompt.text()), prompt.estimatedTokens());
    }

    @Test
    void appendsRankedHistory() {
        store.addItem("Prefer RS256 keys", ContextCategory.DECISION, List.of("auth"), "ITEM-001");
        store.addItem("Kafka is unrelated", ContextCategory.LEARNING, List.of("kafka"), "ITEM-001");

        var prompt = builder.build(item, store, store.cursor());

        assertTrue(prompt.text().contains("=== RELEVANT HISTORY ===\n[1] (decision, score 0.33)\nPrefer RS256 keys\n"));
        assertFalse(prompt.text().contains("Kafka"));
        assertEquals(1, prompt.history().size());
    }

    @Test
    void stopsAtTokenBudget() {
        for (int i = 0; i < 5; i++) {
            store.addItem("note " + i + " " + "word ".repeat(50), ContextCategory.LEARNING, List.of("auth"), "ITEM-001");
        }
        int base = TokenEstimator.estimate(builder.build(item, store, store.cursor()).text());
        properties.setPromptTokenBudget(0);
        var header = builder.build(item, store, store.cursor());
        assertTrue(header.history().isEmpty());

        properties.setPromptTokenBudget(TokenEstimator.estimate(header.text()) + 160);
        var limited = builder.build(item, store, store.cursor());
        assertEquals(2, limited.history().size());
        assertTrue(limited.estimatedTokens() <= properties.getPromptTokenBudget());
        assertTrue(base > limited.estimatedTokens());
    }

    @Test
    void deterministic() {
        store.addItem("Prefer RS256 keys", ContextCategory.DECISION, List.of("auth"), "ITEM-001");
        assertEquals(builder.build(item, store, store.cursor()), builder.build(item, store, store.cursor()));
    }
}
