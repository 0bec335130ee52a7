package com.vivek.core.retrieval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagNormalizerTest {

    private TagNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = TagNormalizer.withDefaults();
    }

    @Test
    @DisplayName("built-in synonyms map to their canonical key")
    void builtInSynonyms() {
        assertEquals("auth", normalizer.normalize("jwt"));
        assertEquals("auth", normalizer.normalize("bearer-token"));
        assertEquals("kafka", normalizer.normalize("message-queue"));
        assertEquals("error", normalizer.normalize("exception"));
        assertEquals("log", normalizer.normalize("tracing"));
    }

    @Test
    @DisplayName("case and surrounding whitespace are ignored")
    void caseAndWhitespace() {
        assertEquals("auth", normalizer.normalize("  JWT "));
        assertEquals("auth", normalizer.normalize("Authentication"));
        assertEquals("redis", normalizer.normalize(" Redis"));
    }

    @Test
    void nullAndBlankBecomeEmpty() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize("   "));
    }

    @Test
    void unknownTagsPassThrough() {
        assertEquals("graphql", normalizer.normalize("GraphQL"));
    }

    @Test
    @DisplayName("file tags keep the case of their path")
    void fileTagsAreCaseSensitive() {
        assertEquals("file:src/App.java", normalizer.normalize(" FILE: src/App.java "));
        assertNotEquals(normalizer.normalize("file:src/Login.java"), normalizer.normalize("file:src/login.java"));
        assertEquals("file:src/App.java", normalizer.normalize(normalizer.normalize("File:src/App.java")));
    }

    @Test
    @DisplayName("normalize is idempotent for vocabulary entries and arbitrary strings")
    void idempotent() {
        var inputs = new ArrayList<String>(Arrays.asList(null, "", " ", "AUTH", "Jwt", "logging ", "x", "İstanbul"));
        TagNormalizer.BUILT_IN.forEach((canonical, synonyms) -> {
            inputs.add(canonical);
            inputs.addAll(synonyms);
        });
        var random = new Random(42);
        String alphabet = "abcdeJWTKLog- _:./";
        for (int i = 0; i < 500; i++) {
            var sb = new StringBuilder();
            int len = random.nextInt(12);
            for (int j = 0; j < len; j++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            inputs.add(sb.toString());
        }

        for (String input : inputs) {
            String once = normalizer.normalize(input);
            assertEquals(once, normalizer.normalize(once), () -> "not idempotent for '" + input + "'");
        }
    }

    @Test
    @DisplayName("configured synonyms extend the vocabulary")
    void extraSynonyms() {
        var custom = new TagNormalizer(Map.of("db", List.of("Database", "sql"), "auth", List.of("oauth")));
        assertEquals("db", custom.normalize("database"));
        assertEquals("auth", custom.normalize("OAuth"));
        assertEquals("auth", custom.normalize("jwt"));
        assertTrue(custom.isCanonical("db"));
    }

    @Test
    @DisplayName("a canonical key may not also be a synonym")
    void canonicalAsSynonymRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TagNormalizer(Map.of("security", List.of("auth"))));
    }

    @Test
    @DisplayName("a synonym may not map to two canonical keys")
    void ambiguousSynonymRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TagNormalizer(Map.of("token", List.of("jwt"))));
    }

    @Test
    void relatedTags() {
        assertEquals(Set.of("authentication", "jwt", "bearer-token"), normalizer.relatedTags("JWT"));
        assertEquals(Set.of(), normalizer.relatedTags("unknown"));
    }

    @Test
    void normalizeAllDropsBlanksAndDuplicates() {
        assertEquals(List.of("auth", "kafka"),
                List.copyOf(normalizer.normalizeAll(Arrays.asList("jwt", "", null, "auth", "messaging"))));
    }

    @Test
    void bindsFromProperties() {
        var properties = new RetrievalProperties();
        properties.setSynonyms(Map.of("cache", List.of("redis")));
        assertEquals("cache", new TagNormalizer(properties).normalize("Redis"));
    }
}
