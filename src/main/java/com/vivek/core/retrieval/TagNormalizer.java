package com.vivek.core.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps free-form tags onto a controlled vocabulary so that "jwt" and "auth" retrieve the
 * same history.
 *
 * <p>Normalization lower-cases (root locale), trims, then replaces a known synonym with its
 * canonical key. Unknown tags pass through. The vocabulary is checked on construction so that
 * no canonical key is also a synonym, which keeps {@link #normalize(String)} idempotent.
 *
 * <p>File tags ({@value #FILE_PREFIX}&lt;path&gt;) only have their prefix lower-cased; paths are
 * case-sensitive, so {@code src/Login.java} and {@code src/login.java} stay apart.
 */
@Component
public class TagNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TagNormalizer.class);

    public static final String FILE_PREFIX = "file:";

    static final Map<String, List<String>> BUILT_IN = builtIn();

    private final Map<String, Set<String>> vocabulary;
    private final Map<String, String> synonymToCanonical;

    @Autowired
    public TagNormalizer(RetrievalProperties properties) {
        this(properties.getSynonyms());
    }

    public TagNormalizer(Map<String, List<String>> extraSynonyms) {
        var merged = new LinkedHashMap<String, Set<String>>();
        BUILT_IN.forEach((canonical, synonyms) -> merged.put(canonical, new LinkedHashSet<>(synonyms)));
        if (extraSynonyms != null) {
            extraSynonyms.forEach((canonical, synonyms) -> {
                String key = clean(canonical);
                if (key.isEmpty()) {
                    throw new IllegalArgumentException("Canonical tag must not be blank");
                }
                var target = merged.computeIfAbsent(key, k -> new LinkedHashSet<>());
                if (synonyms != null) {
                    synonyms.stream().map(TagNormalizer::clean).filter(s -> !s.isEmpty()).forEach(target::add);
                }
            });
        }

        var reverse = new HashMap<String, String>();
        merged.forEach((canonical, synonyms) -> {
            for (String synonym : synonyms) {
                if (merged.containsKey(synonym)) {
                    throw new IllegalArgumentException(
                            "Tag '" + synonym + "' is both a canonical key and a synonym of '" + canonical + "'");
                }
                String previous = reverse.putIfAbsent(synonym, canonical);
                if (previous != null && !previous.equals(canonical)) {
                    throw new IllegalArgumentException(
                            "Synonym '" + synonym + "' maps to both '" + previous + "' and '" + canonical + "'");
                }
            }
        });

        merged.replaceAll((k, v) -> Set.copyOf(v));
        this.vocabulary = Map.copyOf(merged);
        this.synonymToCanonical = Map.copyOf(reverse);
        log.debug("Tag vocabulary: {} canonical tags, {} synonyms", vocabulary.size(), synonymToCanonical.size());
    }

    /** Normalizer with the built-in vocabulary only. */
    public static TagNormalizer withDefaults() {
        return new TagNormalizer(Map.of());
    }

    /**
     * Canonical form of a tag; {@code ""} for null or blank input.
     */
    public String normalize(String tag) {
        String trimmed = tag == null ? "" : tag.trim();
        if (trimmed.regionMatches(true, 0, FILE_PREFIX, 0, FILE_PREFIX.length())) {
            return FILE_PREFIX + trimmed.substring(FILE_PREFIX.length()).trim();
        }
        String cleaned = clean(trimmed);
        if (cleaned.isEmpty()) {
            return "";
        }
        return synonymToCanonical.getOrDefault(cleaned, cleaned);
    }

    /**
     * Normalizes every tag, dropping blanks and duplicates while keeping first-seen order.
     */
    public Set<String> normalizeAll(Collection<String> tags) {
        var result = new LinkedHashSet<String>();
        if (tags == null) {
            return result;
        }
        for (String tag : tags) {
            String n = normalize(tag);
            if (!n.isEmpty()) {
                result.add(n);
            }
        }
        return result;
    }

    /**
     * Synonyms of the tag's canonical key, empty when the tag is outside the vocabulary.
     */
    public Set<String> relatedTags(String tag) {
        return vocabulary.getOrDefault(normalize(tag), Set.of());
    }

    public boolean isCanonical(String tag) {
        return vocabulary.containsKey(clean(tag));
    }

    private static String clean(String tag) {
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<String>> builtIn() {
        var map = new LinkedHashMap<String, List<String>>();
        map.put("auth", List.of("authentication", "jwt", "bearer-token"));
        map.put("kafka", List.of("kafka-client", "message-queue", "messaging"));
        map.put("error", List.of("error-handling", "exception", "fault-tolerance"));
        map.put("log", List.of("logging", "audit", "tracing"));
        return java.util.Collections.unmodifiableMap(map);
    }
}
