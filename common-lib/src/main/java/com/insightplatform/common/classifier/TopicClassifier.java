package com.insightplatform.common.classifier;

import com.insightplatform.common.text.QueryNormalizer;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Greedy longest-match topic classifier for normalized queries.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>longest store-specific entity name (e.g. winery) of at least
 *       {@value #MIN_ENTITY_LENGTH} characters contained in the query</li>
 *   <li>longest global varietal contained in the query; equal lengths resolve
 *       to the earlier entry of {@link #TAXONOMY}</li>
 *   <li>{@link #OTHER}</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class TopicClassifier {

    public static final String OTHER = "other";

    static final int MIN_ENTITY_LENGTH = 3;

    /** Declaration order breaks ties between equal-length matches. */
    public static final List<String> TAXONOMY = List.of(
        "cabernet sauvignon",
        "cabernet",
        "pinot noir",
        "pinot",
        "chardonnay",
        "sauvignon blanc",
        "syrah",
        "shiraz",
        "merlot",
        "riesling",
        "malbec",
        "nebbiolo",
        "sangiovese",
        "grenache",
        "tempranillo",
        "zinfandel",
        "rosé",
        "rose",
        "sparkling",
        "prosecco",
        "champagne"
    );

    private static final List<String> NORMALIZED_TAXONOMY = TAXONOMY.stream()
        .map(QueryNormalizer::normalize)
        .distinct()
        .collect(Collectors.toUnmodifiableList());

    private TopicClassifier() {}

    /**
     * @param query          query text; normalized again here, so raw input is accepted
     * @param knownEntities  store-specific names such as wineries; may be {@code null}
     * @return topic key, never {@code null}
     */
    public static String classify(String query, Collection<String> knownEntities) {
        String q = QueryNormalizer.normalize(query);
        if (q.isEmpty()) {
            return OTHER;
        }

        // ── store entities ────────────────────────────────────────────────
        if (knownEntities != null) {
            String entity = knownEntities.stream()
                .filter(Objects::nonNull)
                .map(QueryNormalizer::normalize)
                .filter(e -> e.length() >= MIN_ENTITY_LENGTH && q.contains(e))
                .max(Comparator.comparingInt(String::length))
                .orElse(null);
            if (entity != null) {
                return entity;
            }
        }

        // ── global taxonomy ───────────────────────────────────────────────
        String best = null;
        for (String topic : NORMALIZED_TAXONOMY) {
            if (q.contains(topic) && (best == null || topic.length() > best.length())) {
                best = topic;
            }
        }
        return best != null ? best : OTHER;
    }
}
